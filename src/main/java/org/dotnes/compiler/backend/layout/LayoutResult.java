package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.api.UnresolvedLabelException;
import org.dotnes.compiler.isa.LabelLookup;

import java.util.List;
import java.util.Map;

/**
 * Result of address resolution.
 *
 * @param baseAddress The address of the first block.
 * @param blockAddresses The address of the first byte of each block, in program order.
 * @param blockScopes The scope name used for each block's local labels, in program order.
 * @param labelToAddress All labels (local ones qualified) and their addresses.
 * @param totalSize The size of the code region in bytes.
 */
public record LayoutResult(
        int baseAddress,
        List<Integer> blockAddresses,
        List<String> blockScopes,
        Map<String, Integer> labelToAddress,
        int totalSize
) {

    public LayoutResult {
        blockAddresses = List.copyOf(blockAddresses);
        blockScopes = List.copyOf(blockScopes);
        labelToAddress = Map.copyOf(labelToAddress);
    }

    /**
     * @param label A global label.
     * @return Its address.
     * @throws UnresolvedLabelException if it is not defined.
     */
    public int addressOf(String label) throws UnresolvedLabelException {
        Integer address = labelToAddress.get(label);
        if (address == null) {
            throw new UnresolvedLabelException(label);
        }
        return address;
    }

    /**
     * @param blockIndex A block position.
     * @return A lookup that resolves labels as written inside that block.
     */
    public LabelLookup lookupFor(int blockIndex) {
        String scope = blockScopes.get(blockIndex);
        return label -> addressOf(LabelTable.qualify(scope, label));
    }
}
