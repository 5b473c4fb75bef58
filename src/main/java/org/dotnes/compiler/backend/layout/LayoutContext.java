package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.api.DuplicateLabelException;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one address assignment pass: the running address, the labels seen so far and
 * the start address of each block.
 */
final class LayoutContext {

    private final LabelTable labels = new LabelTable();
    private final List<Integer> blockAddresses = new ArrayList<>();
    private final List<String> blockScopes = new ArrayList<>();
    private final int baseAddress;
    private int address;

    LayoutContext(int baseAddress) {
        this.baseAddress = baseAddress;
        this.address = baseAddress;
    }

    /**
     * Starts a block at the current address and defines its label.
     *
     * @return The scope of the block's local labels.
     */
    String beginBlock(Block block, int index) throws DuplicateLabelException {
        String scope = block.label() != null ? block.label() : "$" + index;
        blockAddresses.add(address);
        blockScopes.add(scope);
        if (block.label() != null) {
            labels.define(block.label(), address + block.labelOffset());
        }
        return scope;
    }

    void defineInline(String scope, String label) throws DuplicateLabelException {
        labels.define(LabelTable.qualify(scope, label), address);
    }

    void advance(int bytes) {
        address += bytes;
    }

    int address() {
        return address;
    }

    LabelTable labels() {
        return labels;
    }

    LayoutResult toResult() {
        return new LayoutResult(baseAddress, blockAddresses, blockScopes, labels.asMap(), address - baseAddress);
    }
}
