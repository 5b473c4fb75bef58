package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.api.DuplicateLabelException;
import org.dotnes.compiler.api.UnresolvedLabelException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps label names to addresses. Block-local labels are stored under a qualified name
 * ({@code scope:@name}, see {@link #qualify(String, String)}).
 */
public final class LabelTable {

    private final Map<String, Integer> addresses = new LinkedHashMap<>();

    /**
     * Qualifies a label as written inside a block.
     *
     * @param scope The scope of the block that references or defines the label.
     * @param label The label as written.
     * @return The key under which the label is stored.
     */
    public static String qualify(String scope, String label) {
        return label.startsWith("@") ? scope + ":" + label : label;
    }

    /**
     * @param name The qualified label name.
     * @param address The address.
     * @throws DuplicateLabelException if the label is already defined.
     */
    public void define(String name, int address) throws DuplicateLabelException {
        if (addresses.putIfAbsent(name, address) != null) {
            throw new DuplicateLabelException(name);
        }
    }

    /**
     * @param name The qualified label name.
     * @return The address.
     * @throws UnresolvedLabelException if the label is not defined.
     */
    public int resolve(String name) throws UnresolvedLabelException {
        Integer address = addresses.get(name);
        if (address == null) {
            throw new UnresolvedLabelException(name);
        }
        return address;
    }

    public boolean contains(String name) {
        return addresses.containsKey(name);
    }

    /**
     * @return All labels in definition order, unmodifiable.
     */
    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(addresses);
    }
}
