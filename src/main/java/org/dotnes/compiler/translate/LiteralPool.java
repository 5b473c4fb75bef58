package org.dotnes.compiler.translate;

import org.dotnes.compiler.backend.layout.Block;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Literal data referenced by user code: byte arrays in bind order, then strings in first-use
 * order. Equal strings share one block.
 */
final class LiteralPool {

    static final String BYTE_ARRAY_PREFIX = "bytearray_";
    static final String STRING_PREFIX = "string_";

    private final List<Block> byteArrays = new ArrayList<>();
    private final Map<String, String> stringLabels = new LinkedHashMap<>();
    private final List<Block> strings = new ArrayList<>();

    /**
     * @param data Array contents.
     * @return The label of a new data block.
     */
    String addByteArray(byte[] data) {
        String label = BYTE_ARRAY_PREFIX + byteArrays.size();
        byteArrays.add(new Block(label).data(data));
        return label;
    }

    /**
     * @param value An ASCII string.
     * @return The label of the NUL-terminated data block holding it.
     */
    String addString(String value) {
        String existing = stringLabels.get(value);
        if (existing != null) {
            return existing;
        }
        String label = STRING_PREFIX + strings.size();
        byte[] text = value.getBytes(StandardCharsets.US_ASCII);
        byte[] terminated = new byte[text.length + 1];
        System.arraycopy(text, 0, terminated, 0, text.length);
        strings.add(new Block(label).data(terminated));
        stringLabels.put(value, label);
        return label;
    }

    List<Block> byteArrays() {
        return List.copyOf(byteArrays);
    }

    List<Block> strings() {
        return List.copyOf(strings);
    }

    static boolean isAscii(String value) {
        return value.chars().allMatch(c -> c < 0x80);
    }
}
