package org.dotnes.compiler.translate;

/**
 * Width of a value on the target machine.
 */
public enum ValueWidth {
    /** Held in A. */
    BYTE(1),
    /** Held in A (low byte) and X (high byte). */
    WORD(2);

    private final int bytes;

    ValueWidth(int bytes) {
        this.bytes = bytes;
    }

    public int bytes() {
        return bytes;
    }

    /**
     * @param value An unsigned 16-bit value.
     * @return The narrowest width holding it.
     */
    public static ValueWidth of(int value) {
        return (value & 0xFFFF) <= 0xFF ? BYTE : WORD;
    }
}
