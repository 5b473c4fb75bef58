package org.dotnes.compiler.frontend;

/**
 * Encoding of the inline operand that follows an IL opcode.
 */
public enum OperandKind {
    NONE(0),
    /** Signed 8-bit integer ({@code ldc.i4.s}). */
    INT8(1),
    /** Unsigned 8-bit argument or local index, or a prefix flag. */
    UINT8(1),
    /** Unsigned 16-bit argument or local index. */
    UINT16(2),
    INT32(4),
    INT64(8),
    FLOAT32(4),
    FLOAT64(8),
    /** Signed 8-bit branch delta. */
    BRANCH8(1),
    /** Signed 32-bit branch delta. */
    BRANCH32(4),
    /** Metadata token of a method, field or type. */
    TOKEN(4),
    /** User string token. */
    STRING(4),
    /** 32-bit count followed by that many 32-bit deltas. */
    SWITCH(4);

    private final int width;

    OperandKind(int width) {
        this.width = width;
    }

    /**
     * @return The fixed operand width in bytes; for {@link #SWITCH} the width of the count.
     */
    public int width() {
        return width;
    }

    public boolean isBranch() {
        return this == BRANCH8 || this == BRANCH32;
    }
}
