package org.dotnes.compiler.isa;

/**
 * Addressing modes of the 6502. Each mode fixes the encoded size of an instruction.
 */
public enum AddressMode {
    /** No operand, e.g. {@code RTS}. */
    IMPLIED(1),
    /** Operates on A, e.g. {@code ASL A}. */
    ACCUMULATOR(1),
    /** {@code #$nn} */
    IMMEDIATE(2),
    /** {@code $nn} */
    ZERO_PAGE(2),
    /** {@code $nn,X} */
    ZERO_PAGE_X(2),
    /** {@code $nn,Y} */
    ZERO_PAGE_Y(2),
    /** {@code $nnnn} */
    ABSOLUTE(3),
    /** {@code $nnnn,X} */
    ABSOLUTE_X(3),
    /** {@code $nnnn,Y} */
    ABSOLUTE_Y(3),
    /** {@code ($nnnn)}, only used by {@code JMP}. */
    INDIRECT(3),
    /** {@code ($nn,X)} */
    INDEXED_INDIRECT(2),
    /** {@code ($nn),Y} */
    INDIRECT_INDEXED(2),
    /** Signed 8-bit displacement from the following instruction. */
    RELATIVE(2);

    private final int size;

    AddressMode(int size) {
        this.size = size;
    }

    /**
     * @return The encoded instruction size in bytes, opcode included.
     */
    public int size() {
        return size;
    }

    /**
     * @return {@code true} if the operand is a single byte literal or zero page address.
     */
    public boolean takesByte() {
        return size == 2 && this != RELATIVE && this != IMMEDIATE;
    }

    /**
     * @return {@code true} if the operand is a 16-bit address.
     */
    public boolean takesWord() {
        return size == 3;
    }
}
