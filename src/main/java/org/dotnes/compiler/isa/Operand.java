package org.dotnes.compiler.isa;

/**
 * Operand of a {@link TargetInstruction}. Symbolic operands name a label and stay unresolved
 * until the address resolver has assigned addresses to every block.
 */
public sealed interface Operand
        permits Operand.None, Operand.Literal, Operand.Label, Operand.LowByte, Operand.HighByte,
                Operand.Displacement, Operand.BranchLabel {

    /**
     * @return {@code true} if encoding this operand needs a label lookup.
     */
    default boolean isSymbolic() {
        return false;
    }

    /** No operand (implied and accumulator modes). */
    record None() implements Operand {
        public static final None INSTANCE = new None();
    }

    /**
     * A literal byte or word, depending on the addressing mode.
     *
     * @param value The value.
     */
    record Literal(int value) implements Operand {}

    /**
     * The 16-bit address of a label plus a byte offset.
     *
     * @param name The label.
     * @param offset Added to the resolved address.
     */
    record Label(String name, int offset) implements Operand {
        @Override
        public boolean isSymbolic() {
            return true;
        }
    }

    /**
     * The low byte of a label address ({@code #<label}).
     *
     * @param name The label.
     * @param offset Added to the resolved address before taking the byte.
     */
    record LowByte(String name, int offset) implements Operand {
        @Override
        public boolean isSymbolic() {
            return true;
        }
    }

    /**
     * The high byte of a label address ({@code #>label}).
     *
     * @param name The label.
     * @param offset Added to the resolved address before taking the byte.
     */
    record HighByte(String name, int offset) implements Operand {
        @Override
        public boolean isSymbolic() {
            return true;
        }
    }

    /**
     * A fixed signed branch displacement, relative to the following instruction.
     *
     * @param value The displacement in [-128, 127].
     */
    record Displacement(int value) implements Operand {}

    /**
     * A branch to a label. Relaxable branches may be rewritten by the resolver into an inverted
     * branch over an absolute jump when the target is out of range.
     *
     * @param name The branch target.
     * @param relaxable Whether the resolver may rewrite the branch.
     */
    record BranchLabel(String name, boolean relaxable) implements Operand {
        @Override
        public boolean isSymbolic() {
            return true;
        }
    }
}
