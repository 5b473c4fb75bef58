package org.dotnes.compiler.frontend;

/**
 * One decoded IL instruction.
 *
 * @param offset Byte offset of the instruction in the method body.
 * @param size Encoded size in bytes, opcode and operand.
 * @param opcode The opcode.
 * @param operand The decoded operand, never {@code null}.
 */
public record StructuredInstruction(int offset, int size, IlOpcode opcode, IlOperand operand) {

    /**
     * @return The offset of the instruction that follows.
     */
    public int next() {
        return offset + size;
    }

    /**
     * @return The target offset of a branch, or -1 if this is not a branch.
     */
    public int branchTarget() {
        return operand instanceof IlOperand.BranchTarget target ? target.target() : -1;
    }

    /**
     * @return The integer operand.
     * @throws IllegalStateException if the operand is not an integer.
     */
    public long intValue() {
        if (operand instanceof IlOperand.IntValue value) {
            return value.value();
        }
        throw new IllegalStateException(opcode + " has no integer operand");
    }

    @Override
    public String toString() {
        String text = operand.toString();
        return String.format("IL_%04X: %s%s", offset, opcode.mnemonic(), text.isEmpty() ? "" : " " + text);
    }
}
