package org.dotnes.compiler.isa;

/**
 * Static factory methods that read like assembler source, e.g. {@code imm(LDA, 0x3F)} for
 * {@code LDA #$3F} or {@code jsr("popa")} for {@code JSR popa}.
 */
public final class Asm {

    private Asm() {}

    public static TargetInstruction imp(Opcode opcode) {
        return new TargetInstruction(opcode, AddressMode.IMPLIED, Operand.None.INSTANCE);
    }

    public static TargetInstruction acc(Opcode opcode) {
        return new TargetInstruction(opcode, AddressMode.ACCUMULATOR, Operand.None.INSTANCE);
    }

    public static TargetInstruction imm(Opcode opcode, int value) {
        return new TargetInstruction(opcode, AddressMode.IMMEDIATE, new Operand.Literal(value));
    }

    /** {@code #<label} */
    public static TargetInstruction lowByte(Opcode opcode, String label) {
        return lowByte(opcode, label, 0);
    }

    public static TargetInstruction lowByte(Opcode opcode, String label, int offset) {
        return new TargetInstruction(opcode, AddressMode.IMMEDIATE, new Operand.LowByte(label, offset));
    }

    /** {@code #>label} */
    public static TargetInstruction highByte(Opcode opcode, String label) {
        return highByte(opcode, label, 0);
    }

    public static TargetInstruction highByte(Opcode opcode, String label, int offset) {
        return new TargetInstruction(opcode, AddressMode.IMMEDIATE, new Operand.HighByte(label, offset));
    }

    public static TargetInstruction zp(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ZERO_PAGE, new Operand.Literal(address));
    }

    public static TargetInstruction zpX(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ZERO_PAGE_X, new Operand.Literal(address));
    }

    public static TargetInstruction zpY(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ZERO_PAGE_Y, new Operand.Literal(address));
    }

    public static TargetInstruction abs(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ABSOLUTE, new Operand.Literal(address));
    }

    public static TargetInstruction abs(Opcode opcode, String label) {
        return abs(opcode, label, 0);
    }

    public static TargetInstruction abs(Opcode opcode, String label, int offset) {
        return new TargetInstruction(opcode, AddressMode.ABSOLUTE, new Operand.Label(label, offset));
    }

    public static TargetInstruction absX(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ABSOLUTE_X, new Operand.Literal(address));
    }

    public static TargetInstruction absX(Opcode opcode, String label, int offset) {
        return new TargetInstruction(opcode, AddressMode.ABSOLUTE_X, new Operand.Label(label, offset));
    }

    public static TargetInstruction absY(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.ABSOLUTE_Y, new Operand.Literal(address));
    }

    public static TargetInstruction ind(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.INDIRECT, new Operand.Literal(address));
    }

    public static TargetInstruction indX(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.INDEXED_INDIRECT, new Operand.Literal(address));
    }

    public static TargetInstruction indY(Opcode opcode, int address) {
        return new TargetInstruction(opcode, AddressMode.INDIRECT_INDEXED, new Operand.Literal(address));
    }

    /**
     * A branch with a fixed displacement, as found in hand-written runtime code.
     */
    public static TargetInstruction branch(Opcode opcode, int displacement) {
        return new TargetInstruction(opcode, AddressMode.RELATIVE, new Operand.Displacement(displacement));
    }

    /**
     * A branch to a label that must be in range.
     */
    public static TargetInstruction branch(Opcode opcode, String label) {
        return new TargetInstruction(opcode, AddressMode.RELATIVE, new Operand.BranchLabel(label, false));
    }

    /**
     * A branch to a label that the resolver may turn into a long-branch trampoline.
     */
    public static TargetInstruction longBranch(Opcode opcode, String label) {
        return new TargetInstruction(opcode, AddressMode.RELATIVE, new Operand.BranchLabel(label, true));
    }

    public static TargetInstruction jsr(String label) {
        return abs(Opcode.JSR, label);
    }

    public static TargetInstruction jsr(String label, int offset) {
        return abs(Opcode.JSR, label, offset);
    }

    public static TargetInstruction jsr(int address) {
        return abs(Opcode.JSR, address);
    }

    public static TargetInstruction jmp(String label) {
        return abs(Opcode.JMP, label);
    }

    public static TargetInstruction jmp(int address) {
        return abs(Opcode.JMP, address);
    }
}
