package org.dotnes.compiler.isa;

/**
 * The 56 documented mnemonics of the 6502 CPU used by the NES.
 */
public enum Opcode {
    ADC, AND, ASL, BCC, BCS, BEQ, BIT, BMI, BNE, BPL, BRK, BVC, BVS, CLC,
    CLD, CLI, CLV, CMP, CPX, CPY, DEC, DEX, DEY, EOR, INC, INX, INY, JMP,
    JSR, LDA, LDX, LDY, LSR, NOP, ORA, PHA, PHP, PLA, PLP, ROL, ROR, RTI,
    RTS, SBC, SEC, SED, SEI, STA, STX, STY, TAX, TAY, TSX, TXA, TXS, TYA;

    /**
     * @return {@code true} for the eight conditional relative branches.
     */
    public boolean isBranch() {
        return switch (this) {
            case BCC, BCS, BEQ, BMI, BNE, BPL, BVC, BVS -> true;
            default -> false;
        };
    }

    /**
     * Returns the branch that is taken exactly when this one is not.
     *
     * @return The inverted branch mnemonic.
     * @throws IllegalStateException if this is not a conditional branch.
     */
    public Opcode invertBranch() {
        return switch (this) {
            case BCC -> BCS;
            case BCS -> BCC;
            case BEQ -> BNE;
            case BNE -> BEQ;
            case BMI -> BPL;
            case BPL -> BMI;
            case BVC -> BVS;
            case BVS -> BVC;
            default -> throw new IllegalStateException(this + " is not a conditional branch");
        };
    }
}
