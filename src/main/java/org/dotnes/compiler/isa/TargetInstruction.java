package org.dotnes.compiler.isa;

import org.dotnes.compiler.api.BranchOutOfRangeException;
import org.dotnes.compiler.api.CompilationException;

/**
 * A single 6502 instruction: mnemonic, addressing mode and operand. The encoded size follows from
 * the addressing mode alone, so layout never needs to know label values.
 *
 * @param opcode The mnemonic.
 * @param mode The addressing mode.
 * @param operand The operand, literal or symbolic.
 */
public record TargetInstruction(Opcode opcode, AddressMode mode, Operand operand) {

    public TargetInstruction {
        if (!OpcodeTable.supports(opcode, mode)) {
            throw new IllegalArgumentException("Invalid addressing mode " + mode + " for " + opcode);
        }
        validate(mode, operand);
    }

    private static void validate(AddressMode mode, Operand operand) {
        boolean valid = switch (mode) {
            case IMPLIED, ACCUMULATOR -> operand instanceof Operand.None;
            case IMMEDIATE -> operand instanceof Operand.LowByte || operand instanceof Operand.HighByte
                    || (operand instanceof Operand.Literal l && l.value() >= 0 && l.value() <= 0xFF);
            case ZERO_PAGE, ZERO_PAGE_X, ZERO_PAGE_Y, INDEXED_INDIRECT, INDIRECT_INDEXED ->
                    operand instanceof Operand.Literal l && l.value() >= 0 && l.value() <= 0xFF;
            case ABSOLUTE, ABSOLUTE_X, ABSOLUTE_Y, INDIRECT -> operand instanceof Operand.Label
                    || (operand instanceof Operand.Literal l && l.value() >= 0 && l.value() <= 0xFFFF);
            case RELATIVE -> operand instanceof Operand.BranchLabel
                    || (operand instanceof Operand.Displacement d && d.value() >= -128 && d.value() <= 127);
        };
        if (!valid) {
            throw new IllegalArgumentException("Operand " + operand + " does not fit addressing mode " + mode);
        }
    }

    /**
     * @return The encoded size in bytes.
     */
    public int size() {
        return mode.size();
    }

    /**
     * @return The branch target if this is a branch to a label, otherwise {@code null}.
     */
    public String branchTarget() {
        return operand instanceof Operand.BranchLabel b ? b.name() : null;
    }

    /**
     * @return {@code true} if the resolver may rewrite this branch into a long-branch trampoline.
     */
    public boolean isRelaxable() {
        return operand instanceof Operand.BranchLabel b && b.relaxable();
    }

    /**
     * Encodes this instruction at the given address.
     *
     * @param address The address of the first byte of this instruction.
     * @param labels Resolves symbolic operands.
     * @return The encoded bytes, {@link #size()} long.
     * @throws CompilationException if a label is unresolved or a branch target is out of range.
     */
    public byte[] encode(int address, LabelLookup labels) throws CompilationException {
        byte[] bytes = new byte[size()];
        bytes[0] = (byte) OpcodeTable.encode(opcode, mode);
        if (operand instanceof Operand.Literal l) {
            putValue(bytes, l.value());
        } else if (operand instanceof Operand.Label l) {
            putValue(bytes, (labels.addressOf(l.name()) + l.offset()) & 0xFFFF);
        } else if (operand instanceof Operand.LowByte l) {
            bytes[1] = (byte) (labels.addressOf(l.name()) + l.offset());
        } else if (operand instanceof Operand.HighByte l) {
            bytes[1] = (byte) ((labels.addressOf(l.name()) + l.offset()) >> 8);
        } else if (operand instanceof Operand.Displacement d) {
            bytes[1] = (byte) d.value();
        } else if (operand instanceof Operand.BranchLabel b) {
            int displacement = displacement(address, labels.addressOf(b.name()));
            if (displacement < -128 || displacement > 127) {
                throw new BranchOutOfRangeException(b.name(), displacement);
            }
            bytes[1] = (byte) displacement;
        }
        return bytes;
    }

    /**
     * @param address The address of a relative branch.
     * @param target The branch target.
     * @return The displacement relative to the instruction following the branch.
     */
    public static int displacement(int address, int target) {
        return target - (address + AddressMode.RELATIVE.size());
    }

    private static void putValue(byte[] bytes, int value) {
        bytes[1] = (byte) value;
        if (bytes.length == 3) {
            bytes[2] = (byte) (value >> 8);
        }
    }

    @Override
    public String toString() {
        String text = operandText();
        String formatted = switch (mode) {
            case IMPLIED -> "";
            case ACCUMULATOR -> "A";
            case IMMEDIATE -> "#" + text;
            case ZERO_PAGE, ABSOLUTE, RELATIVE -> text;
            case ZERO_PAGE_X, ABSOLUTE_X -> text + ",X";
            case ZERO_PAGE_Y, ABSOLUTE_Y -> text + ",Y";
            case INDIRECT -> "(" + text + ")";
            case INDEXED_INDIRECT -> "(" + text + ",X)";
            case INDIRECT_INDEXED -> "(" + text + "),Y";
        };
        return formatted.isEmpty() ? opcode.name() : opcode.name() + " " + formatted;
    }

    private String operandText() {
        if (operand instanceof Operand.Literal l) {
            return mode.takesWord() ? String.format("$%04X", l.value()) : String.format("$%02X", l.value());
        } else if (operand instanceof Operand.Label l) {
            return withOffset(l.name(), l.offset());
        } else if (operand instanceof Operand.LowByte l) {
            return "<" + withOffset(l.name(), l.offset());
        } else if (operand instanceof Operand.HighByte l) {
            return ">" + withOffset(l.name(), l.offset());
        } else if (operand instanceof Operand.Displacement d) {
            return String.format("*%+d", d.value() + AddressMode.RELATIVE.size());
        } else if (operand instanceof Operand.BranchLabel b) {
            return b.name();
        }
        return "";
    }

    private static String withOffset(String name, int offset) {
        return offset == 0 ? name : name + "+" + offset;
    }
}
