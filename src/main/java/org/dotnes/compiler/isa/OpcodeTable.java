package org.dotnes.compiler.isa;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.dotnes.compiler.isa.AddressMode.*;
import static org.dotnes.compiler.isa.Opcode.*;

/**
 * Encoding table of the documented 6502 instruction set: (mnemonic, addressing mode) to opcode byte
 * and back.
 */
public final class OpcodeTable {

    /**
     * A decoded opcode byte.
     *
     * @param opcode The mnemonic.
     * @param mode The addressing mode.
     */
    public record Entry(Opcode opcode, AddressMode mode) {}

    private static final Map<Opcode, Map<AddressMode, Integer>> ENCODINGS = new EnumMap<>(Opcode.class);
    private static final Entry[] DECODINGS = new Entry[256];

    static {
        // region Load, store, transfer
        define(LDA, IMMEDIATE, 0xA9, ZERO_PAGE, 0xA5, ZERO_PAGE_X, 0xB5, ABSOLUTE, 0xAD,
                ABSOLUTE_X, 0xBD, ABSOLUTE_Y, 0xB9, INDEXED_INDIRECT, 0xA1, INDIRECT_INDEXED, 0xB1);
        define(LDX, IMMEDIATE, 0xA2, ZERO_PAGE, 0xA6, ZERO_PAGE_Y, 0xB6, ABSOLUTE, 0xAE, ABSOLUTE_Y, 0xBE);
        define(LDY, IMMEDIATE, 0xA0, ZERO_PAGE, 0xA4, ZERO_PAGE_X, 0xB4, ABSOLUTE, 0xAC, ABSOLUTE_X, 0xBC);
        define(STA, ZERO_PAGE, 0x85, ZERO_PAGE_X, 0x95, ABSOLUTE, 0x8D, ABSOLUTE_X, 0x9D,
                ABSOLUTE_Y, 0x99, INDEXED_INDIRECT, 0x81, INDIRECT_INDEXED, 0x91);
        define(STX, ZERO_PAGE, 0x86, ZERO_PAGE_Y, 0x96, ABSOLUTE, 0x8E);
        define(STY, ZERO_PAGE, 0x84, ZERO_PAGE_X, 0x94, ABSOLUTE, 0x8C);
        define(TAX, IMPLIED, 0xAA);
        define(TAY, IMPLIED, 0xA8);
        define(TSX, IMPLIED, 0xBA);
        define(TXA, IMPLIED, 0x8A);
        define(TXS, IMPLIED, 0x9A);
        define(TYA, IMPLIED, 0x98);
        define(PHA, IMPLIED, 0x48);
        define(PHP, IMPLIED, 0x08);
        define(PLA, IMPLIED, 0x68);
        define(PLP, IMPLIED, 0x28);
        // endregion

        // region Arithmetic and logic
        define(ADC, IMMEDIATE, 0x69, ZERO_PAGE, 0x65, ZERO_PAGE_X, 0x75, ABSOLUTE, 0x6D,
                ABSOLUTE_X, 0x7D, ABSOLUTE_Y, 0x79, INDEXED_INDIRECT, 0x61, INDIRECT_INDEXED, 0x71);
        define(SBC, IMMEDIATE, 0xE9, ZERO_PAGE, 0xE5, ZERO_PAGE_X, 0xF5, ABSOLUTE, 0xED,
                ABSOLUTE_X, 0xFD, ABSOLUTE_Y, 0xF9, INDEXED_INDIRECT, 0xE1, INDIRECT_INDEXED, 0xF1);
        define(AND, IMMEDIATE, 0x29, ZERO_PAGE, 0x25, ZERO_PAGE_X, 0x35, ABSOLUTE, 0x2D,
                ABSOLUTE_X, 0x3D, ABSOLUTE_Y, 0x39, INDEXED_INDIRECT, 0x21, INDIRECT_INDEXED, 0x31);
        define(ORA, IMMEDIATE, 0x09, ZERO_PAGE, 0x05, ZERO_PAGE_X, 0x15, ABSOLUTE, 0x0D,
                ABSOLUTE_X, 0x1D, ABSOLUTE_Y, 0x19, INDEXED_INDIRECT, 0x01, INDIRECT_INDEXED, 0x11);
        define(EOR, IMMEDIATE, 0x49, ZERO_PAGE, 0x45, ZERO_PAGE_X, 0x55, ABSOLUTE, 0x4D,
                ABSOLUTE_X, 0x5D, ABSOLUTE_Y, 0x59, INDEXED_INDIRECT, 0x41, INDIRECT_INDEXED, 0x51);
        define(CMP, IMMEDIATE, 0xC9, ZERO_PAGE, 0xC5, ZERO_PAGE_X, 0xD5, ABSOLUTE, 0xCD,
                ABSOLUTE_X, 0xDD, ABSOLUTE_Y, 0xD9, INDEXED_INDIRECT, 0xC1, INDIRECT_INDEXED, 0xD1);
        define(CPX, IMMEDIATE, 0xE0, ZERO_PAGE, 0xE4, ABSOLUTE, 0xEC);
        define(CPY, IMMEDIATE, 0xC0, ZERO_PAGE, 0xC4, ABSOLUTE, 0xCC);
        define(BIT, ZERO_PAGE, 0x24, ABSOLUTE, 0x2C);
        define(INC, ZERO_PAGE, 0xE6, ZERO_PAGE_X, 0xF6, ABSOLUTE, 0xEE, ABSOLUTE_X, 0xFE);
        define(DEC, ZERO_PAGE, 0xC6, ZERO_PAGE_X, 0xD6, ABSOLUTE, 0xCE, ABSOLUTE_X, 0xDE);
        define(INX, IMPLIED, 0xE8);
        define(INY, IMPLIED, 0xC8);
        define(DEX, IMPLIED, 0xCA);
        define(DEY, IMPLIED, 0x88);
        // endregion

        // region Shifts
        define(ASL, ACCUMULATOR, 0x0A, ZERO_PAGE, 0x06, ZERO_PAGE_X, 0x16, ABSOLUTE, 0x0E, ABSOLUTE_X, 0x1E);
        define(LSR, ACCUMULATOR, 0x4A, ZERO_PAGE, 0x46, ZERO_PAGE_X, 0x56, ABSOLUTE, 0x4E, ABSOLUTE_X, 0x5E);
        define(ROL, ACCUMULATOR, 0x2A, ZERO_PAGE, 0x26, ZERO_PAGE_X, 0x36, ABSOLUTE, 0x2E, ABSOLUTE_X, 0x3E);
        define(ROR, ACCUMULATOR, 0x6A, ZERO_PAGE, 0x66, ZERO_PAGE_X, 0x76, ABSOLUTE, 0x6E, ABSOLUTE_X, 0x7E);
        // endregion

        // region Control flow
        define(JMP, ABSOLUTE, 0x4C, INDIRECT, 0x6C);
        define(JSR, ABSOLUTE, 0x20);
        define(RTS, IMPLIED, 0x60);
        define(RTI, IMPLIED, 0x40);
        define(BRK, IMPLIED, 0x00);
        define(BCC, RELATIVE, 0x90);
        define(BCS, RELATIVE, 0xB0);
        define(BEQ, RELATIVE, 0xF0);
        define(BMI, RELATIVE, 0x30);
        define(BNE, RELATIVE, 0xD0);
        define(BPL, RELATIVE, 0x10);
        define(BVC, RELATIVE, 0x50);
        define(BVS, RELATIVE, 0x70);
        // endregion

        // region Flags
        define(CLC, IMPLIED, 0x18);
        define(CLD, IMPLIED, 0xD8);
        define(CLI, IMPLIED, 0x58);
        define(CLV, IMPLIED, 0xB8);
        define(SEC, IMPLIED, 0x38);
        define(SED, IMPLIED, 0xF8);
        define(SEI, IMPLIED, 0x78);
        define(NOP, IMPLIED, 0xEA);
        // endregion
    }

    private OpcodeTable() {}

    private static void define(Opcode opcode, Object... modeAndByte) {
        Map<AddressMode, Integer> modes = ENCODINGS.computeIfAbsent(opcode, k -> new EnumMap<>(AddressMode.class));
        for (int i = 0; i < modeAndByte.length; i += 2) {
            AddressMode mode = (AddressMode) modeAndByte[i];
            int value = (Integer) modeAndByte[i + 1];
            modes.put(mode, value);
            DECODINGS[value] = new Entry(opcode, mode);
        }
    }

    /**
     * Returns the opcode byte for a mnemonic in the given addressing mode.
     *
     * @param opcode The mnemonic.
     * @param mode The addressing mode.
     * @return The opcode byte (0..255).
     * @throws IllegalArgumentException if the mnemonic does not support the mode.
     */
    public static int encode(Opcode opcode, AddressMode mode) {
        Integer value = ENCODINGS.getOrDefault(opcode, Map.of()).get(mode);
        if (value == null) {
            throw new IllegalArgumentException("Invalid addressing mode " + mode + " for " + opcode);
        }
        return value;
    }

    /**
     * @param opcode The mnemonic.
     * @param mode The addressing mode.
     * @return {@code true} if the combination exists.
     */
    public static boolean supports(Opcode opcode, AddressMode mode) {
        return ENCODINGS.getOrDefault(opcode, Map.of()).containsKey(mode);
    }

    /**
     * Looks up the instruction for an opcode byte.
     *
     * @param value The opcode byte.
     * @return The mnemonic and mode, or empty for undocumented opcodes.
     */
    public static Optional<Entry> decode(int value) {
        return Optional.ofNullable(DECODINGS[value & 0xFF]);
    }
}
