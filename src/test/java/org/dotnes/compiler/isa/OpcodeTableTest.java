package org.dotnes.compiler.isa;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OpcodeTableTest {

    @Test
    @Tag("unit")
    void encodesCommonInstructions() {
        assertThat(OpcodeTable.encode(Opcode.LDA, AddressMode.IMMEDIATE)).isEqualTo(0xA9);
        assertThat(OpcodeTable.encode(Opcode.STA, AddressMode.ABSOLUTE)).isEqualTo(0x8D);
        assertThat(OpcodeTable.encode(Opcode.JSR, AddressMode.ABSOLUTE)).isEqualTo(0x20);
        assertThat(OpcodeTable.encode(Opcode.JMP, AddressMode.INDIRECT)).isEqualTo(0x6C);
        assertThat(OpcodeTable.encode(Opcode.LDA, AddressMode.INDIRECT_INDEXED)).isEqualTo(0xB1);
        assertThat(OpcodeTable.encode(Opcode.ASL, AddressMode.ACCUMULATOR)).isEqualTo(0x0A);
    }

    @Test
    @Tag("unit")
    void decodeIsInverseOfEncode() {
        for (Opcode opcode : Opcode.values()) {
            for (AddressMode mode : AddressMode.values()) {
                if (OpcodeTable.supports(opcode, mode)) {
                    int value = OpcodeTable.encode(opcode, mode);
                    assertThat(OpcodeTable.decode(value)).contains(new OpcodeTable.Entry(opcode, mode));
                }
            }
        }
    }

    @Test
    @Tag("unit")
    void everyMnemonicHasAnEncoding() {
        for (Opcode opcode : Opcode.values()) {
            boolean any = false;
            for (AddressMode mode : AddressMode.values()) {
                any |= OpcodeTable.supports(opcode, mode);
            }
            assertThat(any).as("%s has no encoding", opcode).isTrue();
        }
    }

    @Test
    @Tag("unit")
    void undocumentedOpcodesDoNotDecode() {
        assertThat(OpcodeTable.decode(0x02)).isEmpty();
        assertThat(OpcodeTable.decode(0xFF)).isEmpty();
    }

    @Test
    @Tag("unit")
    void rejectsUnsupportedMode() {
        assertThatThrownBy(() -> OpcodeTable.encode(Opcode.STA, AddressMode.IMMEDIATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(OpcodeTable.supports(Opcode.JSR, AddressMode.INDIRECT)).isFalse();
    }

    @Test
    @Tag("unit")
    void branchesInvertPairwise() {
        for (Opcode opcode : Opcode.values()) {
            if (opcode.isBranch()) {
                assertThat(opcode.invertBranch()).isNotEqualTo(opcode);
                assertThat(opcode.invertBranch().invertBranch()).isEqualTo(opcode);
            }
        }
        assertThatThrownBy(Opcode.JMP::invertBranch).isInstanceOf(IllegalStateException.class);
    }
}
