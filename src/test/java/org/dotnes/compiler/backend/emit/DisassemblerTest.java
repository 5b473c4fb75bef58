package org.dotnes.compiler.backend.emit;

import org.dotnes.compiler.backend.layout.AddressResolver;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dotnes.compiler.isa.Asm.*;
import static org.dotnes.compiler.isa.Opcode.*;

public class DisassemblerTest {

    private final Disassembler disassembler = new Disassembler();

    @Test
    @Tag("unit")
    void listsHelloMain() throws Exception {
        Program program = EmitterTest.linkedHello();

        String listing = disassembler.listing(program, new AddressResolver().resolve(program));

        assertThat(listing).contains("main:\n"
                + "$8500  A9 00     LDA #$00\n"
                + "$8502  20 A2 85  JSR pusha\n");
        assertThat(listing).contains("@IL_003A:\n$8540  4C 40 85  JMP @IL_003A\n");
        assertThat(listing).contains("string_0:\n$85F1  48 45 4C  .byte $48,$45,$4C,$4C,$4F,$2C,$20,$2E\n");
        assertThat(listing).startsWith("_exit:\n$8000  78        SEI\n");
    }

    @Test
    @Tag("unit")
    void blockLabelFollowsItsOffset() throws Exception {
        Program program = EmitterTest.linkedHello();

        String listing = disassembler.listing(program, new AddressResolver().resolve(program));

        assertThat(listing).contains("$85A0  B1 22     LDA ($22),Y\npusha:\n$85A2");
    }

    @Test
    @Tag("unit")
    void listsAddressTables() throws Exception {
        Program program = new Program(0xC000)
                .add(new Block("table").addressLow("target", 0).addressHigh("target", 2))
                .add(new Block("target").emit(imp(RTS)));

        String listing = disassembler.listing(program, new AddressResolver().resolve(program));

        assertThat(listing).isEqualTo("table:\n"
                + "$C000  02        .byte <target\n"
                + "$C001  C0        .byte >target+2\n"
                + "target:\n"
                + "$C002  60        RTS\n");
    }
}
