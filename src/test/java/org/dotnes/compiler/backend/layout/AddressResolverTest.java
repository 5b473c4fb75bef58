package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.api.BranchOutOfRangeException;
import org.dotnes.compiler.api.DuplicateLabelException;
import org.dotnes.compiler.api.UnresolvedLabelException;
import org.dotnes.compiler.isa.Opcode;
import org.dotnes.compiler.isa.TargetInstruction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dotnes.compiler.isa.Asm.*;
import static org.dotnes.compiler.isa.Opcode.*;

public class AddressResolverTest {

    @Test
    @Tag("unit")
    void assignsConsecutiveAddressesFromTheBase() throws Exception {
        Program program = new Program()
                .add(new Block("first").emit(imm(LDA, 1)).emit(jsr("second")))
                .add(new Block("second").emit(imp(RTS)));

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.blockAddresses()).containsExactly(0x8000, 0x8005);
        assertThat(layout.addressOf("first")).isEqualTo(0x8000);
        assertThat(layout.addressOf("second")).isEqualTo(0x8005);
        assertThat(layout.totalSize()).isEqualTo(6);
    }

    @Test
    @Tag("unit")
    void labelOffsetMovesTheBlockLabel() throws Exception {
        Program program = new Program(0xC000)
                .add(new Block("entry", 2).emit(imp(TAX)).emit(imp(INX)).emit(imp(RTS)));

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.blockAddresses()).containsExactly(0xC000);
        assertThat(layout.addressOf("entry")).isEqualTo(0xC002);
    }

    @Test
    @Tag("unit")
    void localLabelsAreScopedToTheirBlock() throws Exception {
        Program program = new Program()
                .add(new Block("a").mark("@loop").emit(imp(DEX)).emit(branch(BNE, "@loop")))
                .add(new Block("b").emit(imp(NOP)).mark("@loop").emit(imp(DEY)).emit(branch(BNE, "@loop")));

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.labelToAddress())
                .containsEntry("a:@loop", 0x8000)
                .containsEntry("b:@loop", 0x8004)
                .doesNotContainKey("@loop");
        assertThat(layout.lookupFor(1).addressOf("@loop")).isEqualTo(0x8004);
    }

    @Test
    @Tag("unit")
    void anonymousBlocksGetTheirOwnScope() throws Exception {
        Program program = new Program()
                .add(new Block().mark("@x").emit(imp(NOP)))
                .add(new Block().mark("@x").emit(imp(NOP)));

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.blockScopes()).doesNotHaveDuplicates();
        assertThat(layout.lookupFor(0).addressOf("@x")).isEqualTo(0x8000);
        assertThat(layout.lookupFor(1).addressOf("@x")).isEqualTo(0x8001);
    }

    @Test
    @Tag("unit")
    void duplicateGlobalLabelIsRejected() {
        Program program = new Program()
                .add(new Block("same").emit(imp(NOP)))
                .add(new Block("same").emit(imp(NOP)));

        assertThatThrownBy(() -> new AddressResolver().resolve(program))
                .isInstanceOf(DuplicateLabelException.class)
                .hasMessageContaining("same");
    }

    @Test
    @Tag("unit")
    void undefinedLabelIsRejected() {
        Program program = new Program().add(new Block("main").emit(jsr("missing")));

        assertThatThrownBy(() -> new AddressResolver().resolve(program))
                .isInstanceOf(UnresolvedLabelException.class)
                .hasMessageContaining("missing");
    }

    @Test
    @Tag("unit")
    void undefinedAddressTableEntryIsRejected() {
        Program program = new Program().add(new Block("table").addressLow("missing", 0));

        assertThatThrownBy(() -> new AddressResolver().resolve(program))
                .isInstanceOf(UnresolvedLabelException.class);
    }

    @Test
    @Tag("unit")
    void outOfRangeLongBranchBecomesTrampoline() throws Exception {
        Block main = new Block("main").emit(longBranch(BEQ, "far")).data(new byte[200]);
        Program program = new Program().add(main).add(new Block("far").emit(imp(RTS)));

        LayoutResult layout = new AddressResolver().resolve(program);

        List<TargetInstruction> code = main.instructions();
        assertThat(code).hasSize(2);
        assertThat(code.get(0).opcode()).isEqualTo(Opcode.BNE);
        assertThat(code.get(1)).isEqualTo(jmp("far"));
        assertThat(layout.addressOf("far")).isEqualTo(0x8000 + 5 + 200);
        assertThat(code.get(0).encode(0x8000, layout.lookupFor(0))).containsExactly(0xD0, 0x03);
    }

    @Test
    @Tag("unit")
    void inRangeLongBranchIsKept() throws Exception {
        Block main = new Block("main").emit(longBranch(BNE, "near")).data(new byte[10]);
        Program program = new Program().add(main).add(new Block("near").emit(imp(RTS)));

        new AddressResolver().resolve(program);

        assertThat(main.instructions()).containsExactly(longBranch(BNE, "near"));
    }

    @Test
    @Tag("unit")
    void outOfRangeFixedBranchFails() {
        Program program = new Program()
                .add(new Block("main").emit(branch(BEQ, "far")).data(new byte[300]))
                .add(new Block("far").emit(imp(RTS)));

        assertThatThrownBy(() -> new AddressResolver().resolve(program))
                .isInstanceOf(BranchOutOfRangeException.class);
    }

    @Test
    @Tag("unit")
    void resolvingTwiceYieldsTheSameLayout() throws Exception {
        Program program = new Program()
                .add(new Block("main").emit(longBranch(BEQ, "far")).data(new byte[130]))
                .add(new Block("far").emit(imp(RTS)));
        AddressResolver resolver = new AddressResolver();

        LayoutResult first = resolver.resolve(program);
        LayoutResult second = resolver.resolve(program);

        assertThat(second).isEqualTo(first);
    }

    @Test
    @Tag("unit")
    void movingABlockShiftsFollowingAddresses() throws Exception {
        Program program = new Program()
                .add(new Block("a").emit(imp(NOP)))
                .add(new Block("b").emit(imp(NOP)).emit(imp(NOP)))
                .add(new Block("c").emit(imp(RTS)));
        program.move(2, 0);

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.addressOf("c")).isEqualTo(0x8000);
        assertThat(layout.addressOf("a")).isEqualTo(0x8001);
        assertThat(layout.addressOf("b")).isEqualTo(0x8002);
        assertThat(program.indexOf("b")).isEqualTo(2);
    }
}
