package org.dotnes.compiler.translate;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.SubroutineNotFoundException;
import org.dotnes.compiler.api.UnsupportedInstructionException;
import org.dotnes.compiler.backend.layout.BlockItem;
import org.dotnes.compiler.catalog.SubroutineCatalog;
import org.dotnes.compiler.diagnostics.Diagnostic;
import org.dotnes.compiler.diagnostics.DiagnosticsEngine;
import org.dotnes.compiler.frontend.BytecodeReader;
import org.dotnes.compiler.frontend.IlAssembler;
import org.dotnes.compiler.frontend.IlOpcode;
import org.dotnes.compiler.frontend.MetadataTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dotnes.compiler.isa.Asm.*;
import static org.dotnes.compiler.isa.Opcode.*;

/**
 * Translation of IL sequences into 6502 instructions, checked instruction by instruction.
 */
public class InstructionTranslatorTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private TranslationResult translate(IlAssembler il) throws CompilationException {
        return translate(il.bytes(), il.metadata());
    }

    private TranslationResult translate(byte[] body, MetadataTable metadata) throws CompilationException {
        return new InstructionTranslator(SubroutineCatalog.initialize(), diagnostics)
                .translate(new BytecodeReader().read(body, metadata));
    }

    private UnsupportedInstructionException failure(IlAssembler il) {
        try {
            translate(il);
        } catch (UnsupportedInstructionException e) {
            return e;
        } catch (CompilationException e) {
            throw new AssertionError("Unexpected failure " + e.getErrorCode(), e);
        }
        throw new AssertionError("Translation succeeded");
    }

    // region Calls

    @Test
    @Tag("unit")
    void translatesHello() throws Exception {
        TranslationResult result = translate(IlAssembler.hello());

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x00), jsr("pusha"), imm(LDA, 0x02), jsr("pal_col"),
                imm(LDA, 0x01), jsr("pusha"), imm(LDA, 0x14), jsr("pal_col"),
                imm(LDA, 0x02), jsr("pusha"), imm(LDA, 0x20), jsr("pal_col"),
                imm(LDA, 0x03), jsr("pusha"), imm(LDA, 0x30), jsr("pal_col"),
                imm(LDX, 0x20), imm(LDA, 0x42), jsr("vram_adr"),
                lowByte(LDA, "string_0"), highByte(LDX, "string_0"), jsr("pushax"),
                imm(LDX, 0x00), imm(LDA, 0x0C), jsr("vram_write"),
                jsr("ppu_on_all"),
                jmp("@IL_003A"));
        assertThat(result.main().size()).isEqualTo(67);
        assertThat(result.main().label()).isEqualTo("main");
        assertThat(result.main().items()).contains(new BlockItem.Mark("@IL_003A"));
        assertThat(result.calledRoutines()).containsExactly("pal_col", "vram_adr", "vram_write", "ppu_on_all");
        assertThat(result.localBytes()).isZero();
        assertThat(result.byteArrays()).isEmpty();
        assertThat(result.strings()).hasSize(1);
        assertThat(result.strings().get(0).label()).isEqualTo("string_0");
        assertThat(result.strings().get(0).size()).isEqualTo(13);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void equalStringsShareOneBlock() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldstr("AB").call("vram_write")
                .ldstr("CD").call("vram_write")
                .ldstr("AB").call("vram_write")
                .op(IlOpcode.RET));

        assertThat(result.strings()).extracting(b -> b.label()).containsExactly("string_0", "string_1");
        assertThat(result.main().instructions()).filteredOn(i -> i.equals(lowByte(LDA, "string_0"))).hasSize(2);
    }

    @Test
    @Tag("unit")
    void explicitLengthOverloadIsSelectedByStackShape() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldstr("HELLO").ldc(3).call("vram_write")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                lowByte(LDA, "string_0"), highByte(LDX, "string_0"), jsr("pushax"),
                imm(LDX, 0x00), imm(LDA, 0x03), jsr("vram_write"),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void resultOfACallIsSpilledBeforeTheNextPush() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0).call("pad_poll")
                .ldc(2).call("pal_col")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x00), jsr("pad_poll"), jsr("pusha"),
                imm(LDA, 0x02), jsr("pal_col"),
                imp(RTS));
        assertThat(result.calledRoutines()).containsExactly("pad_poll", "pal_col");
    }

    @Test
    @Tag("unit")
    void nametableMacrosFoldToConstants() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(1).ldc(3).call("NTADR_C").call("vram_adr")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDX, 0x28), imm(LDA, 0x61), jsr("vram_adr"), imp(RTS));
        assertThat(result.calledRoutines()).containsExactly("vram_adr");
    }

    @Test
    @Tag("unit")
    void initializedByteArrayBecomesLiteralData() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(2).newarr("System.Byte")
                .op(IlOpcode.DUP)
                .ldtoken(new byte[] {0x0F, 0x30, 0x11, 0x22})
                .call("InitializeArray")
                .call("pal_bg")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                lowByte(LDA, "bytearray_0"), highByte(LDX, "bytearray_0"), jsr("pal_bg"), imp(RTS));
        assertThat(result.byteArrays()).hasSize(1);
        assertThat(result.byteArrays().get(0).label()).isEqualTo("bytearray_0");
        assertThat(result.byteArrays().get(0).items())
                .singleElement()
                .isInstanceOfSatisfying(BlockItem.Data.class,
                        data -> assertThat(data.bytes()).containsExactly(0x0F, 0x30));
        assertThat(result.calledRoutines()).containsExactly("pal_bg");
    }

    @Test
    @Tag("unit")
    void arrayStoredInALocalIsPassedByAddress() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(3).newarr("System.Byte")
                .op(IlOpcode.DUP)
                .ldtoken(new byte[] {1, 2, 3})
                .call("InitializeArray")
                .stloc(0)
                .ldloc(0).call("vram_write")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                lowByte(LDA, "bytearray_0"), highByte(LDX, "bytearray_0"), jsr("pushax"),
                imm(LDX, 0x00), imm(LDA, 0x03), jsr("vram_write"),
                imp(RTS));
        assertThat(result.localBytes()).isZero();
    }

    @Test
    @Tag("unit")
    void unknownCallTargetIsReported() {
        assertThatThrownBy(() -> translate(new IlAssembler().call("WriteLine")))
                .isInstanceOfSatisfying(SubroutineNotFoundException.class, e -> {
                    assertThat(e.getName()).isEqualTo("WriteLine");
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.SUBROUTINE_NOT_FOUND);
                });
    }

    @Test
    @Tag("unit")
    void missingArgumentsAreAStackUnderflow() {
        UnsupportedInstructionException e = failure(new IlAssembler().ldc(1).call("pal_col"));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.STACK_UNDERFLOW);
        assertThat(e.getOffset()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void argumentOfTheWrongShapeIsRejected() {
        UnsupportedInstructionException e = failure(new IlAssembler().ldstr("X").call("pal_bright"));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.INVALID_CALL_SHAPE);
        assertThat(e).hasMessageContaining("pal_bright");
    }

    @Test
    @Tag("unit")
    void nonConstantNametableArgumentsAreUnsupported() {
        UnsupportedInstructionException e = failure(new IlAssembler()
                .ldc(1).stloc(0)
                .ldloc(0).ldc(2).call("NTADR_A"));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_INSTRUCTION);
    }

    // endregion

    // region Locals and arithmetic

    @Test
    @Tag("unit")
    void byteLocalIsAllocatedAtTheStartOfLocalRam() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(5).stloc(0)
                .ldloc(0).call("pal_bright")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x05), abs(STA, 0x0324),
                abs(LDA, 0x0324), jsr("pal_bright"),
                imp(RTS));
        assertThat(result.localBytes()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void wordLocalTakesTwoBytes() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(1).stloc(0)
                .ldc(0x2042).stloc(1)
                .ldloc(1).call("vram_adr")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x01), abs(STA, 0x0324),
                imm(LDX, 0x20), imm(LDA, 0x42), abs(STA, 0x0325), abs(STX, 0x0326),
                abs(LDA, 0x0325), abs(LDX, 0x0326), jsr("vram_adr"),
                imp(RTS));
        assertThat(result.localBytes()).isEqualTo(3);
    }

    @Test
    @Tag("unit")
    void localReadBeforeStoreIsRejected() {
        UnsupportedInstructionException e = failure(new IlAssembler().ldloc(2).call("pal_bright"));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNINITIALIZED_LOCAL);
        assertThat(e.getOffset()).isZero();
    }

    @Test
    @Tag("unit")
    void wordStoredIntoByteLocalIsRejected() {
        UnsupportedInstructionException e = failure(new IlAssembler()
                .ldc(1).stloc(0)
                .ldc(0x1234).stloc(0));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_INSTRUCTION);
        assertThat(e.getInstruction()).isEqualTo("stloc.0");
    }

    @Test
    @Tag("unit")
    void localsAreLimitedToTheReservedRam() throws Exception {
        IlAssembler fits = new IlAssembler();
        for (int i = 0; i < 110; i++) {
            fits.ldc(0x1234).stloc(i);
        }
        assertThat(translate(fits).localBytes()).isEqualTo(220);

        IlAssembler overflows = new IlAssembler();
        for (int i = 0; i < 111; i++) {
            overflows.ldc(0x1234).stloc(i);
        }
        assertThat(failure(overflows)).hasMessageContaining("RAM");
    }

    @Test
    @Tag("unit")
    void constantExpressionsFold() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(3).ldc(4).op(IlOpcode.ADD).ldc(2).op(IlOpcode.MUL)
                .ldc(1).op(IlOpcode.SHL)
                .call("pal_bright")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(imm(LDA, 28), jsr("pal_bright"), imp(RTS));
    }

    @Test
    @Tag("unit")
    void conversionToByteTruncatesConstants() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0x1234).op(IlOpcode.CONV_U1)
                .call("pal_bright")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(imm(LDA, 0x34), jsr("pal_bright"), imp(RTS));
    }

    @Test
    @Tag("unit")
    void divisionByConstantZeroIsRejected() {
        UnsupportedInstructionException e = failure(new IlAssembler()
                .ldc(4).ldc(0).op(IlOpcode.DIV));

        assertThat(e).hasMessageContaining("division by zero");
    }

    @Test
    @Tag("unit")
    void runtimeAdditionUsesTheAccumulator() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(1).stloc(0)
                .ldloc(0).ldc(1).op(IlOpcode.ADD).stloc(0)
                .ldc(8).ldloc(0).op(IlOpcode.AND).call("pal_bright")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x01), abs(STA, 0x0324),
                abs(LDA, 0x0324), imp(CLC), imm(ADC, 0x01), abs(STA, 0x0324),
                abs(LDA, 0x0324), imm(AND, 0x08), jsr("pal_bright"),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void runtimeShiftRepeatsTheShiftInstruction() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0x40).stloc(0)
                .ldloc(0).ldc(2).op(IlOpcode.SHR_UN).stloc(0)
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x40), abs(STA, 0x0324),
                abs(LDA, 0x0324), acc(LSR), acc(LSR), abs(STA, 0x0324),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void runtimeMultiplicationIsUnsupported() {
        UnsupportedInstructionException e = failure(new IlAssembler()
                .ldc(1).stloc(0)
                .ldloc(0).ldc(3).op(IlOpcode.MUL));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_INSTRUCTION);
        assertThat(e.getInstruction()).isEqualTo("mul");
    }

    @Test
    @Tag("unit")
    void instructionWithoutRuleIsUnsupported() {
        UnsupportedInstructionException e = failure(new IlAssembler().ldc(1).op(IlOpcode.LDNULL));

        assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNSUPPORTED_INSTRUCTION);
        assertThat(e.getInstruction()).isEqualTo("ldnull");
        assertThat(e.getOffset()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void discardingACallResultIsReported() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0).call("pad_poll").op(IlOpcode.POP)
                .ldc(1).op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(imm(LDA, 0x00), jsr("pad_poll"), imp(RTS));
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::type)
                .containsExactly(Diagnostic.Type.WARNING, Diagnostic.Type.WARNING);
        assertThat(diagnostics.getDiagnostics().get(0).offset()).isEqualTo(6);
    }

    // endregion

    // region Control flow

    @Test
    @Tag("unit")
    void countingLoopComparesUnsigned() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0).stloc(0)
                .label("top")
                .ldloc(0).ldc(1).op(IlOpcode.ADD).stloc(0)
                .ldloc(0).ldc(10).branch(IlOpcode.BLT_S, "top")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x00), abs(STA, 0x0324),
                abs(LDA, 0x0324), imp(CLC), imm(ADC, 0x01), abs(STA, 0x0324),
                abs(LDA, 0x0324), imm(CMP, 10), longBranch(BCC, "@IL_0002"),
                imp(RTS));
        assertThat(result.main().items()).contains(new BlockItem.Mark("@IL_0002"));
    }

    @Test
    @Tag("unit")
    void greaterThanComparesWithTheNextValue() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(7).stloc(0)
                .ldloc(0).ldc(5).branch(IlOpcode.BGT_S, "end")
                .ldc(5).ldloc(0).branch(IlOpcode.BLT_S, "end")
                .label("end")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x07), abs(STA, 0x0324),
                abs(LDA, 0x0324), imm(CMP, 6), longBranch(BCS, "@IL_000A"),
                abs(LDA, 0x0324), imm(CMP, 6), longBranch(BCS, "@IL_000A"),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void brfalseOnALocalUsesTheLoadFlags() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(1).stloc(0)
                .ldloc(0).branch(IlOpcode.BRFALSE_S, "end")
                .op(IlOpcode.NOP)
                .label("end")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x01), abs(STA, 0x0324),
                abs(LDA, 0x0324), longBranch(BEQ, "@IL_0006"),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void brtrueOnACallResultComparesWithZero() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(0).call("pad_poll").branch(IlOpcode.BRTRUE_S, "end")
                .label("end")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(
                imm(LDA, 0x00), jsr("pad_poll"), imm(CMP, 0x00), longBranch(BNE, "@IL_0008"),
                imp(RTS));
    }

    @Test
    @Tag("unit")
    void constantConditionsFoldAway() throws Exception {
        TranslationResult result = translate(new IlAssembler()
                .ldc(2).ldc(1).branch(IlOpcode.BLT_S, "end")
                .ldc(1).ldc(2).branch(IlOpcode.BLT_S, "end")
                .ldc(0).branch(IlOpcode.BRTRUE_S, "end")
                .label("end")
                .op(IlOpcode.RET));

        assertThat(result.main().instructions()).containsExactly(jmp("@IL_000B"), imp(RTS));
    }

    @Test
    @Tag("unit")
    void branchIntoAnInstructionIsRejected() {
        byte[] body = {0x20, 0x34, 0x12, 0x00, 0x00, 0x2B, (byte) 0xFB};

        assertThatThrownBy(() -> translate(body, new MetadataTable()))
                .isInstanceOfSatisfying(UnsupportedInstructionException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.INVALID_BRANCH_TARGET);
                    assertThat(e.getOffset()).isEqualTo(5);
                });
    }

    @Test
    @Tag("unit")
    void valuesOnTheStackAtABranchTargetAreUnsupported() {
        UnsupportedInstructionException e = failure(new IlAssembler()
                .ldc(1)
                .label("target")
                .ldc(2)
                .branch(IlOpcode.BR_S, "target"));

        assertThat(e.getOffset()).isEqualTo(1);
        assertThat(e).hasMessageContaining("branch target");
    }

    // endregion
}
