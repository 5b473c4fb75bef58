package org.dotnes.compiler.backend.link;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.SubroutineNotFoundException;
import org.dotnes.compiler.backend.layout.AddressResolver;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.LayoutResult;
import org.dotnes.compiler.backend.layout.Program;
import org.dotnes.compiler.catalog.Section;
import org.dotnes.compiler.catalog.Subroutine;
import org.dotnes.compiler.catalog.SubroutineCatalog;
import org.dotnes.compiler.diagnostics.Diagnostic;
import org.dotnes.compiler.diagnostics.DiagnosticsEngine;
import org.dotnes.compiler.frontend.BytecodeReader;
import org.dotnes.compiler.frontend.IlAssembler;
import org.dotnes.compiler.frontend.IlOpcode;
import org.dotnes.compiler.translate.InstructionTranslator;
import org.dotnes.compiler.translate.TranslationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.dotnes.compiler.isa.Asm.imp;
import static org.dotnes.compiler.isa.Asm.jsr;
import static org.dotnes.compiler.isa.Opcode.RTS;

public class LinkerTest {

    private SubroutineCatalog catalog;
    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        catalog = SubroutineCatalog.initialize();
        diagnostics = new DiagnosticsEngine();
    }

    private TranslationResult translateHello() throws CompilationException {
        IlAssembler il = IlAssembler.hello();
        return new InstructionTranslator(catalog, diagnostics)
                .translate(new BytecodeReader().read(il.bytes(), il.metadata()));
    }

    @Test
    @Tag("unit")
    void linksHelloInCanonicalOrder() throws Exception {
        Program program = new Linker(catalog, diagnostics).link(translateHello(), 0x8000);

        List<String> labels = program.blocks().stream().map(Block::label).toList();
        assertThat(labels.get(0)).isEqualTo("_exit");
        assertThat(labels).containsSubsequence("nmi", "irq", "pal_col", "main", "donelib", "popax", "incsp2",
                "popa", "pusha", "pushax", "zerobss", "string_0", "__DESTRUCTOR_TABLE__");
        assertThat(labels).doesNotContain("pad_poll", "oam_spr");
        assertThat(labels.get(labels.size() - 1)).isEqualTo("__DESTRUCTOR_TABLE__");
        assertThat(labels.get(labels.size() - 2)).isEqualTo("string_0");
        assertThat(labels.indexOf("initlib") + 1).isEqualTo(labels.indexOf("main"));
    }

    @Test
    @Tag("unit")
    void linkedHelloMatchesTheReferenceAddresses() throws Exception {
        Program program = new Linker(catalog, diagnostics).link(translateHello(), 0x8000);

        LayoutResult layout = new AddressResolver().resolve(program);

        assertThat(layout.addressOf("_exit")).isEqualTo(0x8000);
        assertThat(layout.addressOf("nmi")).isEqualTo(0x80BC);
        assertThat(layout.addressOf("irq")).isEqualTo(0x8202);
        assertThat(layout.addressOf("pal_col")).isEqualTo(0x823E);
        assertThat(layout.addressOf("ppu_on_all")).isEqualTo(0x8289);
        assertThat(layout.addressOf("vram_write")).isEqualTo(0x834F);
        assertThat(layout.addressOf("vram_adr")).isEqualTo(0x83D4);
        assertThat(layout.addressOf("initlib")).isEqualTo(0x84F4);
        assertThat(layout.addressOf("main")).isEqualTo(0x8500);
        assertThat(layout.addressOf("donelib")).isEqualTo(0x8543);
        assertThat(layout.addressOf("copydata")).isEqualTo(0x854F);
        assertThat(layout.addressOf("popax")).isEqualTo(0x857C);
        assertThat(layout.addressOf("incsp2")).isEqualTo(0x8584);
        assertThat(layout.addressOf("popa")).isEqualTo(0x8592);
        assertThat(layout.addressOf("pusha")).isEqualTo(0x85A2);
        assertThat(layout.addressOf("pushax")).isEqualTo(0x85B8);
        assertThat(layout.addressOf("string_0")).isEqualTo(0x85F1);
        assertThat(layout.addressOf("__DESTRUCTOR_TABLE__")).isEqualTo(0x85FE);
        assertThat(layout.addressOf("main:@IL_003A")).isEqualTo(0x8540);
        assertThat(layout.totalSize()).isEqualTo(0x623);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void optionalRoutinesAreLinkedWhenCalled() throws Exception {
        IlAssembler il = new IlAssembler()
                .ldc(0).call("pad_poll").stloc(0)
                .op(IlOpcode.RET);
        TranslationResult translation = new InstructionTranslator(catalog, diagnostics)
                .translate(new BytecodeReader().read(il.bytes(), il.metadata()));

        Program program = new Linker(catalog, diagnostics).link(translation, 0x8000);

        int main = program.indexOf("main");
        int padPoll = program.indexOf("pad_poll");
        assertThat(padPoll).isGreaterThan(program.indexOf("zerobss"));
        assertThat(padPoll).isGreaterThan(main);
        assertThat(program.indexOf("oam_spr")).isEqualTo(-1);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void optionalRoutineReachedOnlyThroughADependencyIsNoted() throws Exception {
        SubroutineCatalog small = new SubroutineCatalog();
        small.register(new Subroutine("start", Section.LIBRARY, List.of("helper"), null,
                p -> new Block("start").emit(jsr("helper")).emit(imp(RTS))));
        small.register(new Subroutine("helper", Section.OPTIONAL, List.of(), null,
                p -> new Block("helper").emit(imp(RTS))));
        TranslationResult translation = new TranslationResult(
                new Block("main").emit(imp(RTS)), List.of(), List.of(), Set.of(), 0);

        Program program = new Linker(small, diagnostics).link(translation, 0xC000);

        assertThat(program.blocks()).extracting(Block::label).containsExactly("start", "main", "helper");
        assertThat(program.baseAddress()).isEqualTo(0xC000);
        assertThat(diagnostics.getDiagnostics())
                .containsExactly(new Diagnostic(Diagnostic.Type.INFO, "Linked helper as a dependency", -1));
    }

    @Test
    @Tag("unit")
    void callToAnUncatalogedRoutineFailsToLink() {
        SubroutineCatalog empty = new SubroutineCatalog();
        TranslationResult translation = new TranslationResult(
                new Block("main").emit(jsr("pal_col")), List.of(), List.of(), Set.of("pal_col"), 0);

        assertThatThrownBy(() -> new Linker(empty, diagnostics).link(translation, 0x8000))
                .isInstanceOf(SubroutineNotFoundException.class)
                .hasMessage("No subroutine named pal_col");
    }

    @Test
    @Tag("unit")
    void separatedFallThroughPairIsALayoutViolation() throws Exception {
        List<Subroutine> linked = catalog.closure(List.of());
        Program program = new Linker(catalog, diagnostics).link(translateHello(), 0x8000);
        Linker.verifyFallThrough(program, linked);

        program.move(program.indexOf("incsp2"), program.blocks().size() - 1);

        assertThatThrownBy(() -> Linker.verifyFallThrough(program, linked))
                .isInstanceOfSatisfying(CompilationException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.LAYOUT_VIOLATION);
                    assertThat(e).hasMessageContaining("popax falls through to incsp2");
                });
    }
}
