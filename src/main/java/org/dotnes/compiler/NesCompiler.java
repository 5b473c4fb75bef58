package org.dotnes.compiler;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.CompilerInput;
import org.dotnes.compiler.api.CompilerOptions;
import org.dotnes.compiler.api.ICompiler;
import org.dotnes.compiler.api.RomArtifact;
import org.dotnes.compiler.backend.emit.Disassembler;
import org.dotnes.compiler.backend.emit.Emitter;
import org.dotnes.compiler.backend.layout.AddressResolver;
import org.dotnes.compiler.backend.layout.LayoutResult;
import org.dotnes.compiler.backend.layout.Program;
import org.dotnes.compiler.backend.link.Linker;
import org.dotnes.compiler.catalog.SubroutineCatalog;
import org.dotnes.compiler.diagnostics.CompilerLogger;
import org.dotnes.compiler.diagnostics.DiagnosticsEngine;
import org.dotnes.compiler.frontend.BytecodeReader;
import org.dotnes.compiler.frontend.StructuredInstruction;
import org.dotnes.compiler.rom.RomAssembler;
import org.dotnes.compiler.rom.RomImage;
import org.dotnes.compiler.translate.InstructionTranslator;
import org.dotnes.compiler.translate.TranslationResult;

import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from an IL method body
 * to a cartridge image. Each call to {@link #compile(CompilerInput, CompilerOptions)} works on
 * fresh state; the instance only holds the verbosity. It is not thread-safe.
 */
public class NesCompiler implements ICompiler {

    private int verbosity = -1;

    @Override
    public RomArtifact compile(CompilerInput input, CompilerOptions options) throws CompilationException {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            // Phase 1: Decoding
            List<StructuredInstruction> instructions = new BytecodeReader().read(input.ilBody(), input.metadata());

            // Phase 2: Translation (stack shapes, locals, literals)
            SubroutineCatalog catalog = SubroutineCatalog.initialize();
            TranslationResult translation = new InstructionTranslator(catalog, diagnostics).translate(instructions);

            // Phase 3: Linking (runtime closure, canonical order)
            Program program = new Linker(catalog, diagnostics).link(translation, Program.DEFAULT_BASE_ADDRESS);

            // Phase 4: Address resolution and branch relaxation
            LayoutResult layout = new AddressResolver().resolve(program);

            // Phase 5: Emission
            byte[] code = new Emitter().emit(program, layout);
            String listing = new Disassembler().listing(program, layout);

            // Phase 6: ROM assembly
            RomImage image = new RomAssembler(options.prgBanks(), options.chrBanks(), options.mirroring())
                    .assemble(code, layout, input.chr());

            CompilerLogger.info(String.format("Compiled: main %d bytes, %d local bytes, PRG %d bytes",
                    translation.main().size(), translation.localBytes(), code.length));
            return new RomArtifact(image, translation.main().size(), translation.localBytes(), code.length,
                    layout.labelToAddress(), listing, diagnostics.getDiagnostics());
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new CompilationException(CompilerErrorCode.UNKNOWN_ERROR, "Internal compiler error: " + e.getMessage(), e);
        }
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }
}
