package org.dotnes.compiler.backend.link;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.Program;
import org.dotnes.compiler.catalog.RuntimeParameters;
import org.dotnes.compiler.catalog.Section;
import org.dotnes.compiler.catalog.Subroutine;
import org.dotnes.compiler.catalog.SubroutineCatalog;
import org.dotnes.compiler.diagnostics.CompilerLogger;
import org.dotnes.compiler.diagnostics.DiagnosticsEngine;
import org.dotnes.compiler.translate.TranslationResult;

import java.util.List;

/**
 * Linking pass: selects the runtime routines a translation needs and arranges them with the user
 * code into a {@link Program} in canonical order.
 * <p>
 * The order is: library routines, {@code main}, the runtime tail, optional routines, byte array
 * literals, string literals and finally the destructor table. Within a section the catalog's
 * registration order applies.
 */
public final class Linker {

    private final SubroutineCatalog catalog;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new linker.
     * @param catalog The catalog to link against.
     * @param diagnostics Collector for notes about linked routines.
     */
    public Linker(SubroutineCatalog catalog, DiagnosticsEngine diagnostics) {
        this.catalog = catalog;
        this.diagnostics = diagnostics;
    }

    /**
     * Links a translated program.
     *
     * @param translation The user code and its literals.
     * @param baseAddress The load address of the first block.
     * @return A program ready for address resolution.
     * @throws CompilationException if a called routine is not cataloged or a fall-through pair was
     *         separated.
     */
    public Program link(TranslationResult translation, int baseAddress) throws CompilationException {
        List<Subroutine> linked = catalog.closure(translation.calledRoutines());
        RuntimeParameters parameters = new RuntimeParameters(translation.localBytes());
        for (Subroutine subroutine : linked) {
            if (subroutine.section() == Section.OPTIONAL && !translation.calledRoutines().contains(subroutine.name())) {
                diagnostics.reportInfo("Linked " + subroutine.name() + " as a dependency");
            }
        }

        Program program = new Program(baseAddress);
        program.addAll(SubroutineCatalog.blocksFor(linked, Section.LIBRARY, parameters));
        program.add(translation.main());
        program.addAll(SubroutineCatalog.blocksFor(linked, Section.RUNTIME, parameters));
        program.addAll(SubroutineCatalog.blocksFor(linked, Section.OPTIONAL, parameters));
        program.addAll(translation.byteArrays());
        program.addAll(translation.strings());
        program.addAll(SubroutineCatalog.blocksFor(linked, Section.TRAILER, parameters));

        verifyFallThrough(program, linked);
        CompilerLogger.debug(String.format("Linker: %d routines, %d blocks, %d bytes",
                linked.size(), program.blocks().size(), program.totalSize()));
        return program;
    }

    /**
     * Checks that every routine ending without a jump is directly followed by its successor.
     */
    static void verifyFallThrough(Program program, List<Subroutine> linked) throws CompilationException {
        for (Subroutine subroutine : linked) {
            String successor = subroutine.fallsThroughTo();
            if (successor == null) {
                continue;
            }
            int index = program.indexOf(subroutine.name());
            List<Block> blocks = program.blocks();
            if (index < 0 || index + 1 >= blocks.size() || !successor.equals(blocks.get(index + 1).label())) {
                throw new CompilationException(CompilerErrorCode.LAYOUT_VIOLATION,
                        subroutine.name() + " falls through to " + successor + " but is not followed by it");
            }
        }
    }
}
