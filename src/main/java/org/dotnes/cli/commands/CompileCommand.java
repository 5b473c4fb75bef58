package org.dotnes.cli.commands;

import com.fasterxml.jackson.core.JacksonException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.dotnes.cli.CommandLineInterface;
import org.dotnes.cli.input.ProgramInputFile;
import org.dotnes.compiler.NesCompiler;
import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.CompilerInput;
import org.dotnes.compiler.api.CompilerOptions;
import org.dotnes.compiler.api.RomArtifact;
import org.dotnes.compiler.diagnostics.Diagnostic;
import org.dotnes.compiler.rom.Mirroring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * The {@code compile} subcommand: reads a JSON program description and a tile file, compiles them
 * and writes the ROM and, on request, a listing. Nothing is written unless every output could be
 * prepared.
 */
@Command(name = "compile", mixinStandardHelpOptions = true,
        description = "Compiles a program description and tile data into an iNES ROM.")
public class CompileCommand implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_BAD_INPUT = 1;
    public static final int EXIT_IO = 2;
    public static final int EXIT_UNSUPPORTED = 3;
    public static final int EXIT_INTERNAL = 4;

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-i", "--input"}, required = true, description = "The program description (JSON).")
    private Path input;

    @Option(names = {"-c", "--chr"}, required = true, description = "The tile data, copied into the CHR bank.")
    private Path chr;

    @Option(names = {"-o", "--output"}, required = true, description = "The ROM file to write.")
    private Path output;

    @Option(names = "--vertical", description = "Declare vertical mirroring instead of the configured one.")
    private boolean vertical;

    @Option(names = "--listing", description = "Also write an assembler listing to this file.")
    private Path listing;

    @Option(names = {"-v", "--verbosity"}, description = "Compiler log level, 0 (errors) to 4 (trace).")
    private Integer verbosity;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilerInput compilerInput;
        try {
            ProgramInputFile program = ProgramInputFile.read(input);
            compilerInput = new CompilerInput(program.ilBytes(), program.metadata(), Files.readAllBytes(chr));
        } catch (JacksonException | IllegalArgumentException e) {
            err.println("Invalid program description " + input + ": " + e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_IO;
        }

        try {
            Config config = parent.getConfig().getConfig("dotnes");
            CompilerOptions options = CompilerOptions.fromConfig(config);
            if (vertical) {
                options = options.withMirroring(Mirroring.VERTICAL);
            }
            NesCompiler compiler = new NesCompiler();
            compiler.setVerbosity(verbosity != null ? verbosity : config.getInt("compiler.verbosity"));

            RomArtifact artifact = compiler.compile(compilerInput, options);
            Map<Path, byte[]> files = new LinkedHashMap<>();
            files.put(output, artifact.toBytes());
            if (listing != null) {
                files.put(listing, artifact.listing().getBytes(StandardCharsets.US_ASCII));
            }
            writeAllAtomically(files);
            for (Diagnostic diagnostic : artifact.diagnostics()) {
                err.println(diagnostic);
            }
            out.printf("Wrote %s: main %d bytes, %d local bytes, code %d bytes, ROM %d bytes%n",
                    output, artifact.mainSize(), artifact.localBytes(), artifact.codeSize(), artifact.image().size());
            return EXIT_OK;
        } catch (CompilationException e) {
            err.println("Compilation failed [" + e.getErrorCode() + "]: " + e.getMessage());
            LOGGER.debug("Compilation failed", e);
            return exitCodeFor(e.getErrorCode());
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_UNSUPPORTED;
        } catch (IOException e) {
            err.println("Cannot write output: " + e.getMessage());
            return EXIT_IO;
        }
    }

    /**
     * @param code The error a compilation failed with.
     * @return The process exit code for it.
     */
    public static int exitCodeFor(CompilerErrorCode code) {
        switch (code.category()) {
            case BAD_INPUT:
                return EXIT_BAD_INPUT;
            case UNIMPLEMENTED:
            case CONFIGURATION:
                return EXIT_UNSUPPORTED;
            default:
                return EXIT_INTERNAL;
        }
    }

    /**
     * Writes to a temporary file next to the target and moves it into place, so the target is
     * either complete or untouched.
     */
    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        writeAllAtomically(Map.of(target, bytes));
    }

    /**
     * Stages every file next to its target first and moves them into place only once all of them
     * are written. A failure while staging leaves every target untouched.
     */
    static void writeAllAtomically(Map<Path, byte[]> files) throws IOException {
        Map<Path, Path> staged = new LinkedHashMap<>();
        try {
            for (Map.Entry<Path, byte[]> file : files.entrySet()) {
                Path absolute = file.getKey().toAbsolutePath();
                Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
                staged.put(temp, absolute);
                Files.write(temp, file.getValue());
            }
            for (Map.Entry<Path, Path> move : staged.entrySet()) {
                moveIntoPlace(move.getKey(), move.getValue());
            }
        } finally {
            for (Path temp : staged.keySet()) {
                Files.deleteIfExists(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
