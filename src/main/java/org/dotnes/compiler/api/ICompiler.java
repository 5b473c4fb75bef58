package org.dotnes.compiler.api;

/**
 * Defines the public interface of the IL to NES compiler.
 */
public interface ICompiler {

    /**
     * Compiles a program into a cartridge image.
     *
     * @param input The entry method, its metadata and the tile data.
     * @param options Image options.
     * @return The image and its metadata.
     * @throws CompilationException if any stage fails; no partial image is produced.
     */
    RomArtifact compile(CompilerInput input, CompilerOptions options) throws CompilationException;

    /**
     * Compiles with {@link CompilerOptions#defaults()}.
     * @param input The program.
     * @return The image and its metadata.
     * @throws CompilationException if any stage fails.
     */
    default RomArtifact compile(CompilerInput input) throws CompilationException {
        return compile(input, CompilerOptions.defaults());
    }

    /**
     * Sets the verbosity level for log output.
     * @param level 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4=TRACE.
     */
    void setVerbosity(int level);
}
