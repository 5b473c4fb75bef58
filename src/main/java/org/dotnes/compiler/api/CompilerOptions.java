package org.dotnes.compiler.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.dotnes.compiler.rom.Mirroring;

/**
 * Build options that affect the produced image.
 *
 * @param mirroring Header mirroring flag.
 * @param prgBanks Number of 16 KiB code banks.
 * @param chrBanks Number of 8 KiB tile banks.
 */
public record CompilerOptions(Mirroring mirroring, int prgBanks, int chrBanks) {

    /**
     * @return Horizontal mirroring, two code banks and one tile bank.
     */
    public static CompilerOptions defaults() {
        return new CompilerOptions(Mirroring.HORIZONTAL, 2, 1);
    }

    /**
     * Reads the options from the {@code rom} block of the {@code dotnes} configuration.
     *
     * @param config The {@code dotnes} configuration block.
     * @return The options.
     * @throws CompilationException if a value is missing or invalid.
     */
    public static CompilerOptions fromConfig(Config config) throws CompilationException {
        try {
            Config rom = config.getConfig("rom");
            return new CompilerOptions(
                    Mirroring.parse(rom.getString("mirroring")),
                    rom.getInt("prg-banks"),
                    rom.getInt("chr-banks"));
        } catch (ConfigException | IllegalArgumentException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_CONFIGURATION,
                    "Invalid ROM configuration: " + e.getMessage(), e);
        }
    }

    /**
     * @param newMirroring The mirroring to use.
     * @return A copy with the given mirroring.
     */
    public CompilerOptions withMirroring(Mirroring newMirroring) {
        return new CompilerOptions(newMirroring, prgBanks, chrBanks);
    }
}
