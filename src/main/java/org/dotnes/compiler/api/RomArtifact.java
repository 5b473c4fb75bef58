package org.dotnes.compiler.api;

import org.dotnes.compiler.diagnostics.Diagnostic;
import org.dotnes.compiler.rom.RomImage;

import java.util.List;
import java.util.Map;

/**
 * The result of a successful compilation.
 *
 * @param image The cartridge image.
 * @param mainSize Size of the translated user code in bytes.
 * @param localBytes RAM bytes occupied by local variables.
 * @param codeSize Size of the whole code region in bytes.
 * @param labels Every global label and its address.
 * @param listing An assembler listing of the code region.
 * @param diagnostics Non-fatal findings.
 */
public record RomArtifact(
        RomImage image,
        int mainSize,
        int localBytes,
        int codeSize,
        Map<String, Integer> labels,
        String listing,
        List<Diagnostic> diagnostics
) {
    public RomArtifact {
        labels = Map.copyOf(labels);
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The image as written to a {@code .nes} file.
     */
    public byte[] toBytes() {
        return image.toBytes();
    }
}
