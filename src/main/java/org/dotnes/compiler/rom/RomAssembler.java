package org.dotnes.compiler.rom;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.backend.layout.LayoutResult;
import org.dotnes.compiler.catalog.RuntimeLabels;
import org.dotnes.compiler.diagnostics.CompilerLogger;

/**
 * Serializes an emitted code region and a tile blob into a {@link RomImage}.
 * <p>
 * The code starts at the first PRG byte and is zero-padded up to the vector table, which occupies
 * the last six bytes of the last bank (CPU {@code $FFFA}): NMI, RESET and IRQ, little endian.
 * The tile blob is zero-padded to the CHR banks.
 */
public final class RomAssembler {

    /** Size of the NMI, RESET and IRQ vector table. */
    public static final int VECTOR_TABLE_SIZE = 6;

    private final int prgBanks;
    private final int chrBanks;
    private final Mirroring mirroring;

    /**
     * @param prgBanks Number of 16 KiB code banks, 1 or 2.
     * @param chrBanks Number of 8 KiB tile banks.
     * @param mirroring Nametable mirroring for the header.
     */
    public RomAssembler(int prgBanks, int chrBanks, Mirroring mirroring) {
        this.prgBanks = prgBanks;
        this.chrBanks = chrBanks;
        this.mirroring = mirroring;
    }

    /**
     * Assembles the image.
     *
     * @param code The emitted code region.
     * @param layout The layout the code was emitted with; supplies the vector targets.
     * @param chr The tile data, at most the size of the CHR banks.
     * @return The image.
     * @throws CompilationException if the code or the tile data do not fit, or a vector label is
     *         missing.
     */
    public RomImage assemble(byte[] code, LayoutResult layout, byte[] chr) throws CompilationException {
        RomHeader header;
        try {
            header = new RomHeader(prgBanks, chrBanks, mirroring);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(CompilerErrorCode.INVALID_CONFIGURATION, e.getMessage(), e);
        }
        int prgSize = prgBanks * RomHeader.PRG_BANK_SIZE;
        int chrSize = chrBanks * RomHeader.CHR_BANK_SIZE;
        if (code.length > prgSize - VECTOR_TABLE_SIZE) {
            throw new CompilationException(CompilerErrorCode.PRG_OVERFLOW, String.format(
                    "Code region of %d bytes exceeds the %d bytes available in %d PRG bank(s)",
                    code.length, prgSize - VECTOR_TABLE_SIZE, prgBanks));
        }
        if (chr.length > chrSize) {
            throw new CompilationException(CompilerErrorCode.CHR_TOO_LARGE, String.format(
                    "Tile data of %d bytes exceeds %d CHR bank(s) of %d bytes", chr.length, chrBanks,
                    RomHeader.CHR_BANK_SIZE));
        }

        byte[] prg = new byte[prgSize];
        System.arraycopy(code, 0, prg, 0, code.length);
        int vectors = prgSize - VECTOR_TABLE_SIZE;
        putWord(prg, vectors, layout.addressOf(RuntimeLabels.NMI));
        putWord(prg, vectors + 2, layout.addressOf(RuntimeLabels.RESET));
        putWord(prg, vectors + 4, layout.addressOf(RuntimeLabels.IRQ));

        byte[] paddedChr = new byte[chrSize];
        System.arraycopy(chr, 0, paddedChr, 0, chr.length);

        RomImage image = new RomImage(header, prg, paddedChr);
        CompilerLogger.debug(String.format("RomAssembler: %d code bytes, %d free, %s mirroring, %d bytes total",
                code.length, vectors - code.length, mirroring, image.size()));
        return image;
    }

    private static void putWord(byte[] bytes, int offset, int value) {
        bytes[offset] = (byte) value;
        bytes[offset + 1] = (byte) (value >> 8);
    }
}
