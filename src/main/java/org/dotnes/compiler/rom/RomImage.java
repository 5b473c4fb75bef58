package org.dotnes.compiler.rom;

import java.util.Arrays;

/**
 * A complete cartridge image: header, code banks and tile banks.
 */
public final class RomImage {

    private final RomHeader header;
    private final byte[] prg;
    private final byte[] chr;

    RomImage(RomHeader header, byte[] prg, byte[] chr) {
        if (prg.length != header.prgBanks() * RomHeader.PRG_BANK_SIZE) {
            throw new IllegalArgumentException("PRG size " + prg.length + " does not match the header");
        }
        if (chr.length != header.chrBanks() * RomHeader.CHR_BANK_SIZE) {
            throw new IllegalArgumentException("CHR size " + chr.length + " does not match the header");
        }
        this.header = header;
        this.prg = prg.clone();
        this.chr = chr.clone();
    }

    public RomHeader header() {
        return header;
    }

    /**
     * @return A copy of the code banks, vector table included.
     */
    public byte[] prg() {
        return prg.clone();
    }

    /**
     * @return A copy of the tile banks.
     */
    public byte[] chr() {
        return chr.clone();
    }

    public int size() {
        return RomHeader.SIZE + prg.length + chr.length;
    }

    /**
     * @return The image as written to a {@code .nes} file.
     */
    public byte[] toBytes() {
        byte[] bytes = Arrays.copyOf(header.toBytes(), size());
        System.arraycopy(prg, 0, bytes, RomHeader.SIZE, prg.length);
        System.arraycopy(chr, 0, bytes, RomHeader.SIZE + prg.length, chr.length);
        return bytes;
    }
}
