package org.dotnes.compiler.rom;

/**
 * The 16-byte iNES header.
 *
 * @param prgBanks Number of 16 KiB code banks.
 * @param chrBanks Number of 8 KiB tile banks.
 * @param mirroring Selects bit 0 of Flags6.
 */
public record RomHeader(int prgBanks, int chrBanks, Mirroring mirroring) {

    public static final int SIZE = 16;
    public static final int PRG_BANK_SIZE = 0x4000;
    public static final int CHR_BANK_SIZE = 0x2000;

    private static final byte[] MAGIC = {'N', 'E', 'S', 0x1A};

    public RomHeader {
        if (prgBanks < 1 || prgBanks > 2) {
            throw new IllegalArgumentException("prgBanks must be 1 or 2: " + prgBanks);
        }
        if (chrBanks < 1 || chrBanks > 0xFF) {
            throw new IllegalArgumentException("chrBanks must be in 1..255: " + chrBanks);
        }
    }

    /**
     * @return Flags6 of the header; mapper 0, bit 0 set for vertical mirroring.
     */
    public int flags6() {
        return mirroring == Mirroring.VERTICAL ? 0x01 : 0x00;
    }

    public byte[] toBytes() {
        byte[] bytes = new byte[SIZE];
        System.arraycopy(MAGIC, 0, bytes, 0, MAGIC.length);
        bytes[4] = (byte) prgBanks;
        bytes[5] = (byte) chrBanks;
        bytes[6] = (byte) flags6();
        return bytes;
    }
}
