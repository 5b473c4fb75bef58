package org.dotnes.compiler.catalog;

/**
 * Memory map of the NES runtime: neslib zero page variables, RAM buffers and hardware registers.
 */
public final class NesConstants {

    private NesConstants() {}

    // region Zero page
    public static final int ZP_START = 0x00;
    public static final int STARTUP = 0x01;
    public static final int NES_PRG_BANKS = 0x02;
    public static final int VRAM_UPDATE = 0x03;
    public static final int NAME_UPD_ADR = 0x04;
    public static final int NAME_UPD_ENABLE = 0x06;
    public static final int PAL_UPDATE = 0x07;
    public static final int PAL_BG_PTR = 0x08;
    public static final int PAL_SPR_PTR = 0x0A;
    public static final int SCROLL_X = 0x0C;
    public static final int SCROLL_Y = 0x0D;
    public static final int PRG_FILEOFFS = 0x10;
    public static final int PPU_MASK_VAR = 0x12;
    /** A {@code JMP} instruction patched at startup; the NMI handler calls it. */
    public static final int NMI_CALLBACK = 0x14;
    public static final int TEMP = 0x17;
    /** cc65 software stack pointer. */
    public static final int SP = 0x22;
    public static final int PTR1 = 0x2A;
    public static final int PTR2 = 0x2C;
    public static final int TMP1 = 0x32;
    // endregion

    // region RAM
    public static final int PAL_BUF = 0x01C0;
    public static final int OAM_BUF = 0x0200;
    /** Constructor/destructor dispatcher copied to RAM by the C runtime. */
    public static final int CONDES = 0x0300;
    /** First RAM address handed out to local variables. */
    public static final int LOCALS_START = 0x0324;
    /** End (exclusive) of the local variable area. */
    public static final int LOCALS_END = 0x0400;
    // endregion

    // region PPU registers
    public static final int PPU_CTRL = 0x2000;
    public static final int PPU_MASK = 0x2001;
    public static final int PPU_STATUS = 0x2002;
    public static final int PPU_OAM_ADDR = 0x2003;
    public static final int PPU_OAM_DATA = 0x2004;
    public static final int PPU_SCROLL = 0x2005;
    public static final int PPU_ADDR = 0x2006;
    public static final int PPU_DATA = 0x2007;
    // endregion

    // region APU and I/O registers
    public static final int DMC_FREQ = 0x4010;
    public static final int PPU_OAM_DMA = 0x4014;
    public static final int JOYPAD1 = 0x4016;
    public static final int PPU_FRAMECNT = 0x4017;
    // endregion
}
