package org.dotnes.compiler.catalog;

import org.dotnes.compiler.backend.layout.Block;

import static org.dotnes.compiler.catalog.NesConstants.*;
import static org.dotnes.compiler.isa.Asm.*;
import static org.dotnes.compiler.isa.Opcode.*;

/**
 * Block factories for the neslib and cc65 runtime routines.
 * <p>
 * Each routine reproduces the machine code of the reference toolchain instruction for instruction.
 * Addresses of other routines and tables are label references, so the bytes match the reference
 * when the blocks are laid out in canonical order, and still link correctly in any other order.
 * Branches inside a routine keep their fixed displacements.
 */
final class RuntimeRoutines {

    private RuntimeRoutines() {}

    // region Reset and initialization (crt0)

    static Block exit() {
        return new Block("_exit")
                .emit(imp(SEI))
                .emit(imm(LDX, 0xFF))
                .emit(imp(TXS))
                .emit(imp(INX))
                .emit(abs(STX, PPU_MASK))
                .emit(abs(STX, DMC_FREQ))
                .emit(abs(STX, PPU_CTRL));
    }

    /** Waits for two vblanks. */
    static Block initPpu() {
        return new Block("_initPPU")
                .emit(abs(BIT, PPU_STATUS))
                .emit(abs(BIT, PPU_STATUS), "@1")
                .emit(branch(BPL, -5))
                .emit(abs(BIT, PPU_STATUS), "@2")
                .emit(branch(BPL, -5))
                .emit(imm(LDA, 0x40))
                .emit(abs(STA, PPU_FRAMECNT));
    }

    static Block clearPalette() {
        return new Block("_clearPalette")
                .emit(imm(LDA, 0x3F))
                .emit(abs(STA, PPU_ADDR))
                .emit(abs(STX, PPU_ADDR))
                .emit(imm(LDA, 0x0F))
                .emit(imm(LDX, 0x20))
                .emit(abs(STA, PPU_DATA), "@1")
                .emit(imp(DEX))
                .emit(branch(BNE, -6));
    }

    static Block clearVram() {
        return new Block("_clearVRAM")
                .emit(imp(TXA))
                .emit(imm(LDY, 0x20))
                .emit(abs(STY, PPU_ADDR))
                .emit(abs(STA, PPU_ADDR))
                .emit(imm(LDY, 0x10))
                .emit(abs(STA, PPU_DATA), "@1")
                .emit(imp(INX))
                .emit(branch(BNE, -6))
                .emit(imp(DEY))
                .emit(branch(BNE, -9));
    }

    /**
     * Clears RAM, sets up palette, OAM, the C runtime and the NMI callback. The callback is
     * initialized to {@code JMP} the {@code RTS} of {@code nmi_set_callback}.
     */
    static Block clearRam() {
        Block block = new Block("clearRAM")
                .emit(imp(TXA))
                .emit(zpX(STA, 0x00), "@loop");
        for (int page = 0x0100; page <= 0x0700; page += 0x0100) {
            block.emit(absX(STA, page));
        }
        return block
                .emit(imp(INX))
                .emit(branch(BNE, -26))
                .emit(imm(LDA, 0x04))
                .emit(jsr("pal_bright"))
                .emit(jsr("pal_clear"))
                .emit(jsr("oam_clear"))
                .emit(jsr("zerobss"))
                .emit(jsr("copydata"))
                .emit(imm(LDA, 0x00))
                .emit(zp(STA, SP))
                .emit(imm(LDA, 0x08))
                .emit(zp(STA, SP + 1))
                .emit(jsr("initlib"))
                .emit(imm(LDA, 0x4C))
                .emit(zp(STA, NMI_CALLBACK))
                .emit(lowByte(LDA, "nmi_set_callback", 4))
                .emit(zp(STA, NMI_CALLBACK + 1))
                .emit(highByte(LDA, "nmi_set_callback", 4))
                .emit(zp(STA, NMI_CALLBACK + 2))
                .emit(imm(LDA, 0x80))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(abs(STA, PPU_CTRL))
                .emit(imm(LDA, 0x06))
                .emit(zp(STA, PPU_MASK_VAR));
    }

    static Block waitSync3() {
        return new Block("_waitSync3")
                .emit(zp(LDA, STARTUP))
                .emit(zp(CMP, STARTUP))
                .emit(branch(BEQ, -4));
    }

    /** Delay loop, PAL/NTSC detection, then enters {@code main}. */
    static Block detectNtsc() {
        return new Block("detectNTSC")
                .emit(imm(LDX, 0x34))
                .emit(imm(LDY, 0x18))
                .emit(imp(DEX), "@loop")
                .emit(branch(BNE, -3))
                .emit(imp(DEY))
                .emit(branch(BNE, -6))
                .emit(abs(LDA, PPU_STATUS))
                .emit(imm(AND, 0x80))
                .emit(zp(STA, ZP_START))
                .emit(jsr("ppu_off"))
                .emit(imm(LDA, 0x00))
                .emit(abs(STA, PPU_SCROLL))
                .emit(abs(STA, PPU_SCROLL))
                .emit(abs(STA, PPU_OAM_ADDR))
                .emit(jmp(RuntimeLabels.MAIN));
    }

    // endregion

    // region NMI and IRQ handlers

    static Block nmi() {
        return new Block(RuntimeLabels.NMI)
                .emit(imp(PHA))
                .emit(imp(TXA))
                .emit(imp(PHA))
                .emit(imp(TYA))
                .emit(imp(PHA))
                .emit(zp(LDA, PPU_MASK_VAR))
                .emit(imm(AND, 0x18))
                .emit(branch(BNE, 3))
                .emit(jmp("skipAll"));
    }

    static Block doUpdate() {
        return new Block("doUpdate")
                .emit(imm(LDA, OAM_BUF >> 8))
                .emit(abs(STA, PPU_OAM_DMA))
                .emit(zp(LDA, PAL_UPDATE))
                .emit(branch(BNE, 3))
                .emit(jmp("updVRAM"));
    }

    /** Copies the palette buffer to the PPU through the brightness tables. */
    static Block updPal() {
        Block block = new Block("updPal")
                .emit(imm(LDX, 0x00))
                .emit(zp(STX, PAL_UPDATE))
                .emit(imm(LDA, 0x3F))
                .emit(abs(STA, PPU_ADDR))
                .emit(abs(STX, PPU_ADDR))
                .emit(abs(LDY, PAL_BUF))
                .emit(indY(LDA, PAL_BG_PTR))
                .emit(abs(STA, PPU_DATA))
                .emit(imp(TAX));
        for (int i = 1; i <= 3; i++) {
            copyColor(block, PAL_BUF + i, PAL_BG_PTR);
        }
        for (int j = 1; j <= 3; j++) {
            block.emit(abs(STX, PPU_DATA));
            for (int i = 1; i <= 3; i++) {
                copyColor(block, PAL_BUF + j * 4 + i, PAL_BG_PTR);
            }
        }
        for (int j = 1; j <= 4; j++) {
            block.emit(abs(STX, PPU_DATA));
            for (int i = 1; i <= 3; i++) {
                copyColor(block, PAL_BUF + 12 + j * 4 + i, PAL_SPR_PTR);
            }
        }
        return block;
    }

    private static void copyColor(Block block, int source, int table) {
        block.emit(abs(LDY, source))
                .emit(indY(LDA, table))
                .emit(abs(STA, PPU_DATA));
    }

    static Block updVram() {
        return new Block("updVRAM")
                .emit(zp(LDA, VRAM_UPDATE))
                .emit(branch(BEQ, 11))
                .emit(imm(LDA, 0x00))
                .emit(zp(STA, VRAM_UPDATE))
                .emit(zp(LDA, NAME_UPD_ENABLE))
                .emit(branch(BEQ, 3))
                .emit(jsr("_flush_vram_update_nmi"));
    }

    static Block skipUpd() {
        return new Block("skipUpd")
                .emit(imm(LDA, 0x00))
                .emit(abs(STA, PPU_ADDR))
                .emit(abs(STA, PPU_ADDR))
                .emit(zp(LDA, SCROLL_X))
                .emit(abs(STA, PPU_SCROLL))
                .emit(zp(LDA, SCROLL_Y))
                .emit(abs(STA, PPU_SCROLL))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(abs(STA, PPU_CTRL));
    }

    static Block skipAll() {
        return new Block("skipAll")
                .emit(zp(LDA, PPU_MASK_VAR))
                .emit(abs(STA, PPU_MASK))
                .emit(zp(INC, STARTUP))
                .emit(zp(INC, NES_PRG_BANKS))
                .emit(zp(LDA, NES_PRG_BANKS))
                .emit(imm(CMP, 0x06))
                .emit(branch(BNE, 4))
                .emit(imm(LDA, 0x00))
                .emit(zp(STA, NES_PRG_BANKS));
    }

    static Block skipNtsc() {
        return new Block("skipNtsc")
                .emit(jsr(NMI_CALLBACK))
                .emit(imp(PLA))
                .emit(imp(TAY))
                .emit(imp(PLA))
                .emit(imp(TAX))
                .emit(imp(PLA))
                .emit(imp(RTI));
    }

    static Block irq() {
        return new Block(RuntimeLabels.IRQ)
                .emit(imp(PHA))
                .emit(imp(TXA))
                .emit(imp(PHA))
                .emit(imp(TYA))
                .emit(imp(PHA))
                .emit(imm(LDA, 0xFF))
                .emit(jmp("skipNtsc"));
    }

    static Block nmiSetCallback() {
        return new Block("nmi_set_callback")
                .emit(zp(STA, NMI_CALLBACK + 1))
                .emit(zp(STX, NMI_CALLBACK + 2))
                .emit(imp(RTS));
    }

    // endregion

    // region Palette

    /** Falls through into {@code pal_copy}. */
    static Block palAll() {
        return new Block("pal_all")
                .emit(zp(STA, TEMP))
                .emit(zp(STX, TEMP + 1))
                .emit(imm(LDX, 0x00))
                .emit(imm(LDA, 0x20));
    }

    static Block palCopy() {
        return new Block("pal_copy")
                .emit(zp(STA, TEMP + 2))
                .emit(imm(LDY, 0x00))
                .emit(indY(LDA, TEMP), "@0")
                .emit(absX(STA, PAL_BUF))
                .emit(imp(INX))
                .emit(imp(INY))
                .emit(zp(DEC, TEMP + 2))
                .emit(branch(BNE, -11))
                .emit(zp(INC, PAL_UPDATE))
                .emit(imp(RTS));
    }

    static Block palBg() {
        return new Block("pal_bg")
                .emit(zp(STA, TEMP))
                .emit(zp(STX, TEMP + 1))
                .emit(imm(LDX, 0x00))
                .emit(imm(LDA, 0x10))
                .emit(branch(BNE, "pal_copy"));
    }

    static Block palSpr() {
        return new Block("pal_spr")
                .emit(zp(STA, TEMP))
                .emit(zp(STX, TEMP + 1))
                .emit(imm(LDX, 0x10))
                .emit(imp(TXA))
                .emit(branch(BNE, "pal_copy"));
    }

    static Block palCol() {
        return new Block("pal_col")
                .emit(zp(STA, TEMP))
                .emit(jsr(RuntimeLabels.POPA))
                .emit(imm(AND, 0x1F))
                .emit(imp(TAX))
                .emit(zp(LDA, TEMP))
                .emit(absX(STA, PAL_BUF))
                .emit(zp(INC, PAL_UPDATE))
                .emit(imp(RTS));
    }

    static Block palClear() {
        return new Block("pal_clear")
                .emit(imm(LDA, 0x0F))
                .emit(imm(LDX, 0x00))
                .emit(absX(STA, PAL_BUF), "@1")
                .emit(imp(INX))
                .emit(imm(CPX, 0x20))
                .emit(branch(BNE, -8))
                .emit(zp(STX, PAL_UPDATE))
                .emit(imp(RTS));
    }

    static Block palSprBright() {
        return palBright("pal_spr_bright", PAL_SPR_PTR);
    }

    static Block palBgBright() {
        return palBright("pal_bg_bright", PAL_BG_PTR);
    }

    private static Block palBright(String name, int pointer) {
        return new Block(name)
                .emit(imp(TAX))
                .emit(absX(LDA, PaletteTables.POINTER_TABLE, 0))
                .emit(zp(STA, pointer))
                .emit(absX(LDA, PaletteTables.POINTER_TABLE, PaletteTables.TABLE_COUNT))
                .emit(zp(STA, pointer + 1))
                .emit(zp(STA, PAL_UPDATE))
                .emit(imp(RTS));
    }

    static Block palBright() {
        return new Block("pal_bright")
                .emit(jsr("pal_spr_bright"))
                .emit(imp(TXA))
                .emit(jmp("pal_bg_bright"));
    }

    // endregion

    // region PPU control

    static Block ppuOff() {
        return new Block("ppu_off")
                .emit(zp(LDA, PPU_MASK_VAR))
                .emit(imm(AND, 0xE7))
                .emit(zp(STA, PPU_MASK_VAR))
                .emit(jmp("ppu_wait_nmi"));
    }

    /** Falls through into {@code ppu_onoff}. */
    static Block ppuOnAll() {
        return new Block("ppu_on_all")
                .emit(zp(LDA, PPU_MASK_VAR))
                .emit(imm(ORA, 0x18));
    }

    static Block ppuOnOff() {
        return new Block("ppu_onoff")
                .emit(zp(STA, PPU_MASK_VAR))
                .emit(jmp("ppu_wait_nmi"));
    }

    static Block ppuOnBg() {
        return ppuOn("ppu_on_bg", 0x08);
    }

    static Block ppuOnSpr() {
        return ppuOn("ppu_on_spr", 0x10);
    }

    private static Block ppuOn(String name, int bits) {
        return new Block(name)
                .emit(zp(LDA, PPU_MASK_VAR))
                .emit(imm(ORA, bits))
                .emit(branch(BNE, "ppu_onoff"));
    }

    static Block ppuMask() {
        return new Block("ppu_mask")
                .emit(zp(STA, PPU_MASK_VAR))
                .emit(imp(RTS));
    }

    static Block ppuSystem() {
        return new Block("ppu_system")
                .emit(zp(LDA, ZP_START))
                .emit(imm(LDX, 0x00))
                .emit(imp(RTS));
    }

    static Block getPpuCtrlVar() {
        return new Block("get_ppu_ctrl_var")
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(LDX, 0x00))
                .emit(imp(RTS));
    }

    static Block setPpuCtrlVar() {
        return new Block("set_ppu_ctrl_var")
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(imp(RTS));
    }

    static Block ppuWaitFrame() {
        return new Block("ppu_wait_frame")
                .emit(imm(LDA, 0x01))
                .emit(zp(STA, VRAM_UPDATE))
                .emit(zp(LDA, STARTUP))
                .emit(zp(CMP, STARTUP), "@1")
                .emit(branch(BEQ, -4))
                .emit(zp(LDA, ZP_START))
                .emit(branch(BEQ, 6), "@2")
                .emit(zp(LDA, NES_PRG_BANKS))
                .emit(imm(CMP, 0x05), "@loop")
                .emit(branch(BEQ, -6))
                .emit(imp(RTS));
    }

    static Block ppuWaitNmi() {
        return new Block("ppu_wait_nmi")
                .emit(imm(LDA, 0x01))
                .emit(zp(STA, VRAM_UPDATE))
                .emit(zp(LDA, STARTUP))
                .emit(zp(CMP, STARTUP), "@1")
                .emit(branch(BEQ, -4))
                .emit(imp(RTS));
    }

    // endregion

    // region OAM

    static Block oamClear() {
        return new Block("oam_clear")
                .emit(imm(LDX, 0x00))
                .emit(imm(LDA, 0xFF))
                .emit(absX(STA, OAM_BUF), "@1")
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(branch(BNE, -9))
                .emit(imp(RTS));
    }

    static Block oamSize() {
        return new Block("oam_size")
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(imm(AND, 0x20))
                .emit(zp(STA, TEMP))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(AND, 0xDF))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(imp(RTS));
    }

    static Block oamHideRest() {
        return new Block("oam_hide_rest")
                .emit(imp(TAX))
                .emit(imm(LDA, 0xF0))
                .emit(absX(STA, OAM_BUF), "@1")
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(imp(INX))
                .emit(branch(BNE, -9))
                .emit(imp(RTS));
    }

    /** Stores one sprite (x, y, tile, attributes) at the OAM offset in A; returns the next offset. */
    static Block oamSpr() {
        return new Block("oam_spr")
                .emit(imp(TAX))
                .emit(imm(LDY, 0x00))
                .emit(indY(LDA, SP))
                .emit(imp(INY))
                .emit(absX(STA, OAM_BUF + 2))
                .emit(indY(LDA, SP))
                .emit(imp(INY))
                .emit(absX(STA, OAM_BUF + 1))
                .emit(indY(LDA, SP))
                .emit(imp(INY))
                .emit(absX(STA, OAM_BUF))
                .emit(indY(LDA, SP))
                .emit(absX(STA, OAM_BUF + 3))
                .emit(zp(LDA, SP))
                .emit(imp(CLC))
                .emit(imm(ADC, 0x04))
                .emit(zp(STA, SP))
                .emit(branch(BCC, 2))
                .emit(zp(INC, SP + 1))
                .emit(imp(TXA), "@1")
                .emit(imp(CLC))
                .emit(imm(ADC, 0x04))
                .emit(imm(LDX, 0x00))
                .emit(imp(RTS));
    }

    // endregion

    // region Scroll and banks

    static Block scroll() {
        return new Block("scroll")
                .emit(zp(STA, TEMP))
                .emit(imp(TXA))
                .emit(branch(BNE, 0x0E))
                .emit(zp(LDA, TEMP))
                .emit(imm(CMP, 0xF0))
                .emit(branch(BCS, 0x08))
                .emit(zp(STA, SCROLL_Y))
                .emit(imm(LDA, 0x00))
                .emit(zp(STA, TEMP))
                .emit(branch(BEQ, 0x0B))
                .emit(imp(SEC), "@1")
                .emit(zp(LDA, TEMP))
                .emit(imm(SBC, 0xF0))
                .emit(zp(STA, SCROLL_Y))
                .emit(imm(LDA, 0x02))
                .emit(zp(STA, TEMP))
                .emit(jsr(RuntimeLabels.POPAX), "@2")
                .emit(zp(STA, SCROLL_X))
                .emit(imp(TXA))
                .emit(imm(AND, 0x01))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, TEMP))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(AND, 0xFC))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(imp(RTS));
    }

    static Block bankSpr() {
        return new Block("bank_spr")
                .emit(imm(AND, 0x01))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(zp(STA, TEMP))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(AND, 0xF7))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(imp(RTS));
    }

    static Block bankBg() {
        return new Block("bank_bg")
                .emit(imm(AND, 0x01))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(acc(ASL))
                .emit(zp(STA, TEMP))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(AND, 0xEF))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(imp(RTS));
    }

    // endregion

    // region VRAM

    static Block vramWrite() {
        return new Block("vram_write")
                .emit(zp(STA, TEMP))
                .emit(zp(STX, TEMP + 1))
                .emit(jsr(RuntimeLabels.POPAX))
                .emit(zp(STA, TEMP + 2))
                .emit(zp(STX, TEMP + 3))
                .emit(imm(LDY, 0x00))
                .emit(indY(LDA, TEMP + 2), "@1")
                .emit(abs(STA, PPU_DATA))
                .emit(zp(INC, TEMP + 2))
                .emit(branch(BNE, 0x02))
                .emit(zp(INC, TEMP + 3))
                .emit(zp(LDA, TEMP))
                .emit(branch(BNE, 0x02))
                .emit(zp(DEC, TEMP + 1))
                .emit(zp(DEC, TEMP))
                .emit(zp(LDA, TEMP))
                .emit(zp(ORA, TEMP + 1))
                .emit(branch(BNE, -25))
                .emit(imp(RTS));
    }

    static Block setVramUpdate() {
        return new Block("set_vram_update")
                .emit(zp(STA, NAME_UPD_ADR))
                .emit(zp(STX, NAME_UPD_ADR + 1))
                .emit(zp(ORA, NAME_UPD_ADR + 1))
                .emit(zp(STA, NAME_UPD_ENABLE))
                .emit(imp(RTS));
    }

    /**
     * Processes a VRAM update buffer: single bytes, horizontal and vertical runs, terminated by
     * {@code $FF}. The NMI handler enters at {@code _flush_vram_update_nmi}.
     */
    static Block flushVramUpdate() {
        return new Block("flush_vram_update")
                .emit(zp(STA, NAME_UPD_ADR))
                .emit(zp(STX, NAME_UPD_ADR + 1))
                .emit(imm(LDY, 0x00), "_flush_vram_update_nmi")
                .emit(indY(LDA, NAME_UPD_ADR), "updName")
                .emit(imp(INY))
                .emit(imm(CMP, 0x40))
                .emit(branch(BCS, 0x12))
                .emit(abs(STA, PPU_ADDR))
                .emit(indY(LDA, NAME_UPD_ADR))
                .emit(imp(INY))
                .emit(abs(STA, PPU_ADDR))
                .emit(indY(LDA, NAME_UPD_ADR))
                .emit(imp(INY))
                .emit(abs(STA, PPU_DATA))
                .emit(jmp("updName"))
                .emit(imp(TAX), "@updNotSeq")
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(CPX, 0x80))
                .emit(branch(BCC, 0x08))
                .emit(imm(CPX, 0xFF))
                .emit(branch(BEQ, 0x2A))
                .emit(imm(ORA, 0x04), "@updVertSeq")
                .emit(branch(BNE, 0x02))
                .emit(imm(AND, 0xFB), "@updHorzSeq")
                .emit(abs(STA, PPU_CTRL), "@updNameSeq")
                .emit(imp(TXA))
                .emit(imm(AND, 0x3F))
                .emit(abs(STA, PPU_ADDR))
                .emit(indY(LDA, NAME_UPD_ADR))
                .emit(imp(INY))
                .emit(abs(STA, PPU_ADDR))
                .emit(indY(LDA, NAME_UPD_ADR))
                .emit(imp(INY))
                .emit(imp(TAX))
                .emit(indY(LDA, NAME_UPD_ADR), "@updNameLoop")
                .emit(imp(INY))
                .emit(abs(STA, PPU_DATA))
                .emit(imp(DEX))
                .emit(branch(BNE, -9))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(abs(STA, PPU_CTRL))
                .emit(jmp("updName"))
                .emit(imp(RTS), "@updDone");
    }

    static Block vramAdr() {
        return new Block("vram_adr")
                .emit(abs(STX, PPU_ADDR))
                .emit(abs(STA, PPU_ADDR))
                .emit(imp(RTS));
    }

    static Block vramPut() {
        return new Block("vram_put")
                .emit(abs(STA, PPU_DATA))
                .emit(imp(RTS));
    }

    static Block vramFill() {
        return new Block("vram_fill")
                .emit(zp(STA, TEMP + 2))
                .emit(zp(STX, TEMP + 3))
                .emit(jsr(RuntimeLabels.POPA))
                .emit(zp(LDX, TEMP + 3))
                .emit(branch(BEQ, 0x0C))
                .emit(imm(LDX, 0x00), "@1")
                .emit(abs(STA, PPU_DATA), "@2")
                .emit(imp(DEX))
                .emit(branch(BNE, -6))
                .emit(zp(DEC, TEMP + 3))
                .emit(branch(BNE, -10))
                .emit(zp(LDX, TEMP + 2), "@3")
                .emit(branch(BEQ, 0x06))
                .emit(abs(STA, PPU_DATA))
                .emit(imp(DEX))
                .emit(branch(BNE, -6))
                .emit(imp(RTS), "@4");
    }

    static Block vramInc() {
        return new Block("vram_inc")
                .emit(imm(ORA, 0x00))
                .emit(branch(BEQ, 0x02))
                .emit(imm(LDA, 0x04))
                .emit(zp(STA, TEMP))
                .emit(zp(LDA, PRG_FILEOFFS))
                .emit(imm(AND, 0xFB))
                .emit(zp(ORA, TEMP))
                .emit(zp(STA, PRG_FILEOFFS))
                .emit(abs(STA, PPU_CTRL))
                .emit(imp(RTS));
    }

    // endregion

    // region Timing

    static Block nesclock() {
        return new Block("nesclock")
                .emit(zp(LDA, STARTUP))
                .emit(imm(LDX, 0x00))
                .emit(imp(RTS));
    }

    static Block delay() {
        return new Block("delay")
                .emit(imp(TAX))
                .emit(jsr("ppu_wait_nmi"), "@1")
                .emit(imp(DEX))
                .emit(branch(BNE, -6))
                .emit(imp(RTS));
    }

    // endregion

    // region C runtime (cc65)

    /** Runs the constructor table; the reference program has none, so Y=0 skips it. */
    static Block initlib() {
        return new Block("initlib")
                .emit(imm(LDY, 0x00))
                .emit(branch(BEQ, 7))
                .emit(imm(LDA, 0x00))
                .emit(imm(LDX, 0x85))
                .emit(jmp(CONDES))
                .emit(imp(RTS));
    }

    static Block donelib() {
        return new Block("donelib")
                .emit(imm(LDY, 0x00))
                .emit(branch(BEQ, 7))
                .emit(lowByte(LDA, RuntimeLabels.DESTRUCTOR_TABLE))
                .emit(highByte(LDX, RuntimeLabels.DESTRUCTOR_TABLE))
                .emit(jmp(CONDES))
                .emit(imp(RTS));
    }

    /** Copies the DATA segment, which starts after the literal data, to RAM at $0300. */
    static Block copydata() {
        return new Block("copydata")
                .emit(lowByte(LDA, RuntimeLabels.DESTRUCTOR_TABLE))
                .emit(zp(STA, PTR1))
                .emit(highByte(LDA, RuntimeLabels.DESTRUCTOR_TABLE))
                .emit(zp(STA, PTR1 + 1))
                .emit(imm(LDA, 0x00))
                .emit(zp(STA, PTR2))
                .emit(imm(LDA, 0x03))
                .emit(zp(STA, PTR2 + 1))
                .emit(imm(LDX, 0xDA))
                .emit(imm(LDA, 0xFF))
                .emit(zp(STA, TMP1))
                .emit(imm(LDY, 0x00))
                .emit(imp(INX), "@loop1")
                .emit(branch(BEQ, 13))
                .emit(indY(LDA, PTR1), "@copyLoop")
                .emit(indY(STA, PTR2))
                .emit(imp(INY))
                .emit(branch(BNE, -10))
                .emit(zp(INC, PTR1 + 1))
                .emit(zp(INC, PTR2 + 1))
                .emit(branch(BNE, -16))
                .emit(zp(INC, TMP1), "@incTmp")
                .emit(branch(BNE, -17))
                .emit(imp(RTS));
    }

    /** Falls through into {@code incsp2}. */
    static Block popax() {
        return new Block(RuntimeLabels.POPAX)
                .emit(imm(LDY, 0x01))
                .emit(indY(LDA, SP))
                .emit(imp(TAX))
                .emit(imp(DEY))
                .emit(indY(LDA, SP));
    }

    static Block incsp2() {
        return new Block("incsp2")
                .emit(zp(INC, SP))
                .emit(branch(BEQ, 5))
                .emit(zp(INC, SP))
                .emit(branch(BEQ, 3))
                .emit(imp(RTS))
                .emit(zp(INC, SP))
                .emit(zp(INC, SP + 1))
                .emit(imp(RTS));
    }

    static Block popa() {
        return new Block(RuntimeLabels.POPA)
                .emit(imm(LDY, 0x00))
                .emit(indY(LDA, SP))
                .emit(zp(INC, SP))
                .emit(branch(BEQ, 1))
                .emit(imp(RTS))
                .emit(zp(INC, SP + 1))
                .emit(imp(RTS));
    }

    /** {@code pusha0sp} and {@code pushaysp} precede the {@code pusha} entry point. */
    static Block pusha() {
        return new Block(RuntimeLabels.PUSHA, 4)
                .emit(imm(LDY, 0x00))
                .emit(indY(LDA, SP))
                .emit(zp(LDY, SP))
                .emit(branch(BEQ, 7))
                .emit(zp(DEC, SP))
                .emit(imm(LDY, 0x00))
                .emit(indY(STA, SP))
                .emit(imp(RTS))
                .emit(zp(DEC, SP + 1))
                .emit(zp(DEC, SP))
                .emit(indY(STA, SP))
                .emit(imp(RTS));
    }

    /** {@code push0} and {@code pusha0} precede the {@code pushax} entry point. */
    static Block pushax() {
        return new Block(RuntimeLabels.PUSHAX, 4)
                .emit(imm(LDA, 0x00))
                .emit(imm(LDX, 0x00))
                .emit(imp(PHA))
                .emit(zp(LDA, SP))
                .emit(imp(SEC))
                .emit(imm(SBC, 0x02))
                .emit(zp(STA, SP))
                .emit(branch(BCS, 2))
                .emit(zp(DEC, SP + 1))
                .emit(imm(LDY, 0x01))
                .emit(imp(TXA))
                .emit(indY(STA, SP))
                .emit(imp(PLA))
                .emit(imp(DEY))
                .emit(indY(STA, SP))
                .emit(imp(RTS));
    }

    /**
     * Clears the BSS segment.
     *
     * @param localBytes Number of RAM bytes used by local variables.
     */
    static Block zerobss(int localBytes) {
        return new Block("zerobss")
                .emit(imm(LDA, 0x25))
                .emit(zp(STA, PTR1))
                .emit(imm(LDA, 0x03))
                .emit(zp(STA, PTR1 + 1))
                .emit(imm(LDA, 0x00))
                .emit(imp(TAY))
                .emit(imm(LDX, 0x00))
                .emit(branch(BEQ, 10))
                .emit(indY(STA, PTR1), "@zeroLoop")
                .emit(imp(INY))
                .emit(branch(BNE, -5))
                .emit(zp(INC, PTR1 + 1))
                .emit(imp(DEX))
                .emit(branch(BNE, -10))
                .emit(imm(CPY, localBytes), "@checkDone")
                .emit(branch(BEQ, 5))
                .emit(indY(STA, PTR1))
                .emit(imp(INY))
                .emit(branch(BNE, -9))
                .emit(imp(RTS));
    }

    /** Dispatcher copied to RAM by {@code copydata}; its operands are patched at run time. */
    static Block destructorTable() {
        return new Block(RuntimeLabels.DESTRUCTOR_TABLE)
                .emit(abs(STA, 0x030E))
                .emit(abs(STX, 0x030F))
                .emit(abs(STA, 0x0315))
                .emit(abs(STX, 0x0316))
                .emit(imp(DEY), "@loop")
                .emit(absY(LDA, 0xFFFF))
                .emit(abs(STA, 0x031F))
                .emit(imp(DEY))
                .emit(absY(LDA, 0xFFFF))
                .emit(abs(STA, 0x031E))
                .emit(abs(STY, 0x0321))
                .emit(jsr(0xFFFF))
                .emit(imm(LDY, 0xFF))
                .emit(branch(BNE, -24))
                .emit(imp(RTS));
    }

    // endregion

    // region Controller

    /**
     * Reads pad A or B (index in A) twice and keeps a stable reading; also updates the trigger and
     * state arrays at $3C/$3E/$40.
     */
    static Block padPoll() {
        return new Block("pad_poll")
                .emit(imp(TAY))
                .emit(imm(LDX, 0x00))
                .emit(imm(LDA, 0x01), "@padPollPort")
                .emit(abs(STA, JOYPAD1))
                .emit(imm(LDA, 0x00))
                .emit(abs(STA, JOYPAD1))
                .emit(imm(LDA, 0x08))
                .emit(zp(STA, TEMP))
                .emit(absY(LDA, JOYPAD1), "@padPollLoop")
                .emit(acc(LSR))
                .emit(zpX(ROR, TEMP + 1))
                .emit(zp(DEC, TEMP))
                .emit(branch(BNE, -10))
                .emit(imp(INX))
                .emit(imm(CPX, 0x03))
                .emit(branch(BNE, -29))
                .emit(zp(LDA, TEMP + 1))
                .emit(zp(CMP, TEMP + 2))
                .emit(branch(BEQ, 6))
                .emit(zp(CMP, TEMP + 3))
                .emit(branch(BEQ, 2))
                .emit(zp(LDA, TEMP + 2))
                .emit(absY(STA, 0x003C), "@done")
                .emit(imp(TAX))
                .emit(absY(EOR, 0x003E))
                .emit(absY(AND, 0x003C))
                .emit(absY(STA, 0x0040))
                .emit(imp(TXA))
                .emit(absY(STA, 0x003E))
                .emit(imm(LDX, 0x00))
                .emit(imp(RTS));
    }

    // endregion
}
