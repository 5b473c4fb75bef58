package org.dotnes.compiler.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The external call targets a program may use, with the argument shape the translator validates
 * before it selects a translation rule.
 * <p>
 * Several constants may share one {@link #externalName()}; they are overloads told apart by the
 * shape of the evaluation stack at the call.
 */
public enum LibraryFunction {

    // region Palette
    PAL_ALL("pal_all", ReturnWidth.VOID, ArgumentKind.DATA),
    PAL_BG("pal_bg", ReturnWidth.VOID, ArgumentKind.DATA),
    PAL_SPR("pal_spr", ReturnWidth.VOID, ArgumentKind.DATA),
    PAL_COL("pal_col", ReturnWidth.VOID, ArgumentKind.BYTE, ArgumentKind.BYTE),
    PAL_CLEAR("pal_clear", ReturnWidth.VOID),
    PAL_BRIGHT("pal_bright", ReturnWidth.VOID, ArgumentKind.BYTE),
    PAL_SPR_BRIGHT("pal_spr_bright", ReturnWidth.VOID, ArgumentKind.BYTE),
    PAL_BG_BRIGHT("pal_bg_bright", ReturnWidth.VOID, ArgumentKind.BYTE),
    // endregion

    // region PPU
    PPU_WAIT_NMI("ppu_wait_nmi", ReturnWidth.VOID),
    PPU_WAIT_FRAME("ppu_wait_frame", ReturnWidth.VOID),
    PPU_OFF("ppu_off", ReturnWidth.VOID),
    PPU_ON_ALL("ppu_on_all", ReturnWidth.VOID),
    PPU_ON_BG("ppu_on_bg", ReturnWidth.VOID),
    PPU_ON_SPR("ppu_on_spr", ReturnWidth.VOID),
    PPU_MASK("ppu_mask", ReturnWidth.VOID, ArgumentKind.BYTE),
    PPU_SYSTEM("ppu_system", ReturnWidth.BYTE),
    GET_PPU_CTRL_VAR("get_ppu_ctrl_var", ReturnWidth.BYTE),
    SET_PPU_CTRL_VAR("set_ppu_ctrl_var", ReturnWidth.VOID, ArgumentKind.BYTE),
    // endregion

    // region OAM and controller
    OAM_CLEAR("oam_clear", ReturnWidth.VOID),
    OAM_SIZE("oam_size", ReturnWidth.VOID, ArgumentKind.BYTE),
    OAM_SPR("oam_spr", ReturnWidth.BYTE,
            ArgumentKind.BYTE, ArgumentKind.BYTE, ArgumentKind.BYTE, ArgumentKind.BYTE, ArgumentKind.BYTE),
    OAM_HIDE_REST("oam_hide_rest", ReturnWidth.VOID, ArgumentKind.BYTE),
    PAD_POLL("pad_poll", ReturnWidth.BYTE, ArgumentKind.BYTE),
    // endregion

    // region VRAM, scroll and banks
    VRAM_ADR("vram_adr", ReturnWidth.VOID, ArgumentKind.WORD),
    VRAM_PUT("vram_put", ReturnWidth.VOID, ArgumentKind.BYTE),
    VRAM_FILL("vram_fill", ReturnWidth.VOID, ArgumentKind.BYTE, ArgumentKind.WORD),
    VRAM_INC("vram_inc", ReturnWidth.VOID, ArgumentKind.BYTE),
    VRAM_WRITE_SIZED("vram_write", ReturnWidth.VOID, ArgumentKind.DATA, ArgumentKind.WORD),
    VRAM_WRITE("vram_write", ReturnWidth.VOID, ArgumentKind.DATA_WITH_LENGTH),
    SET_VRAM_UPDATE("set_vram_update", ReturnWidth.VOID, ArgumentKind.DATA),
    FLUSH_VRAM_UPDATE("flush_vram_update", ReturnWidth.VOID, ArgumentKind.DATA),
    SCROLL("scroll", ReturnWidth.VOID, ArgumentKind.WORD, ArgumentKind.WORD),
    BANK_SPR("bank_spr", ReturnWidth.VOID, ArgumentKind.BYTE),
    BANK_BG("bank_bg", ReturnWidth.VOID, ArgumentKind.BYTE),
    // endregion

    // region Timing
    NESCLOCK("nesclock", ReturnWidth.BYTE),
    DELAY("delay", ReturnWidth.VOID, ArgumentKind.BYTE),
    // endregion

    // region Compile-time
    NTADR_A("NTADR_A", CallRule.FOLD_NAMETABLE, ReturnWidth.WORD, ArgumentKind.BYTE, ArgumentKind.BYTE),
    NTADR_B("NTADR_B", CallRule.FOLD_NAMETABLE, ReturnWidth.WORD, ArgumentKind.BYTE, ArgumentKind.BYTE),
    NTADR_C("NTADR_C", CallRule.FOLD_NAMETABLE, ReturnWidth.WORD, ArgumentKind.BYTE, ArgumentKind.BYTE),
    NTADR_D("NTADR_D", CallRule.FOLD_NAMETABLE, ReturnWidth.WORD, ArgumentKind.BYTE, ArgumentKind.BYTE),
    /** {@code RuntimeHelpers.InitializeArray(array, fieldHandle)}. */
    INITIALIZE_ARRAY("InitializeArray", CallRule.BIND_ARRAY, ReturnWidth.VOID, ArgumentKind.DATA, ArgumentKind.FIELD);
    // endregion

    /**
     * The kind of value a parameter accepts.
     */
    public enum ArgumentKind {
        /** An 8-bit value, passed in A. */
        BYTE,
        /** A 16-bit value, passed in A (low) and X (high). */
        WORD,
        /** The address of a literal data block. */
        DATA,
        /** The address of a literal data block followed by its length as a WORD. */
        DATA_WITH_LENGTH,
        /** A field handle naming the initial data of an array. */
        FIELD
    }

    /**
     * The width of the value a function leaves on the evaluation stack.
     */
    public enum ReturnWidth {
        VOID, BYTE, WORD
    }

    /**
     * How a call is translated.
     */
    public enum CallRule {
        /** Arguments are materialized and the runtime routine of the same name is called. */
        CALL,
        /** Both arguments are constants and the call is replaced by the computed nametable address. */
        FOLD_NAMETABLE,
        /** The array on the stack is bound to literal data; no code is emitted. */
        BIND_ARRAY
    }

    private static final Map<String, List<LibraryFunction>> BY_NAME = new LinkedHashMap<>();

    static {
        for (LibraryFunction function : values()) {
            BY_NAME.computeIfAbsent(function.externalName, k -> new ArrayList<>()).add(function);
        }
    }

    private final String externalName;
    private final CallRule rule;
    private final ReturnWidth returnWidth;
    private final List<ArgumentKind> arguments;

    LibraryFunction(String externalName, ReturnWidth returnWidth, ArgumentKind... arguments) {
        this(externalName, CallRule.CALL, returnWidth, arguments);
    }

    LibraryFunction(String externalName, CallRule rule, ReturnWidth returnWidth, ArgumentKind... arguments) {
        this.externalName = externalName;
        this.rule = rule;
        this.returnWidth = returnWidth;
        this.arguments = List.of(arguments);
    }

    /**
     * @return The name call instructions refer to; for {@link CallRule#CALL} also the routine label.
     */
    public String externalName() {
        return externalName;
    }

    public CallRule rule() {
        return rule;
    }

    public ReturnWidth returnWidth() {
        return returnWidth;
    }

    /**
     * @return The parameters, first parameter first.
     */
    public List<ArgumentKind> arguments() {
        return arguments;
    }

    public int arity() {
        return arguments.size();
    }

    /**
     * @param name An external call target name.
     * @return All overloads with that name, in declaration order; empty if the name is unknown.
     */
    public static List<LibraryFunction> overloads(String name) {
        return BY_NAME.getOrDefault(name, Collections.emptyList());
    }

    /**
     * The base address of the nametable a folding function addresses.
     * @return {@code $2000}, {@code $2400}, {@code $2800} or {@code $2C00}.
     */
    public int nametableBase() {
        switch (this) {
            case NTADR_A: return 0x2000;
            case NTADR_B: return 0x2400;
            case NTADR_C: return 0x2800;
            case NTADR_D: return 0x2C00;
            default: throw new IllegalStateException(name() + " does not address a nametable");
        }
    }

    /**
     * Evaluates a nametable address macro.
     *
     * @param x Tile column, 0..31.
     * @param y Tile row, 0..29.
     * @return {@code base | y << 5 | x}.
     */
    public int foldNametable(int x, int y) {
        return (nametableBase() | ((y << 5) | x)) & 0xFFFF;
    }
}
