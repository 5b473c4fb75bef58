package org.dotnes.compiler.catalog;

import org.dotnes.compiler.api.SubroutineNotFoundException;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.diagnostics.CompilerLogger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The fixed library of runtime routines, keyed by label.
 * <p>
 * Entries are kept in canonical order: iterating a section yields its routines in the order the
 * reference toolchain places them.
 */
public final class SubroutineCatalog {

    private final Map<String, Subroutine> entries = new LinkedHashMap<>();

    /**
     * Registers a routine. Registration order is canonical order.
     * @param subroutine The routine.
     */
    public void register(Subroutine subroutine) {
        if (entries.putIfAbsent(subroutine.name(), subroutine) != null) {
            throw new IllegalArgumentException("Subroutine registered twice: " + subroutine.name());
        }
    }

    /**
     * @param name A routine label.
     * @return The routine, if cataloged.
     */
    public Optional<Subroutine> get(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @param name A routine label.
     * @return The routine.
     * @throws SubroutineNotFoundException if the catalog has no such routine.
     */
    public Subroutine find(String name) throws SubroutineNotFoundException {
        Subroutine subroutine = entries.get(name);
        if (subroutine == null) {
            throw new SubroutineNotFoundException(name);
        }
        return subroutine;
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    /**
     * @return All routines in canonical order.
     */
    public List<Subroutine> all() {
        return List.copyOf(entries.values());
    }

    /**
     * Computes the routines a program links: every library, runtime and trailer routine plus the
     * optional routines reachable from the names user code calls.
     *
     * @param usedNames Routine names called by user code.
     * @return The linked routines in canonical order.
     * @throws SubroutineNotFoundException if a name or a dependency is not cataloged.
     */
    public List<Subroutine> closure(Collection<String> usedNames) throws SubroutineNotFoundException {
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>(usedNames);
        for (Subroutine subroutine : entries.values()) {
            if (subroutine.section() != Section.OPTIONAL) {
                pending.add(subroutine.name());
            }
        }
        while (!pending.isEmpty()) {
            String name = pending.pop();
            if (!reached.add(name)) {
                continue;
            }
            Subroutine subroutine = find(name);
            pending.addAll(subroutine.dependencies());
            if (subroutine.fallsThroughTo() != null) {
                pending.add(subroutine.fallsThroughTo());
            }
        }
        List<Subroutine> linked = new ArrayList<>();
        for (Subroutine subroutine : entries.values()) {
            if (reached.contains(subroutine.name())) {
                linked.add(subroutine);
            }
        }
        CompilerLogger.trace("Catalog closure of " + usedNames + ": " + linked.size() + " routines");
        return linked;
    }

    /**
     * Creates the blocks of the given routines that belong to one section, in the given order.
     *
     * @param linked Routines as returned by {@link #closure(Collection)}.
     * @param section The section to select.
     * @param parameters Program-dependent parameters.
     * @return New blocks.
     */
    public static List<Block> blocksFor(List<Subroutine> linked, Section section, RuntimeParameters parameters) {
        List<Block> blocks = new ArrayList<>();
        for (Subroutine subroutine : linked) {
            if (subroutine.section() == section) {
                blocks.add(subroutine.createBlock(parameters));
            }
        }
        return blocks;
    }

    /**
     * Creates the catalog of the neslib and cc65 runtime.
     * @return A new catalog.
     */
    public static SubroutineCatalog initialize() {
        SubroutineCatalog catalog = new SubroutineCatalog();

        // region crt0
        catalog.library("_exit", RuntimeRoutines::exit, "_initPPU");
        catalog.library("_initPPU", RuntimeRoutines::initPpu, "_clearPalette");
        catalog.library("_clearPalette", RuntimeRoutines::clearPalette, "_clearVRAM");
        catalog.library("_clearVRAM", RuntimeRoutines::clearVram, "clearRAM");
        catalog.library("clearRAM", RuntimeRoutines::clearRam, "_waitSync3",
                "pal_bright", "pal_clear", "oam_clear", "zerobss", "copydata", "initlib", "nmi_set_callback");
        catalog.library("_waitSync3", RuntimeRoutines::waitSync3, "detectNTSC");
        catalog.library("detectNTSC", RuntimeRoutines::detectNtsc, null, "ppu_off");
        catalog.library(RuntimeLabels.NMI, RuntimeRoutines::nmi, "doUpdate", "skipAll");
        catalog.library("doUpdate", RuntimeRoutines::doUpdate, "updPal", "updVRAM");
        catalog.library("updPal", RuntimeRoutines::updPal, "updVRAM");
        catalog.library("updVRAM", RuntimeRoutines::updVram, "skipUpd", "flush_vram_update");
        catalog.library("skipUpd", RuntimeRoutines::skipUpd, "skipAll");
        catalog.library("skipAll", RuntimeRoutines::skipAll, "skipNtsc");
        catalog.library("skipNtsc", RuntimeRoutines::skipNtsc, null);
        catalog.library(RuntimeLabels.IRQ, RuntimeRoutines::irq, null, "skipNtsc");
        catalog.library("nmi_set_callback", RuntimeRoutines::nmiSetCallback, null);
        // endregion

        // region neslib
        catalog.library("pal_all", RuntimeRoutines::palAll, "pal_copy");
        catalog.library("pal_copy", RuntimeRoutines::palCopy, null);
        catalog.library("pal_bg", RuntimeRoutines::palBg, null, "pal_copy");
        catalog.library("pal_spr", RuntimeRoutines::palSpr, null, "pal_copy");
        catalog.library("pal_col", RuntimeRoutines::palCol, null, RuntimeLabels.POPA);
        catalog.library("pal_clear", RuntimeRoutines::palClear, null);
        catalog.library("pal_spr_bright", RuntimeRoutines::palSprBright, null, PaletteTables.POINTER_TABLE);
        catalog.library("pal_bg_bright", RuntimeRoutines::palBgBright, null, PaletteTables.POINTER_TABLE);
        catalog.library("pal_bright", RuntimeRoutines::palBright, null, "pal_spr_bright", "pal_bg_bright");
        catalog.library("ppu_off", RuntimeRoutines::ppuOff, null, "ppu_wait_nmi");
        catalog.library("ppu_on_all", RuntimeRoutines::ppuOnAll, "ppu_onoff");
        catalog.library("ppu_onoff", RuntimeRoutines::ppuOnOff, null, "ppu_wait_nmi");
        catalog.library("ppu_on_bg", RuntimeRoutines::ppuOnBg, null, "ppu_onoff");
        catalog.library("ppu_on_spr", RuntimeRoutines::ppuOnSpr, null, "ppu_onoff");
        catalog.library("ppu_mask", RuntimeRoutines::ppuMask, null);
        catalog.library("ppu_system", RuntimeRoutines::ppuSystem, null);
        catalog.library("get_ppu_ctrl_var", RuntimeRoutines::getPpuCtrlVar, null);
        catalog.library("set_ppu_ctrl_var", RuntimeRoutines::setPpuCtrlVar, null);
        catalog.library("oam_clear", RuntimeRoutines::oamClear, null);
        catalog.library("oam_size", RuntimeRoutines::oamSize, null);
        catalog.library("oam_hide_rest", RuntimeRoutines::oamHideRest, null);
        catalog.library("ppu_wait_frame", RuntimeRoutines::ppuWaitFrame, null);
        catalog.library("ppu_wait_nmi", RuntimeRoutines::ppuWaitNmi, null);
        catalog.library("scroll", RuntimeRoutines::scroll, null, RuntimeLabels.POPAX);
        catalog.library("bank_spr", RuntimeRoutines::bankSpr, null);
        catalog.library("bank_bg", RuntimeRoutines::bankBg, null);
        catalog.library("vram_write", RuntimeRoutines::vramWrite, null, RuntimeLabels.POPAX);
        catalog.library("set_vram_update", RuntimeRoutines::setVramUpdate, null);
        catalog.library("flush_vram_update", RuntimeRoutines::flushVramUpdate, null);
        catalog.library("vram_adr", RuntimeRoutines::vramAdr, null);
        catalog.library("vram_put", RuntimeRoutines::vramPut, null);
        catalog.library("vram_fill", RuntimeRoutines::vramFill, null, RuntimeLabels.POPA);
        catalog.library("vram_inc", RuntimeRoutines::vramInc, null);
        catalog.library("nesclock", RuntimeRoutines::nesclock, null);
        catalog.library("delay", RuntimeRoutines::delay, null, "ppu_wait_nmi");
        // endregion

        // region Palette brightness tables
        String[] tables = new String[PaletteTables.TABLE_COUNT];
        for (int i = 0; i < tables.length; i++) {
            tables[i] = PaletteTables.tableLabel(i);
        }
        catalog.library(PaletteTables.POINTER_TABLE, PaletteTables::pointerTable, null, tables);
        for (int i = 0; i < PaletteTables.TABLE_COUNT; i++) {
            final int index = i;
            catalog.library(tables[i], () -> PaletteTables.table(index), null);
        }
        // endregion

        catalog.library("initlib", RuntimeRoutines::initlib, null);

        // region cc65 runtime
        catalog.register(new Subroutine("donelib", Section.RUNTIME, List.of(RuntimeLabels.DESTRUCTOR_TABLE), null,
                p -> RuntimeRoutines.donelib()));
        catalog.register(new Subroutine("copydata", Section.RUNTIME, List.of(RuntimeLabels.DESTRUCTOR_TABLE), null,
                p -> RuntimeRoutines.copydata()));
        catalog.register(new Subroutine(RuntimeLabels.POPAX, Section.RUNTIME, List.of(), "incsp2",
                p -> RuntimeRoutines.popax()));
        catalog.register(new Subroutine("incsp2", Section.RUNTIME, List.of(), null,
                p -> RuntimeRoutines.incsp2()));
        catalog.register(new Subroutine(RuntimeLabels.POPA, Section.RUNTIME, List.of(), null,
                p -> RuntimeRoutines.popa()));
        catalog.register(new Subroutine(RuntimeLabels.PUSHA, Section.RUNTIME, List.of(), null,
                p -> RuntimeRoutines.pusha()));
        catalog.register(new Subroutine(RuntimeLabels.PUSHAX, Section.RUNTIME, List.of(), null,
                p -> RuntimeRoutines.pushax()));
        catalog.register(new Subroutine("zerobss", Section.RUNTIME, List.of(), null,
                p -> RuntimeRoutines.zerobss(p.localBytes())));
        // endregion

        // region Optional
        catalog.register(new Subroutine("pad_poll", Section.OPTIONAL, List.of(), null,
                p -> RuntimeRoutines.padPoll()));
        catalog.register(new Subroutine("oam_spr", Section.OPTIONAL, List.of(), null,
                p -> RuntimeRoutines.oamSpr()));
        // endregion

        catalog.register(new Subroutine(RuntimeLabels.DESTRUCTOR_TABLE, Section.TRAILER, List.of(), null,
                p -> RuntimeRoutines.destructorTable()));
        return catalog;
    }

    private void library(String name, Supplier<Block> factory, String fallsThroughTo, String... dependencies) {
        Function<RuntimeParameters, Block> ignoringParameters = p -> factory.get();
        register(new Subroutine(name, Section.LIBRARY, List.of(dependencies), fallsThroughTo, ignoringParameters));
    }
}
