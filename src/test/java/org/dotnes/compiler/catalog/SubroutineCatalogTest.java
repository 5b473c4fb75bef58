package org.dotnes.compiler.catalog;

import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.SubroutineNotFoundException;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.BlockItem;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SubroutineCatalogTest {

    private final SubroutineCatalog catalog = SubroutineCatalog.initialize();

    @Test
    @Tag("unit")
    void closureWithoutCallsLinksEverythingButOptionalRoutines() throws Exception {
        List<Subroutine> linked = catalog.closure(List.of());

        assertThat(linked).extracting(Subroutine::name)
                .contains("_exit", "nmi", "irq", "pal_col", "vram_write", "popa", "pushax", "zerobss",
                        RuntimeLabels.DESTRUCTOR_TABLE)
                .doesNotContain("pad_poll", "oam_spr");
        assertThat(linked).extracting(Subroutine::section).doesNotContain(Section.OPTIONAL);
    }

    @Test
    @Tag("unit")
    void closureKeepsCanonicalOrder() throws Exception {
        List<Subroutine> linked = catalog.closure(List.of("pad_poll", "oam_spr"));

        List<String> names = linked.stream().map(Subroutine::name).toList();
        List<String> all = catalog.all().stream().map(Subroutine::name).toList();
        assertThat(all).containsSubsequence(names);
        assertThat(names).endsWith("pad_poll", "oam_spr", RuntimeLabels.DESTRUCTOR_TABLE);
        assertThat(names.get(0)).isEqualTo(RuntimeLabels.RESET);
    }

    @Test
    @Tag("unit")
    void closureOfAnUnknownNameFails() {
        assertThatThrownBy(() -> catalog.closure(List.of("print")))
                .isInstanceOfSatisfying(SubroutineNotFoundException.class, e -> {
                    assertThat(e.getName()).isEqualTo("print");
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.SUBROUTINE_NOT_FOUND);
                });
    }

    @Test
    @Tag("unit")
    void lookupByName() {
        assertThat(catalog.get("pal_col")).map(Subroutine::section).contains(Section.LIBRARY);
        assertThat(catalog.get("pusha")).map(Subroutine::section).contains(Section.RUNTIME);
        assertThat(catalog.get("nope")).isEmpty();
        assertThat(catalog.contains("oam_spr")).isTrue();
        assertThatThrownBy(() -> catalog.find("nope")).hasMessage("No subroutine named nope");
    }

    @Test
    @Tag("unit")
    void registeringANameTwiceIsRejected() {
        Function<RuntimeParameters, Block> factory = p -> new Block("pusha");

        assertThatThrownBy(() -> catalog.register(new Subroutine("pusha", Section.RUNTIME, List.of(), null, factory)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pusha");
    }

    @Test
    @Tag("unit")
    void everyReferencedNameIsCataloged() {
        for (Subroutine subroutine : catalog.all()) {
            assertThat(subroutine.dependencies())
                    .as("dependencies of %s", subroutine.name())
                    .allSatisfy(dependency -> assertThat(catalog.contains(dependency)).isTrue());
            if (subroutine.fallsThroughTo() != null) {
                assertThat(catalog.contains(subroutine.fallsThroughTo())).isTrue();
            }
        }
    }

    @Test
    @Tag("unit")
    void everyBlockIsLabeledWithItsRoutineName() {
        RuntimeParameters parameters = new RuntimeParameters(0);
        for (Subroutine subroutine : catalog.all()) {
            Block block = subroutine.createBlock(parameters);
            assertThat(block.label()).isEqualTo(subroutine.name());
            assertThat(block.size()).as("size of %s", subroutine.name()).isPositive();
        }
    }

    @Test
    @Tag("unit")
    void fallThroughSuccessorsAreRecorded() {
        assertThat(catalog.get("_exit").orElseThrow().fallsThroughTo()).isEqualTo("_initPPU");
        assertThat(catalog.get("popax").orElseThrow().fallsThroughTo()).isEqualTo("incsp2");
        assertThat(catalog.get("skipNtsc").orElseThrow().fallsThroughTo()).isNull();
    }

    @Test
    @Tag("unit")
    void blocksForSelectsOneSection() throws Exception {
        List<Subroutine> linked = catalog.closure(Set.of("pad_poll"));

        List<Block> optional = SubroutineCatalog.blocksFor(linked, Section.OPTIONAL, new RuntimeParameters(0));
        List<Block> trailer = SubroutineCatalog.blocksFor(linked, Section.TRAILER, new RuntimeParameters(0));

        assertThat(optional).extracting(Block::label).containsExactly("pad_poll");
        assertThat(trailer).extracting(Block::label).containsExactly(RuntimeLabels.DESTRUCTOR_TABLE);
    }

    @Test
    @Tag("unit")
    void zerobssDependsOnLocalRam() {
        Subroutine zerobss = catalog.get("zerobss").orElseThrow();

        Block without = zerobss.createBlock(new RuntimeParameters(0));
        Block with = zerobss.createBlock(new RuntimeParameters(12));

        assertThat(with.instructions()).isNotEqualTo(without.instructions());
        assertThatThrownBy(() -> new RuntimeParameters(256)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void paletteBrightnessTables() {
        Block pointers = PaletteTables.pointerTable();
        assertThat(pointers.size()).isEqualTo(18);
        assertThat(pointers.items().get(0)).isEqualTo(new BlockItem.AddressByte("palBrightTable0", 0, false));
        assertThat(pointers.items().get(9)).isEqualTo(new BlockItem.AddressByte("palBrightTable0", 0, true));

        int total = 0;
        for (int i = 0; i < PaletteTables.TABLE_COUNT; i++) {
            total += PaletteTables.table(i).size();
        }
        assertThat(total).isEqualTo(192);
        assertThat(PaletteTables.table(4).items().get(0))
                .isInstanceOfSatisfying(BlockItem.Data.class, data -> assertThat(data.bytes()).startsWith(0x00, 0x01));
        assertThatThrownBy(() -> PaletteTables.table(9)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void libraryFunctionsResolveToCatalogedRoutines() {
        for (LibraryFunction function : LibraryFunction.values()) {
            if (function.rule() == LibraryFunction.CallRule.CALL) {
                assertThat(catalog.contains(function.externalName()))
                        .as("routine for %s", function)
                        .isTrue();
            }
        }
        assertThat(LibraryFunction.overloads("vram_write"))
                .containsExactly(LibraryFunction.VRAM_WRITE_SIZED, LibraryFunction.VRAM_WRITE);
        assertThat(LibraryFunction.overloads("Console.WriteLine")).isEmpty();
        assertThat(LibraryFunction.NTADR_A.foldNametable(2, 2)).isEqualTo(0x2042);
        assertThat(LibraryFunction.NTADR_D.foldNametable(31, 29)).isEqualTo(0x2FBF);
        assertThatThrownBy(LibraryFunction.PAL_COL::nametableBase).isInstanceOf(IllegalStateException.class);
    }
}
