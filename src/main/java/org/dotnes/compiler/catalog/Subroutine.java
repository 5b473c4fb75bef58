package org.dotnes.compiler.catalog;

import org.dotnes.compiler.backend.layout.Block;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One catalog entry.
 *
 * @param name The label of the routine, which is also the external call target name.
 * @param section The section the routine belongs to.
 * @param dependencies Names of catalog entries the routine calls or jumps to.
 * @param fallsThroughTo The entry that must directly follow this one, or {@code null}.
 * @param factory Creates a fresh block for the routine.
 */
public record Subroutine(
        String name,
        Section section,
        List<String> dependencies,
        String fallsThroughTo,
        Function<RuntimeParameters, Block> factory
) {
    public Subroutine {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(section, "section");
        Objects.requireNonNull(factory, "factory");
        dependencies = List.copyOf(dependencies);
    }

    /**
     * Creates the block of this routine.
     * @param parameters The program-dependent parameters.
     * @return A new block labeled with {@link #name()}.
     */
    public Block createBlock(RuntimeParameters parameters) {
        return factory.apply(parameters);
    }
}
