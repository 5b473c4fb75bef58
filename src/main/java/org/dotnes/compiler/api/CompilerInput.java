package org.dotnes.compiler.api;

import org.dotnes.compiler.frontend.MetadataResolver;

import java.util.Objects;

/**
 * Everything the compiler reads about a program.
 *
 * @param ilBody The raw IL bytes of the entry method.
 * @param metadata Resolves the tokens used in the body.
 * @param chr The tile data, copied into the CHR banks unchanged.
 */
public record CompilerInput(byte[] ilBody, MetadataResolver metadata, byte[] chr) {

    public CompilerInput {
        Objects.requireNonNull(metadata, "metadata");
        ilBody = ilBody.clone();
        chr = chr.clone();
    }

    @Override
    public byte[] ilBody() {
        return ilBody.clone();
    }

    @Override
    public byte[] chr() {
        return chr.clone();
    }
}
