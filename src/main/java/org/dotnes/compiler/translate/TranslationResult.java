package org.dotnes.compiler.translate;

import org.dotnes.compiler.backend.layout.Block;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of the {@link InstructionTranslator}.
 *
 * @param main The user code block, labeled {@code main}.
 * @param byteArrays Byte array literals, in bind order.
 * @param strings String literals, in first-use order.
 * @param calledRoutines Runtime routines called by user code, in first-call order.
 * @param localBytes RAM bytes allocated to local variables.
 */
public record TranslationResult(
        Block main,
        List<Block> byteArrays,
        List<Block> strings,
        Set<String> calledRoutines,
        int localBytes
) {
    public TranslationResult {
        byteArrays = List.copyOf(byteArrays);
        strings = List.copyOf(strings);
        calledRoutines = Collections.unmodifiableSet(new LinkedHashSet<>(calledRoutines));
    }
}
