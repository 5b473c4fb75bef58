package org.dotnes.compiler.isa;

import org.dotnes.compiler.api.UnresolvedLabelException;

/**
 * Resolves label names to addresses while encoding instructions.
 */
@FunctionalInterface
public interface LabelLookup {

    /**
     * @param label The label name as written in the operand.
     * @return The absolute address of the label.
     * @throws UnresolvedLabelException if the label is not defined.
     */
    int addressOf(String label) throws UnresolvedLabelException;
}
