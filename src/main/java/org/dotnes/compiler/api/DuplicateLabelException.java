package org.dotnes.compiler.api;

/**
 * Thrown when a label is defined twice in one program.
 */
public class DuplicateLabelException extends CompilationException {

    private final String label;

    /**
     * @param label The label defined twice.
     */
    public DuplicateLabelException(String label) {
        super(CompilerErrorCode.DUPLICATE_LABEL, "Label defined more than once: " + label);
        this.label = label;
    }

    /**
     * @return The label defined twice.
     */
    public String getLabel() {
        return label;
    }
}
