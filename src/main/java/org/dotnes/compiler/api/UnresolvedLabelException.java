package org.dotnes.compiler.api;

/**
 * Thrown when an instruction references a label that is never defined.
 */
public class UnresolvedLabelException extends CompilationException {

    private final String label;

    /**
     * @param label The missing label.
     */
    public UnresolvedLabelException(String label) {
        super(CompilerErrorCode.UNRESOLVED_LABEL, "Label not found: " + label);
        this.label = label;
    }

    /**
     * @return The missing label.
     */
    public String getLabel() {
        return label;
    }
}
