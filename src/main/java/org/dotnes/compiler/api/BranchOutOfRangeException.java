package org.dotnes.compiler.api;

/**
 * Thrown when a relative branch cannot reach its target and was not eligible for relaxation.
 */
public class BranchOutOfRangeException extends CompilationException {

    private final String label;
    private final int displacement;

    /**
     * @param label The branch target.
     * @param displacement The displacement that would be needed.
     */
    public BranchOutOfRangeException(String label, int displacement) {
        super(CompilerErrorCode.BRANCH_OUT_OF_RANGE,
                String.format("Branch to %s out of range: displacement %d", label, displacement));
        this.label = label;
        this.displacement = displacement;
    }

    public String getLabel() {
        return label;
    }

    public int getDisplacement() {
        return displacement;
    }
}
