package org.dotnes.compiler.api;

/**
 * Thrown when user code calls an external name the subroutine catalog does not provide.
 */
public class SubroutineNotFoundException extends CompilationException {

    private final String name;

    /**
     * @param name The unknown call target.
     */
    public SubroutineNotFoundException(String name) {
        super(CompilerErrorCode.SUBROUTINE_NOT_FOUND, "No subroutine named " + name);
        this.name = name;
    }

    /**
     * @return The unknown call target.
     */
    public String getName() {
        return name;
    }
}
