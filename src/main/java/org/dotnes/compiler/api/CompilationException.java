package org.dotnes.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * It is part of the public API. Every instance carries a {@link CompilerErrorCode}, and through it a
 * {@link CompilerErrorCode.Category}, so tooling can report actionable messages without parsing text.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;

    /**
     * Constructs a new compilation exception with the specified error code and detail message.
     * @param errorCode The error code.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Constructs a new compilation exception with the specified error code, detail message and cause.
     * @param errorCode The error code.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * @return The error code of this failure.
     */
    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The category of this failure.
     */
    public CompilerErrorCode.Category getCategory() {
        return errorCode.category();
    }
}
