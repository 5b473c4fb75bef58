package org.dotnes.compiler.diagnostics;

/**
 * A single diagnostic message reported during compilation.
 *
 * @param type The type of the diagnostic.
 * @param message The message.
 * @param offset The IL offset the message refers to, or -1 if it has none.
 */
public record Diagnostic(
        Type type,
        String message,
        int offset
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** A problem that does not stop compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return offset >= 0
                ? String.format("[%s] IL_%04X: %s", type, offset, message)
                : String.format("[%s] %s", type, message);
    }
}
