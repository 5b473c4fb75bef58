package org.dotnes.compiler.api;

/**
 * Thrown by the bytecode reader for malformed or truncated method bodies and for metadata tokens
 * that cannot be resolved.
 */
public class DecodeException extends CompilationException {

    private final int offset;

    /**
     * @param errorCode One of the reader error codes.
     * @param offset The byte offset of the offending instruction.
     * @param message The detail message.
     */
    public DecodeException(CompilerErrorCode errorCode, int offset, String message) {
        super(errorCode, String.format("%s at IL_%04X", message, offset));
        this.offset = offset;
    }

    /**
     * @return The byte offset of the offending instruction.
     */
    public int getOffset() {
        return offset;
    }
}
