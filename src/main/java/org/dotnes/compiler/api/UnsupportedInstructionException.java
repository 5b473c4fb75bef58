package org.dotnes.compiler.api;

/**
 * Thrown when the translator meets an instruction or idiom it has no rule for.
 */
public class UnsupportedInstructionException extends CompilationException {

    private final int offset;
    private final String instruction;

    /**
     * @param offset The byte offset of the instruction in the method body.
     * @param instruction The instruction name, e.g. {@code callvirt}.
     * @param reason Why it cannot be translated.
     */
    public UnsupportedInstructionException(int offset, String instruction, String reason) {
        this(CompilerErrorCode.UNSUPPORTED_INSTRUCTION, offset, instruction, reason);
    }

    /**
     * @param errorCode The error code, for shape errors that are the program's fault.
     * @param offset The byte offset of the instruction in the method body.
     * @param instruction The instruction name.
     * @param reason Why it cannot be translated.
     */
    public UnsupportedInstructionException(CompilerErrorCode errorCode, int offset, String instruction, String reason) {
        super(errorCode, String.format("%s at IL_%04X: %s", instruction, offset, reason));
        this.offset = offset;
        this.instruction = instruction;
    }

    /**
     * @return The byte offset of the instruction.
     */
    public int getOffset() {
        return offset;
    }

    /**
     * @return The instruction name.
     */
    public String getInstruction() {
        return instruction;
    }
}
