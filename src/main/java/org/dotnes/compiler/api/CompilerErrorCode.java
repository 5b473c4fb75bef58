package org.dotnes.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * Every code belongs to a {@link Category} so callers can tell a malformed program apart from
 * a construct the compiler does not translate yet.
 */
public enum CompilerErrorCode {
    // region Bytecode Reader Errors
    /** The method body ended in the middle of an operand. */
    TRUNCATED_OPERAND(Category.BAD_INPUT),
    /** An opcode byte that is not part of the instruction set. */
    UNKNOWN_OPCODE(Category.BAD_INPUT),
    /** A metadata token could not be resolved to a name, string or field. */
    UNRESOLVED_TOKEN(Category.BAD_INPUT),
    // endregion

    // region Translation Errors
    /** A recognized instruction or idiom without a translation rule. */
    UNSUPPORTED_INSTRUCTION(Category.UNIMPLEMENTED),
    /** An instruction consumed more values than the evaluation stack holds. */
    STACK_UNDERFLOW(Category.BAD_INPUT),
    /** A call whose stack shape matches no overload of the target. */
    INVALID_CALL_SHAPE(Category.BAD_INPUT),
    /** A local variable was read before it was stored. */
    UNINITIALIZED_LOCAL(Category.BAD_INPUT),
    /** A branch target that is not the start of an instruction. */
    INVALID_BRANCH_TARGET(Category.BAD_INPUT),
    // endregion

    // region Catalog Errors
    /** User code calls an external name the catalog does not know. */
    SUBROUTINE_NOT_FOUND(Category.CONFIGURATION),
    // endregion

    // region Resolver Errors
    /** A label was referenced but never defined. */
    UNRESOLVED_LABEL(Category.INTERNAL),
    /** A label was defined more than once. */
    DUPLICATE_LABEL(Category.INTERNAL),
    /** A relative branch cannot reach its target and cannot be relaxed. */
    BRANCH_OUT_OF_RANGE(Category.INTERNAL),
    /** A routine that falls through is not followed by its successor. */
    LAYOUT_VIOLATION(Category.INTERNAL),
    // endregion

    // region ROM Assembler Errors
    /** The tile data does not fit into one CHR bank. */
    CHR_TOO_LARGE(Category.BAD_INPUT),
    /** The code region does not fit into the PRG banks. */
    PRG_OVERFLOW(Category.BAD_INPUT),
    /** A configuration value is missing or has an invalid value. */
    INVALID_CONFIGURATION(Category.CONFIGURATION),
    // endregion

    // region General Errors
    /** An unknown or unexpected error occurred. */
    UNKNOWN_ERROR(Category.INTERNAL);
    // endregion

    /**
     * Coarse classification of errors for reporting.
     */
    public enum Category {
        /** The program or its metadata is malformed. */
        BAD_INPUT,
        /** The construct is recognized but has no translation rule. */
        UNIMPLEMENTED,
        /** The program references something the build configuration does not provide. */
        CONFIGURATION,
        /** An invariant of the compiler itself was violated. */
        INTERNAL
    }

    private final Category category;

    CompilerErrorCode(Category category) {
        this.category = category;
    }

    /**
     * @return The category of this error code.
     */
    public Category category() {
        return category;
    }
}
