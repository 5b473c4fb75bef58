package org.dotnes.compiler.catalog;

/**
 * Where a runtime routine is placed relative to user code in the canonical program order.
 */
public enum Section {
    /** crt0 and neslib code in front of {@code main}; always linked. */
    LIBRARY,
    /** cc65 runtime following {@code main}; always linked. */
    RUNTIME,
    /** Routines linked only when user code calls them, after the runtime. */
    OPTIONAL,
    /** Placed after the literal data region. */
    TRAILER
}
