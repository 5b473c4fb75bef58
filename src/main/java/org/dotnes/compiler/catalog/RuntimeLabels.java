package org.dotnes.compiler.catalog;

/**
 * Names of runtime labels that other components refer to directly.
 */
public final class RuntimeLabels {

    private RuntimeLabels() {}

    /** Reset entry point. */
    public static final String RESET = "_exit";
    public static final String NMI = "nmi";
    public static final String IRQ = "irq";
    /** The translated entry method. */
    public static final String MAIN = "main";
    /** Last block of the image; its address marks the end of the literal data. */
    public static final String DESTRUCTOR_TABLE = "__DESTRUCTOR_TABLE__";
    public static final String POPA = "popa";
    public static final String POPAX = "popax";
    public static final String PUSHA = "pusha";
    public static final String PUSHAX = "pushax";
}
