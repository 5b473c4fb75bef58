package org.dotnes.compiler.translate;

/**
 * Storage assigned to an IL local variable.
 */
sealed interface LocalSlot permits LocalSlot.Ram, LocalSlot.Data {

    /** A local held in RAM. */
    record Ram(int address, ValueWidth width) implements LocalSlot {
    }

    /** An array local bound to literal data; it occupies no RAM. */
    record Data(String label, int length) implements LocalSlot {
    }
}
