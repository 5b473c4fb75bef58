package org.dotnes.compiler.translate;

/**
 * An array created by {@code newarr}. Copies made by {@code dup} share the slot, so binding the
 * array to literal data through one copy binds all of them.
 */
final class ArraySlot {

    private final int length;
    private String label;

    ArraySlot(int length) {
        this.length = length;
    }

    int length() {
        return length;
    }

    boolean isBound() {
        return label != null;
    }

    /**
     * @return The label of the literal data, or {@code null} while unbound.
     */
    String label() {
        return label;
    }

    void bind(String dataLabel) {
        this.label = dataLabel;
    }
}
