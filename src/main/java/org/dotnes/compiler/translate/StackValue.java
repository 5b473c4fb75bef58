package org.dotnes.compiler.translate;

/**
 * The shape of one evaluation stack entry. Most entries are lazy and produce code only when an
 * instruction consumes them.
 */
sealed interface StackValue
        permits StackValue.Constant, StackValue.LocalRead, StackValue.DataAddress, StackValue.ArrayRef,
                StackValue.FieldHandle, StackValue.InRegisters, StackValue.Pushed {

    /**
     * @return The width of the value once loaded, or {@code null} for values that cannot be loaded.
     */
    ValueWidth width();

    /**
     * @return {@code true} if the value has no code attached yet.
     */
    default boolean isLazy() {
        return true;
    }

    /** A compile-time constant, unsigned 16 bits. */
    record Constant(int value) implements StackValue {
        public Constant {
            value &= 0xFFFF;
        }

        @Override
        public ValueWidth width() {
            return ValueWidth.of(value);
        }
    }

    /** The current value of a RAM local. */
    record LocalRead(int address, ValueWidth width) implements StackValue {
    }

    /**
     * The address of a literal data block.
     * @param label The data block label.
     * @param length The payload length, without a string terminator.
     */
    record DataAddress(String label, int length) implements StackValue {
        @Override
        public ValueWidth width() {
            return ValueWidth.WORD;
        }
    }

    record ArrayRef(ArraySlot slot) implements StackValue {
        @Override
        public ValueWidth width() {
            return slot.isBound() ? ValueWidth.WORD : null;
        }

        /**
         * @return The bound data as an address value.
         */
        DataAddress asData() {
            return new DataAddress(slot.label(), slot.length());
        }
    }

    /** The initial data of a field, pushed by {@code ldtoken}. */
    record FieldHandle(byte[] data) implements StackValue {
        @Override
        public ValueWidth width() {
            return null;
        }
    }

    /**
     * A value computed into A (and X).
     * @param flagsValid Whether the Z and N flags reflect A.
     */
    record InRegisters(ValueWidth width, boolean flagsValid) implements StackValue {
        @Override
        public boolean isLazy() {
            return false;
        }
    }

    /** A value saved on the cc65 software stack. */
    record Pushed(ValueWidth width) implements StackValue {
        @Override
        public boolean isLazy() {
            return false;
        }
    }
}
