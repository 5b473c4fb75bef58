package org.dotnes.compiler.frontend;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The decoded operand of a {@link StructuredInstruction}. Tokens are already resolved through
 * the program metadata.
 */
public sealed interface IlOperand
        permits IlOperand.None, IlOperand.IntValue, IlOperand.FloatValue, IlOperand.BranchTarget,
                IlOperand.SwitchTargets, IlOperand.Member, IlOperand.StringLiteral, IlOperand.FieldData,
                IlOperand.TypeName {

    /** No operand. */
    record None() implements IlOperand {
        public static final None INSTANCE = new None();

        @Override
        public String toString() {
            return "";
        }
    }

    /** An integer constant or a variable index. */
    record IntValue(long value) implements IlOperand {
        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements IlOperand {
        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    /**
     * A branch destination.
     * @param target Absolute byte offset of the target instruction.
     */
    record BranchTarget(int target) implements IlOperand {
        @Override
        public String toString() {
            return String.format("IL_%04X", target);
        }
    }

    record SwitchTargets(List<Integer> targets) implements IlOperand {
        public SwitchTargets {
            targets = List.copyOf(targets);
        }
    }

    /** A method reference, identified by its simple name. */
    record Member(int token, String name) implements IlOperand {
        public Member {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString() {
            return name;
        }
    }

    record StringLiteral(int token, String value) implements IlOperand {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    /**
     * A field token whose field carries initial data, as used by {@code ldtoken} before
     * {@code InitializeArray}.
     */
    record FieldData(int token, byte[] data) implements IlOperand {
        public FieldData {
            data = data.clone();
        }

        @Override
        public byte[] data() {
            return data.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FieldData other && token == other.token && Arrays.equals(data, other.data);
        }

        @Override
        public int hashCode() {
            return 31 * token + Arrays.hashCode(data);
        }

        @Override
        public String toString() {
            return String.format("field 0x%08X (%d bytes)", token, data.length);
        }
    }

    /** A type or field reference, identified by name. */
    record TypeName(int token, String name) implements IlOperand {
        @Override
        public String toString() {
            return name;
        }
    }
}
