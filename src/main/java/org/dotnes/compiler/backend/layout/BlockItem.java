package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.isa.TargetInstruction;

/**
 * One entry of a {@link Block}: an instruction, an inline label, raw data or a single byte of a
 * label address.
 */
public sealed interface BlockItem
        permits BlockItem.Code, BlockItem.Mark, BlockItem.Data, BlockItem.AddressByte {

    /**
     * @return The number of bytes this item occupies in the image.
     */
    int size();

    /**
     * @param instruction The instruction.
     */
    record Code(TargetInstruction instruction) implements BlockItem {
        @Override
        public int size() {
            return instruction.size();
        }
    }

    /**
     * Defines a label at the address of the next item. Names starting with {@code @} are local to
     * the enclosing block.
     *
     * @param label The label.
     */
    record Mark(String label) implements BlockItem {
        @Override
        public int size() {
            return 0;
        }
    }

    /**
     * Raw bytes emitted as they are.
     *
     * @param bytes The data.
     */
    record Data(byte[] bytes) implements BlockItem {
        public Data {
            bytes = bytes.clone();
        }

        @Override
        public byte[] bytes() {
            return bytes.clone();
        }

        @Override
        public int size() {
            return bytes.length;
        }
    }

    /**
     * The low or high byte of a label address, for address tables.
     *
     * @param label The label.
     * @param offset Added to the address before taking the byte.
     * @param high {@code true} for the high byte.
     */
    record AddressByte(String label, int offset, boolean high) implements BlockItem {
        @Override
        public int size() {
            return 1;
        }
    }
}
