package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.isa.TargetInstruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, contiguous run of instructions and data with an optional leading label.
 * <p>
 * The label normally names the first byte. Runtime routines with an alternate entry in front of
 * the documented one (e.g. {@code pusha}) place the label {@code labelOffset} bytes into the block.
 */
public final class Block {

    private final String label;
    private final int labelOffset;
    private final List<BlockItem> items = new ArrayList<>();

    /**
     * Creates an unlabeled block.
     */
    public Block() {
        this(null, 0);
    }

    /**
     * @param label The block label, or {@code null}.
     */
    public Block(String label) {
        this(label, 0);
    }

    /**
     * @param label The block label, or {@code null}.
     * @param labelOffset Offset of the label from the first byte of the block.
     */
    public Block(String label, int labelOffset) {
        if (labelOffset < 0) {
            throw new IllegalArgumentException("labelOffset must not be negative: " + labelOffset);
        }
        this.label = label;
        this.labelOffset = labelOffset;
    }

    /**
     * Appends an instruction.
     * @param instruction The instruction.
     * @return This block.
     */
    public Block emit(TargetInstruction instruction) {
        items.add(new BlockItem.Code(instruction));
        return this;
    }

    /**
     * Appends an instruction preceded by an inline label.
     * @param instruction The instruction.
     * @param inlineLabel The label defined at the instruction.
     * @return This block.
     */
    public Block emit(TargetInstruction instruction, String inlineLabel) {
        mark(inlineLabel);
        return emit(instruction);
    }

    /**
     * Defines an inline label at the current end of the block.
     * @param inlineLabel The label.
     * @return This block.
     */
    public Block mark(String inlineLabel) {
        items.add(new BlockItem.Mark(inlineLabel));
        return this;
    }

    /**
     * Appends raw data.
     * @param bytes The data.
     * @return This block.
     */
    public Block data(byte[] bytes) {
        items.add(new BlockItem.Data(bytes));
        return this;
    }

    /**
     * Appends the low byte of a label address.
     * @param target The label.
     * @param offset Added to the address.
     * @return This block.
     */
    public Block addressLow(String target, int offset) {
        items.add(new BlockItem.AddressByte(target, offset, false));
        return this;
    }

    /**
     * Appends the high byte of a label address.
     * @param target The label.
     * @param offset Added to the address.
     * @return This block.
     */
    public Block addressHigh(String target, int offset) {
        items.add(new BlockItem.AddressByte(target, offset, true));
        return this;
    }

    /**
     * @return The block label, or {@code null} for an anonymous block.
     */
    public String label() {
        return label;
    }

    public int labelOffset() {
        return labelOffset;
    }

    /**
     * @return The items of this block, unmodifiable.
     */
    public List<BlockItem> items() {
        return Collections.unmodifiableList(items);
    }

    /**
     * @return The instructions of this block in order, without labels and data.
     */
    public List<TargetInstruction> instructions() {
        List<TargetInstruction> result = new ArrayList<>();
        for (BlockItem item : items) {
            if (item instanceof BlockItem.Code code) {
                result.add(code.instruction());
            }
        }
        return result;
    }

    /**
     * @return The size of the block in bytes.
     */
    public int size() {
        int size = 0;
        for (BlockItem item : items) {
            size += item.size();
        }
        return size;
    }

    /**
     * Replaces one item by a sequence of items. Used by branch relaxation.
     */
    void replace(int index, List<BlockItem> replacement) {
        items.remove(index);
        items.addAll(index, replacement);
    }

    @Override
    public String toString() {
        return "Block[" + (label == null ? "<anonymous>" : label) + ", " + size() + " bytes]";
    }
}
