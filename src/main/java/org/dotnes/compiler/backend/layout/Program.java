package org.dotnes.compiler.backend.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered arena of blocks that make up the code region, plus its load address.
 * <p>
 * Blocks may be added, inserted, removed and moved freely before emission. Addresses are never
 * stored here; the {@link AddressResolver} recomputes them from the arena on every run.
 */
public final class Program {

    /** Load address of the first PRG bank. */
    public static final int DEFAULT_BASE_ADDRESS = 0x8000;

    private final int baseAddress;
    private final List<Block> blocks = new ArrayList<>();

    public Program() {
        this(DEFAULT_BASE_ADDRESS);
    }

    /**
     * @param baseAddress The address of the first byte of the first block.
     */
    public Program(int baseAddress) {
        this.baseAddress = baseAddress;
    }

    public int baseAddress() {
        return baseAddress;
    }

    /**
     * Appends a block.
     * @param block The block.
     * @return This program.
     */
    public Program add(Block block) {
        blocks.add(block);
        return this;
    }

    /**
     * Appends all blocks in order.
     * @param more The blocks.
     * @return This program.
     */
    public Program addAll(List<Block> more) {
        blocks.addAll(more);
        return this;
    }

    /**
     * Inserts a block before the given position.
     * @param index The position.
     * @param block The block.
     */
    public void insert(int index, Block block) {
        blocks.add(index, block);
    }

    /**
     * Removes the block at the given position.
     * @param index The position.
     * @return The removed block.
     */
    public Block remove(int index) {
        return blocks.remove(index);
    }

    /**
     * Moves a block to a new position; the blocks in between shift by one.
     * @param from The current position.
     * @param to The new position.
     */
    public void move(int from, int to) {
        blocks.add(to, blocks.remove(from));
    }

    /**
     * @param label A block label.
     * @return The index of the block with that label, or -1.
     */
    public int indexOf(String label) {
        for (int i = 0; i < blocks.size(); i++) {
            if (label.equals(blocks.get(i).label())) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return The blocks in order, unmodifiable.
     */
    public List<Block> blocks() {
        return Collections.unmodifiableList(blocks);
    }

    /**
     * @return The sum of all block sizes.
     */
    public int totalSize() {
        int size = 0;
        for (Block block : blocks) {
            size += block.size();
        }
        return size;
    }
}
