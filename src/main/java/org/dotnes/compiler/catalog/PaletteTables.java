package org.dotnes.compiler.catalog;

import org.dotnes.compiler.backend.layout.Block;

import java.util.Arrays;

/**
 * The neslib palette brightness tables: a pointer table followed by nine color translation tables,
 * from black (0) over normal colors (4) to white (8).
 */
final class PaletteTables {

    static final String POINTER_TABLE = "palBrightTableL";
    static final int TABLE_COUNT = 9;

    private PaletteTables() {}

    static String tableLabel(int index) {
        return "palBrightTable" + index;
    }

    /**
     * Low bytes of the nine table addresses followed by their high bytes. {@code palBrightTableL+9}
     * is therefore the high byte table.
     */
    static Block pointerTable() {
        Block block = new Block(POINTER_TABLE);
        for (int i = 0; i < TABLE_COUNT; i++) {
            block.addressLow(tableLabel(i), 0);
        }
        for (int i = 0; i < TABLE_COUNT; i++) {
            block.addressHigh(tableLabel(i), 0);
        }
        return block;
    }

    /**
     * @param index Brightness level, 0..8.
     * @return The color translation table for that level.
     */
    static Block table(int index) {
        switch (index) {
            case 0: case 1: case 2: case 3:
                return uniform(index, 0x0F, 16);
            case 4:
                return table(4, 0x00, 0x01, 0x02, 0x03, 0x04, 0x05, 0x06, 0x07, 0x08, 0x09, 0x0A, 0x0B, 0x0C, 0x0F, 0x0F, 0x0F);
            case 5:
                return table(5, 0x10, 0x11, 0x12, 0x13, 0x14, 0x15, 0x16, 0x17, 0x18, 0x19, 0x1A, 0x1B, 0x1C, 0x00, 0x00, 0x00);
            case 6:
                // $10 because $20 is the same color as $30
                return table(6, 0x10, 0x21, 0x22, 0x23, 0x24, 0x25, 0x26, 0x27, 0x28, 0x29, 0x2A, 0x2B, 0x2C, 0x10, 0x10, 0x10);
            case 7:
                return table(7, 0x30, 0x31, 0x32, 0x33, 0x34, 0x35, 0x36, 0x37, 0x38, 0x39, 0x3A, 0x3B, 0x3C, 0x20, 0x20, 0x20);
            case 8:
                return uniform(8, 0x30, 64);
            default:
                throw new IllegalArgumentException("No brightness table " + index);
        }
    }

    private static Block uniform(int index, int color, int length) {
        byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) color);
        return new Block(tableLabel(index)).data(bytes);
    }

    private static Block table(int index, int... colors) {
        byte[] bytes = new byte[colors.length];
        for (int i = 0; i < colors.length; i++) {
            bytes[i] = (byte) colors[i];
        }
        return new Block(tableLabel(index)).data(bytes);
    }
}
