package org.dotnes.compiler.backend.emit;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.BlockItem;
import org.dotnes.compiler.backend.layout.LayoutResult;
import org.dotnes.compiler.backend.layout.Program;
import org.dotnes.compiler.isa.LabelLookup;

import java.util.List;

/**
 * Renders a resolved program as an assembler listing, one line per instruction:
 * <pre>
 * pal_col:
 * $823E  85 17     STA $17
 * </pre>
 * Data is listed eight bytes per line.
 */
public final class Disassembler {

    private static final int DATA_BYTES_PER_LINE = 8;

    /**
     * @param program The resolved program.
     * @param layout Its layout.
     * @return The listing, lines separated by {@code \n}.
     * @throws CompilationException if a label cannot be resolved.
     */
    public String listing(Program program, LayoutResult layout) throws CompilationException {
        StringBuilder sb = new StringBuilder();
        List<Block> blocks = program.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            LabelLookup lookup = layout.lookupFor(i);
            int start = layout.blockAddresses().get(i);
            int address = start;
            boolean labelPrinted = block.label() == null;
            for (BlockItem item : block.items()) {
                if (!labelPrinted && address - start >= block.labelOffset()) {
                    sb.append(block.label()).append(":\n");
                    labelPrinted = true;
                }
                if (item instanceof BlockItem.Mark mark) {
                    sb.append(mark.label()).append(":\n");
                } else if (item instanceof BlockItem.Data data) {
                    appendData(sb, address, data.bytes());
                } else {
                    byte[] bytes = Emitter.encode(item, address, lookup);
                    String text = item instanceof BlockItem.Code code
                            ? code.instruction().toString()
                            : addressByteText((BlockItem.AddressByte) item);
                    appendLine(sb, address, bytes, 0, bytes.length, text);
                }
                address += item.size();
            }
            if (!labelPrinted) {
                sb.append(block.label()).append(":\n");
            }
        }
        return sb.toString();
    }

    private static String addressByteText(BlockItem.AddressByte ref) {
        String target = ref.offset() == 0 ? ref.label() : ref.label() + "+" + ref.offset();
        return ".byte " + (ref.high() ? ">" : "<") + target;
    }

    private static void appendData(StringBuilder sb, int address, byte[] bytes) {
        for (int from = 0; from < bytes.length; from += DATA_BYTES_PER_LINE) {
            int to = Math.min(bytes.length, from + DATA_BYTES_PER_LINE);
            StringBuilder text = new StringBuilder(".byte ");
            for (int j = from; j < to; j++) {
                if (j > from) {
                    text.append(',');
                }
                text.append(String.format("$%02X", bytes[j] & 0xFF));
            }
            appendLine(sb, address + from, bytes, from, to, text.toString());
        }
    }

    private static void appendLine(StringBuilder sb, int address, byte[] bytes, int from, int to, String text) {
        StringBuilder hex = new StringBuilder();
        for (int j = from; j < to && j < from + 3; j++) {
            hex.append(String.format("%02X ", bytes[j] & 0xFF));
        }
        sb.append(String.format("$%04X  %-9s %s", address, hex.toString().trim(), text)).append('\n');
    }
}
