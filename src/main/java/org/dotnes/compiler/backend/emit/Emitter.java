package org.dotnes.compiler.backend.emit;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.backend.layout.BlockItem;
import org.dotnes.compiler.backend.layout.LayoutResult;
import org.dotnes.compiler.backend.layout.Program;
import org.dotnes.compiler.diagnostics.CompilerLogger;
import org.dotnes.compiler.isa.LabelLookup;

import java.io.ByteArrayOutputStream;
import java.util.List;

/**
 * The Emitter is the final stage of the compiler backend. It takes the resolved program and its
 * layout and produces the bytes of the code region in one pass. Emission does not modify the
 * program.
 */
public final class Emitter {

    /**
     * Emits the code region.
     *
     * @param program The program, as resolved.
     * @param layout The layout produced by the resolver for exactly this program.
     * @return The code bytes, {@link LayoutResult#totalSize()} long.
     * @throws CompilationException if a label cannot be resolved or a branch is out of range.
     */
    public byte[] emit(Program program, LayoutResult layout) throws CompilationException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(layout.totalSize());
        List<Block> blocks = program.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            LabelLookup lookup = layout.lookupFor(i);
            int address = layout.blockAddresses().get(i);
            for (BlockItem item : blocks.get(i).items()) {
                out.writeBytes(encode(item, address, lookup));
                address += item.size();
            }
        }
        byte[] bytes = out.toByteArray();
        if (bytes.length != layout.totalSize()) {
            throw new IllegalStateException("Emitted " + bytes.length + " bytes, layout expects " + layout.totalSize());
        }
        CompilerLogger.debug("Emitter: " + bytes.length + " bytes");
        return bytes;
    }

    static byte[] encode(BlockItem item, int address, LabelLookup lookup) throws CompilationException {
        if (item instanceof BlockItem.Code code) {
            return code.instruction().encode(address, lookup);
        } else if (item instanceof BlockItem.Data data) {
            return data.bytes();
        } else if (item instanceof BlockItem.AddressByte ref) {
            int value = lookup.addressOf(ref.label()) + ref.offset();
            return new byte[] {(byte) (ref.high() ? value >> 8 : value)};
        }
        return new byte[0];
    }
}
