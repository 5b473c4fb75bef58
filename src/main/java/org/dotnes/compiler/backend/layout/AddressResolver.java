package org.dotnes.compiler.backend.layout;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.DuplicateLabelException;
import org.dotnes.compiler.api.UnresolvedLabelException;
import org.dotnes.compiler.diagnostics.CompilerLogger;
import org.dotnes.compiler.isa.Asm;
import org.dotnes.compiler.isa.LabelLookup;
import org.dotnes.compiler.isa.TargetInstruction;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns addresses to every block, label and instruction of a {@link Program}.
 * <p>
 * A pass walks the blocks in order, advancing a running address by the size of each item and
 * defining labels as they are reached. Relaxable branches that cannot reach their target are then
 * rewritten into an inverted branch over {@code JMP target} and the pass is repeated until nothing
 * changes. Finally every symbolic operand is checked, so emission cannot fail afterwards.
 * <p>
 * Resolution is a pure function of the block arena: running it again over a resolved program
 * yields the same addresses.
 */
public final class AddressResolver {

    /** Size of the inverted branch in a long-branch trampoline; it skips the following {@code JMP}. */
    private static final int TRAMPOLINE_SKIP = 3;

    /**
     * Resolves the program, relaxing out-of-range branches where allowed.
     *
     * @param program The program. Relaxation rewrites its blocks in place.
     * @return The resolved addresses.
     * @throws CompilationException if a label is undefined or defined twice, or a non-relaxable
     *         branch is out of range.
     */
    public LayoutResult resolve(Program program) throws CompilationException {
        CompilerLogger.debug("AddressResolver: resolving " + program.blocks().size() + " blocks");
        int passes = 0;
        int relaxed = 0;
        while (true) {
            passes++;
            LayoutResult layout = assign(program);
            int count = relax(program, layout);
            if (count == 0) {
                verify(program, layout);
                CompilerLogger.debug(String.format("AddressResolver: %d bytes, %d labels, %d passes, %d branches relaxed",
                        layout.totalSize(), layout.labelToAddress().size(), passes, relaxed));
                return layout;
            }
            relaxed += count;
        }
    }

    private LayoutResult assign(Program program) throws DuplicateLabelException {
        LayoutContext ctx = new LayoutContext(program.baseAddress());
        List<Block> blocks = program.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            String scope = ctx.beginBlock(blocks.get(i), i);
            for (BlockItem item : blocks.get(i).items()) {
                if (item instanceof BlockItem.Mark mark) {
                    ctx.defineInline(scope, mark.label());
                } else {
                    ctx.advance(item.size());
                }
            }
        }
        return ctx.toResult();
    }

    private int relax(Program program, LayoutResult layout) throws UnresolvedLabelException {
        int count = 0;
        List<Block> blocks = program.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            LabelLookup lookup = layout.lookupFor(i);
            int address = layout.blockAddresses().get(i);
            List<Integer> outOfRange = new ArrayList<>();
            List<BlockItem> items = block.items();
            for (int j = 0; j < items.size(); j++) {
                if (items.get(j) instanceof BlockItem.Code code && code.instruction().isRelaxable()) {
                    int displacement = TargetInstruction.displacement(address, lookup.addressOf(code.instruction().branchTarget()));
                    if (displacement < -128 || displacement > 127) {
                        outOfRange.add(j);
                    }
                }
                address += items.get(j).size();
            }
            for (int k = outOfRange.size() - 1; k >= 0; k--) {
                int index = outOfRange.get(k);
                TargetInstruction branch = ((BlockItem.Code) items.get(index)).instruction();
                CompilerLogger.trace("AddressResolver: long branch " + branch + " in " + block);
                block.replace(index, List.of(
                        new BlockItem.Code(Asm.branch(branch.opcode().invertBranch(), TRAMPOLINE_SKIP)),
                        new BlockItem.Code(Asm.jmp(branch.branchTarget()))));
            }
            count += outOfRange.size();
        }
        return count;
    }

    private void verify(Program program, LayoutResult layout) throws CompilationException {
        List<Block> blocks = program.blocks();
        for (int i = 0; i < blocks.size(); i++) {
            LabelLookup lookup = layout.lookupFor(i);
            int address = layout.blockAddresses().get(i);
            for (BlockItem item : blocks.get(i).items()) {
                if (item instanceof BlockItem.Code code) {
                    code.instruction().encode(address, lookup);
                } else if (item instanceof BlockItem.AddressByte ref) {
                    lookup.addressOf(ref.label());
                }
                address += item.size();
            }
        }
    }
}
