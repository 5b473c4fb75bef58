package org.dotnes.compiler.translate;

import org.dotnes.compiler.api.CompilationException;
import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.SubroutineNotFoundException;
import org.dotnes.compiler.api.UnsupportedInstructionException;
import org.dotnes.compiler.backend.layout.Block;
import org.dotnes.compiler.catalog.LibraryFunction;
import org.dotnes.compiler.catalog.LibraryFunction.ArgumentKind;
import org.dotnes.compiler.catalog.NesConstants;
import org.dotnes.compiler.catalog.RuntimeLabels;
import org.dotnes.compiler.catalog.SubroutineCatalog;
import org.dotnes.compiler.diagnostics.CompilerLogger;
import org.dotnes.compiler.diagnostics.DiagnosticsEngine;
import org.dotnes.compiler.frontend.IlOpcode;
import org.dotnes.compiler.frontend.IlOperand;
import org.dotnes.compiler.frontend.StructuredInstruction;
import org.dotnes.compiler.isa.Opcode;
import org.dotnes.compiler.isa.TargetInstruction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dotnes.compiler.isa.Asm.*;

/**
 * Translates the entry method into 6502 code.
 * <p>
 * The evaluation stack is tracked by shape. Constants, local reads and data addresses stay lazy
 * until an instruction consumes them, so constant arguments become immediate loads and
 * compile-time address macros fold away. Calls follow the cc65 convention: every argument but the
 * last is pushed on the software stack, the last is passed in A or A/X.
 * <p>
 * A value computed into registers is only ever on top of the stack, and every entry below it is on
 * the software stack. Pushing another value spills it first.
 */
public final class InstructionTranslator {

    private final SubroutineCatalog catalog;
    private final DiagnosticsEngine diagnostics;

    /**
     * @param catalog Runtime routines available to calls.
     * @param diagnostics Collector for non-fatal findings.
     */
    public InstructionTranslator(SubroutineCatalog catalog, DiagnosticsEngine diagnostics) {
        this.catalog = catalog;
        this.diagnostics = diagnostics;
    }

    /**
     * Translates one method body.
     *
     * @param instructions The decoded body.
     * @return The user code block and its literal data.
     * @throws CompilationException if an instruction has no translation rule or the program is malformed.
     */
    public TranslationResult translate(List<StructuredInstruction> instructions) throws CompilationException {
        CompilerLogger.debug("InstructionTranslator: " + instructions.size() + " instructions");
        TranslationResult result = new MethodTranslation(instructions).run();
        CompilerLogger.debug("InstructionTranslator: main " + result.main().size() + " bytes, "
                + result.localBytes() + " local bytes, " + result.byteArrays().size() + " byte arrays, "
                + result.strings().size() + " strings");
        return result;
    }

    static String ilLabel(int offset) {
        return String.format("@IL_%04X", offset);
    }

    private enum Condition {
        EQ, NE, LT, GE, GT, LE;

        Condition mirror() {
            switch (this) {
                case LT: return GT;
                case GT: return LT;
                case GE: return LE;
                case LE: return GE;
                default: return this;
            }
        }

        boolean test(int left, int right) {
            switch (this) {
                case EQ: return left == right;
                case NE: return left != right;
                case LT: return left < right;
                case GE: return left >= right;
                case GT: return left > right;
                default: return left <= right;
            }
        }
    }

    /**
     * State of one translation run.
     */
    private final class MethodTranslation {

        private final List<StructuredInstruction> instructions;
        private final Block main = new Block(RuntimeLabels.MAIN);
        private final List<StackValue> stack = new ArrayList<>();
        private final Map<Integer, LocalSlot> locals = new HashMap<>();
        private final LiteralPool literals = new LiteralPool();
        private final Set<String> calledRoutines = new LinkedHashSet<>();
        private int localBytes;
        private StructuredInstruction current;

        MethodTranslation(List<StructuredInstruction> instructions) {
            this.instructions = instructions;
        }

        TranslationResult run() throws CompilationException {
            Set<Integer> targets = branchTargets();
            for (StructuredInstruction instruction : instructions) {
                current = instruction;
                if (targets.contains(instruction.offset())) {
                    requireEmptyStack("at a branch target");
                    main.mark(ilLabel(instruction.offset()));
                }
                translate(instruction);
            }
            return new TranslationResult(main, literals.byteArrays(), literals.strings(), calledRoutines, localBytes);
        }

        private Set<Integer> branchTargets() throws CompilationException {
            Set<Integer> starts = new HashSet<>();
            for (StructuredInstruction instruction : instructions) {
                starts.add(instruction.offset());
            }
            Set<Integer> targets = new HashSet<>();
            for (StructuredInstruction instruction : instructions) {
                int target = instruction.branchTarget();
                if (target < 0) {
                    continue;
                }
                if (!starts.contains(target)) {
                    throw new UnsupportedInstructionException(CompilerErrorCode.INVALID_BRANCH_TARGET,
                            instruction.offset(), instruction.opcode().mnemonic(),
                            String.format("target IL_%04X is not the start of an instruction", target));
                }
                targets.add(target);
            }
            return targets;
        }

        private void translate(StructuredInstruction instruction) throws CompilationException {
            IlOpcode opcode = instruction.opcode();
            switch (opcode) {
                case NOP -> { }
                case LDC_I4_M1 -> pushConstant(-1);
                case LDC_I4_0, LDC_I4_1, LDC_I4_2, LDC_I4_3, LDC_I4_4, LDC_I4_5, LDC_I4_6, LDC_I4_7, LDC_I4_8 ->
                        pushConstant(opcode.code() - IlOpcode.LDC_I4_0.code());
                case LDC_I4_S, LDC_I4 -> pushConstant(instruction.intValue());
                case LDSTR -> loadString((IlOperand.StringLiteral) instruction.operand());
                case LDTOKEN -> loadToken(instruction.operand());
                case NEWARR -> newArray(instruction.operand());
                case DUP -> duplicate();
                case POP -> discard();
                case LDLOC_0, LDLOC_1, LDLOC_2, LDLOC_3 -> loadLocal(opcode.code() - IlOpcode.LDLOC_0.code());
                case LDLOC_S, LDLOC -> loadLocal((int) instruction.intValue());
                case STLOC_0, STLOC_1, STLOC_2, STLOC_3 -> storeLocal(opcode.code() - IlOpcode.STLOC_0.code());
                case STLOC_S, STLOC -> storeLocal((int) instruction.intValue());
                case CONV_U1, CONV_I1 -> narrowToByte();
                case CONV_U2, CONV_I2, CONV_I4, CONV_U4, CONV_I8, CONV_U8, CONV_I, CONV_U -> requireOperands(1);
                case ADD, SUB, MUL, DIV, DIV_UN, REM, REM_UN, AND, OR, XOR, SHL, SHR, SHR_UN -> binary(opcode);
                case CALL -> call(((IlOperand.Member) instruction.operand()).name());
                case RET -> returnFromMain();
                case BR_S, BR -> jump(instruction.branchTarget());
                case BRTRUE_S, BRTRUE -> branchOnValue(true, instruction.branchTarget());
                case BRFALSE_S, BRFALSE -> branchOnValue(false, instruction.branchTarget());
                case BEQ_S, BEQ -> compareAndBranch(Condition.EQ, instruction.branchTarget());
                case BNE_UN_S, BNE_UN -> compareAndBranch(Condition.NE, instruction.branchTarget());
                case BLT_S, BLT, BLT_UN_S, BLT_UN -> compareAndBranch(Condition.LT, instruction.branchTarget());
                case BGE_S, BGE, BGE_UN_S, BGE_UN -> compareAndBranch(Condition.GE, instruction.branchTarget());
                case BGT_S, BGT, BGT_UN_S, BGT_UN -> compareAndBranch(Condition.GT, instruction.branchTarget());
                case BLE_S, BLE, BLE_UN_S, BLE_UN -> compareAndBranch(Condition.LE, instruction.branchTarget());
                default -> throw unsupported("no translation rule");
            }
        }

        // region Evaluation stack

        private void push(StackValue value) {
            if (!stack.isEmpty() && top() instanceof StackValue.InRegisters registers) {
                emit(jsr(registers.width() == ValueWidth.WORD ? RuntimeLabels.PUSHAX : RuntimeLabels.PUSHA));
                stack.set(stack.size() - 1, new StackValue.Pushed(registers.width()));
            }
            stack.add(value);
        }

        private StackValue top() {
            return stack.get(stack.size() - 1);
        }

        private void requireOperands(int count) throws CompilationException {
            if (stack.size() < count) {
                throw new UnsupportedInstructionException(CompilerErrorCode.STACK_UNDERFLOW, current.offset(),
                        current.opcode().mnemonic(), "needs " + count + " value(s), stack holds " + stack.size());
            }
        }

        private StackValue pop() throws CompilationException {
            requireOperands(1);
            return stack.remove(stack.size() - 1);
        }

        /**
         * @return The top {@code count} values, deepest first.
         */
        private List<StackValue> popOperands(int count) throws CompilationException {
            requireOperands(count);
            List<StackValue> top = stack.subList(stack.size() - count, stack.size());
            List<StackValue> operands = new ArrayList<>(top);
            top.clear();
            return operands;
        }

        /**
         * Moves every lazy value below the top {@code keep} entries to the software stack, so that
         * a result computed into registers has only pushed values beneath it.
         */
        private void spillBelow(int keep) throws CompilationException {
            for (int i = 0; i < stack.size() - keep; i++) {
                StackValue value = stack.get(i);
                if (!value.isLazy()) {
                    continue;
                }
                ValueWidth width = value.width();
                if (width == null) {
                    throw unsupported("a pending array or field handle cannot be kept on the stack");
                }
                load(value, width);
                emit(jsr(width == ValueWidth.WORD ? RuntimeLabels.PUSHAX : RuntimeLabels.PUSHA));
                stack.set(i, new StackValue.Pushed(width));
            }
        }

        private void requireEmptyStack(String where) throws CompilationException {
            if (!stack.isEmpty()) {
                throw unsupported(stack.size() + " value(s) on the evaluation stack " + where);
            }
        }

        // endregion

        // region Loads and stores

        private void pushConstant(long value) throws CompilationException {
            if (value < Short.MIN_VALUE || value > 0xFFFF) {
                throw unsupported("constant " + value + " does not fit in 16 bits");
            }
            int encoded = value < 0 && value >= Byte.MIN_VALUE ? (int) value & 0xFF : (int) value & 0xFFFF;
            push(new StackValue.Constant(encoded));
        }

        private void loadString(IlOperand.StringLiteral literal) throws CompilationException {
            if (!LiteralPool.isAscii(literal.value())) {
                throw unsupported("string literal is not ASCII");
            }
            String label = literals.addString(literal.value());
            push(new StackValue.DataAddress(label, literal.value().length()));
        }

        private void loadToken(IlOperand operand) throws CompilationException {
            if (!(operand instanceof IlOperand.FieldData field)) {
                throw unsupported("only field tokens with initial data are supported");
            }
            push(new StackValue.FieldHandle(field.data()));
        }

        private void newArray(IlOperand elementType) throws CompilationException {
            String type = elementType instanceof IlOperand.TypeName name ? name.name() : elementType.toString();
            if (!type.endsWith("Byte") && !type.equals("byte") && !type.equals("uint8")) {
                throw unsupported("only byte arrays are supported, not " + type);
            }
            StackValue length = pop();
            if (!(length instanceof StackValue.Constant constant)) {
                throw unsupported("array length must be a constant");
            }
            push(new StackValue.ArrayRef(new ArraySlot(constant.value())));
        }

        private void duplicate() throws CompilationException {
            requireOperands(1);
            StackValue value = top();
            if (!value.isLazy()) {
                throw unsupported("cannot duplicate a computed value");
            }
            push(value);
        }

        private void discard() throws CompilationException {
            StackValue value = pop();
            if (value instanceof StackValue.Pushed pushed) {
                emit(jsr(pushed.width() == ValueWidth.WORD ? RuntimeLabels.POPAX : RuntimeLabels.POPA));
            }
            if (!value.isLazy()) {
                diagnostics.reportWarning("Computed value discarded", current.offset());
            }
        }

        private void loadLocal(int index) throws CompilationException {
            LocalSlot slot = locals.get(index);
            if (slot == null) {
                throw new UnsupportedInstructionException(CompilerErrorCode.UNINITIALIZED_LOCAL, current.offset(),
                        current.opcode().mnemonic(), "local " + index + " is read before it is stored");
            }
            if (slot instanceof LocalSlot.Ram ram) {
                push(new StackValue.LocalRead(ram.address(), ram.width()));
            } else {
                LocalSlot.Data data = (LocalSlot.Data) slot;
                push(new StackValue.DataAddress(data.label(), data.length()));
            }
        }

        private void storeLocal(int index) throws CompilationException {
            StackValue value = pop();
            if (value instanceof StackValue.ArrayRef array) {
                if (!array.slot().isBound()) {
                    throw unsupported("array local without initializer");
                }
                locals.put(index, new LocalSlot.Data(array.slot().label(), array.slot().length()));
                return;
            }
            if (value instanceof StackValue.DataAddress data) {
                locals.put(index, new LocalSlot.Data(data.label(), data.length()));
                return;
            }
            if (value.width() == null) {
                throw unsupported("value cannot be stored in a local");
            }
            LocalSlot existing = locals.get(index);
            LocalSlot.Ram slot;
            if (existing == null) {
                if (NesConstants.LOCALS_START + localBytes + value.width().bytes() > NesConstants.LOCALS_END) {
                    throw unsupported("local variables exceed the RAM reserved for them");
                }
                slot = new LocalSlot.Ram(NesConstants.LOCALS_START + localBytes, value.width());
                localBytes += value.width().bytes();
                locals.put(index, slot);
                CompilerLogger.trace(String.format("local %d at $%04X (%s)", index, slot.address(), slot.width()));
            } else if (existing instanceof LocalSlot.Ram ram) {
                slot = ram;
                if (value.width() == ValueWidth.WORD && ram.width() == ValueWidth.BYTE) {
                    throw unsupported("16-bit value stored to 8-bit local " + index);
                }
            } else {
                throw unsupported("array local " + index + " cannot be reassigned");
            }
            final int address = slot.address();
            if (stack.stream().anyMatch(v -> v instanceof StackValue.LocalRead read && read.address() == address)) {
                spillBelow(0);
            }
            load(value, slot.width());
            emit(abs(Opcode.STA, address));
            if (slot.width() == ValueWidth.WORD) {
                emit(abs(Opcode.STX, address + 1));
            }
        }

        private void narrowToByte() throws CompilationException {
            StackValue value = pop();
            if (value instanceof StackValue.Constant constant) {
                value = new StackValue.Constant(constant.value() & 0xFF);
            } else if (value instanceof StackValue.LocalRead read) {
                value = new StackValue.LocalRead(read.address(), ValueWidth.BYTE);
            } else if (value instanceof StackValue.InRegisters registers) {
                value = new StackValue.InRegisters(ValueWidth.BYTE, registers.flagsValid()
                        && registers.width() == ValueWidth.BYTE);
            } else if (value instanceof StackValue.Pushed pushed && pushed.width() == ValueWidth.WORD) {
                throw unsupported("narrowing a 16-bit value on the software stack");
            } else if (value.width() != ValueWidth.BYTE) {
                throw unsupported("value cannot be converted to a byte");
            }
            stack.add(value);
        }

        /**
         * Loads a value into A, or A and X for {@link ValueWidth#WORD}.
         *
         * @return Whether the Z and N flags reflect A afterwards.
         */
        private boolean load(StackValue value, ValueWidth width) throws CompilationException {
            if (value instanceof StackValue.Constant constant) {
                if (width == ValueWidth.BYTE) {
                    if (constant.value() > 0xFF) {
                        throw shapeError(String.format("constant $%04X passed as a byte", constant.value()));
                    }
                    emit(imm(Opcode.LDA, constant.value()));
                } else {
                    emit(imm(Opcode.LDX, constant.value() >> 8));
                    emit(imm(Opcode.LDA, constant.value() & 0xFF));
                }
                return true;
            }
            if (value instanceof StackValue.LocalRead read) {
                emit(abs(Opcode.LDA, read.address()));
                if (width == ValueWidth.WORD) {
                    if (read.width() == ValueWidth.WORD) {
                        emit(abs(Opcode.LDX, read.address() + 1));
                    } else {
                        emit(imm(Opcode.LDX, 0x00));
                    }
                    return false;
                }
                return true;
            }
            if (value instanceof StackValue.ArrayRef array) {
                if (!array.slot().isBound()) {
                    throw unsupported("array without initializer");
                }
                return load(array.asData(), width);
            }
            if (value instanceof StackValue.DataAddress data) {
                if (width != ValueWidth.WORD) {
                    throw shapeError("address of " + data.label() + " passed as a byte");
                }
                emit(lowByte(Opcode.LDA, data.label()));
                emit(highByte(Opcode.LDX, data.label()));
                return false;
            }
            if (value instanceof StackValue.InRegisters registers) {
                if (width == ValueWidth.WORD && registers.width() == ValueWidth.BYTE) {
                    emit(imm(Opcode.LDX, 0x00));
                    return false;
                }
                return registers.flagsValid();
            }
            if (value instanceof StackValue.Pushed pushed) {
                emit(jsr(pushed.width() == ValueWidth.WORD ? RuntimeLabels.POPAX : RuntimeLabels.POPA));
                if (width == ValueWidth.WORD && pushed.width() == ValueWidth.BYTE) {
                    emit(imm(Opcode.LDX, 0x00));
                }
                return false;
            }
            throw shapeError("a field handle cannot be loaded");
        }

        // endregion

        // region Arithmetic

        private void binary(IlOpcode opcode) throws CompilationException {
            requireOperands(2);
            StackValue right = stack.get(stack.size() - 1);
            StackValue left = stack.get(stack.size() - 2);
            if (left instanceof StackValue.Constant l && right instanceof StackValue.Constant r) {
                popOperands(2);
                push(new StackValue.Constant(fold(opcode, l.value(), r.value())));
                return;
            }
            boolean commutative = opcode == IlOpcode.ADD || opcode == IlOpcode.AND
                    || opcode == IlOpcode.OR || opcode == IlOpcode.XOR;
            if (commutative && left instanceof StackValue.Constant) {
                StackValue swap = left;
                left = right;
                right = swap;
            }
            if (left.width() != ValueWidth.BYTE) {
                throw unsupported("runtime arithmetic is limited to 8-bit operands");
            }
            Opcode operation = operation(opcode);
            boolean shift = opcode == IlOpcode.SHL || opcode == IlOpcode.SHR || opcode == IlOpcode.SHR_UN;
            if (shift && !(right instanceof StackValue.Constant)) {
                throw unsupported("shift count must be a constant");
            }
            boolean immediate = right instanceof StackValue.Constant c && c.value() <= 0xFF;
            boolean memory = right instanceof StackValue.LocalRead read && read.width() == ValueWidth.BYTE;
            if (!immediate && !memory) {
                throw unsupported("right operand must be an 8-bit constant or local");
            }
            spillBelow(2);
            popOperands(2);
            load(left, ValueWidth.BYTE);
            if (shift) {
                int count = Math.min(((StackValue.Constant) right).value(), 8);
                for (int i = 0; i < count; i++) {
                    emit(acc(operation));
                }
            } else {
                if (opcode == IlOpcode.ADD) {
                    emit(imp(Opcode.CLC));
                } else if (opcode == IlOpcode.SUB) {
                    emit(imp(Opcode.SEC));
                }
                emit(immediate
                        ? imm(operation, ((StackValue.Constant) right).value())
                        : abs(operation, ((StackValue.LocalRead) right).address()));
            }
            push(new StackValue.InRegisters(ValueWidth.BYTE, true));
        }

        private Opcode operation(IlOpcode opcode) throws CompilationException {
            switch (opcode) {
                case ADD: return Opcode.ADC;
                case SUB: return Opcode.SBC;
                case AND: return Opcode.AND;
                case OR: return Opcode.ORA;
                case XOR: return Opcode.EOR;
                case SHL: return Opcode.ASL;
                case SHR:
                case SHR_UN: return Opcode.LSR;
                default: throw unsupported("runtime " + opcode.mnemonic() + " is not supported");
            }
        }

        private int fold(IlOpcode opcode, int left, int right) throws CompilationException {
            switch (opcode) {
                case ADD: return left + right;
                case SUB: return left - right;
                case MUL: return left * right;
                case AND: return left & right;
                case OR: return left | right;
                case XOR: return left ^ right;
                case SHL: return left << right;
                case SHR:
                case SHR_UN: return left >>> right;
                default:
                    if (right == 0) {
                        throw unsupported("division by zero");
                    }
                    return opcode == IlOpcode.DIV || opcode == IlOpcode.DIV_UN ? left / right : left % right;
            }
        }

        // endregion

        // region Calls

        private void call(String name) throws CompilationException {
            List<LibraryFunction> overloads = LibraryFunction.overloads(name);
            if (overloads.isEmpty()) {
                throw new SubroutineNotFoundException(name);
            }
            LibraryFunction function = selectOverload(overloads);
            switch (function.rule()) {
                case FOLD_NAMETABLE -> foldNametable(function);
                case BIND_ARRAY -> bindArray();
                default -> callRoutine(function);
            }
        }

        private LibraryFunction selectOverload(List<LibraryFunction> overloads) throws CompilationException {
            List<LibraryFunction> byArity = new ArrayList<>(overloads);
            byArity.sort(Comparator.comparingInt(LibraryFunction::arity).reversed());
            for (LibraryFunction candidate : byArity) {
                if (candidate.arity() <= stack.size() && accepts(candidate)) {
                    return candidate;
                }
            }
            int fewest = byArity.get(byArity.size() - 1).arity();
            requireOperands(fewest);
            throw shapeError("arguments do not match any overload of " + overloads.get(0).externalName());
        }

        private boolean accepts(LibraryFunction function) {
            List<ArgumentKind> kinds = function.arguments();
            int base = stack.size() - kinds.size();
            for (int i = 0; i < kinds.size(); i++) {
                StackValue value = stack.get(base + i);
                if (function.rule() == LibraryFunction.CallRule.BIND_ARRAY && kinds.get(i) == ArgumentKind.DATA) {
                    if (!(value instanceof StackValue.ArrayRef)) {
                        return false;
                    }
                } else if (!accepts(kinds.get(i), value)) {
                    return false;
                }
            }
            return true;
        }

        private boolean accepts(ArgumentKind kind, StackValue value) {
            switch (kind) {
                case BYTE:
                    return value.width() == ValueWidth.BYTE;
                case WORD:
                    return value.width() != null
                            && !(value instanceof StackValue.Pushed pushed && pushed.width() == ValueWidth.BYTE);
                case DATA:
                case DATA_WITH_LENGTH:
                    return value instanceof StackValue.DataAddress
                            || value instanceof StackValue.ArrayRef array && array.slot().isBound();
                default:
                    return value instanceof StackValue.FieldHandle;
            }
        }

        private void foldNametable(LibraryFunction function) throws CompilationException {
            List<StackValue> arguments = popOperands(2);
            if (!(arguments.get(0) instanceof StackValue.Constant x)
                    || !(arguments.get(1) instanceof StackValue.Constant y)) {
                throw unsupported(function.externalName() + " needs constant arguments");
            }
            int address = function.foldNametable(x.value(), y.value());
            CompilerLogger.trace(String.format("%s(%d, %d) folded to $%04X", function.externalName(),
                    x.value(), y.value(), address));
            push(new StackValue.Constant(address));
        }

        private void bindArray() throws CompilationException {
            List<StackValue> arguments = popOperands(2);
            ArraySlot slot = ((StackValue.ArrayRef) arguments.get(0)).slot();
            byte[] data = ((StackValue.FieldHandle) arguments.get(1)).data();
            if (slot.isBound()) {
                throw unsupported("array initialized twice");
            }
            if (data.length < slot.length()) {
                throw shapeError("field data has " + data.length + " bytes, array needs " + slot.length());
            }
            slot.bind(literals.addByteArray(Arrays.copyOf(data, slot.length())));
        }

        private void callRoutine(LibraryFunction function) throws CompilationException {
            String routine = catalog.find(function.externalName()).name();
            List<ArgumentKind> kinds = function.arguments();
            if (function.returnWidth() != LibraryFunction.ReturnWidth.VOID) {
                spillBelow(kinds.size());
            }
            List<StackValue> arguments = popOperands(kinds.size());
            for (int i = 0; i < arguments.size(); i++) {
                passArgument(arguments.get(i), kinds.get(i), i == arguments.size() - 1);
            }
            emit(jsr(routine));
            calledRoutines.add(routine);
            switch (function.returnWidth()) {
                case BYTE -> push(new StackValue.InRegisters(ValueWidth.BYTE, false));
                case WORD -> push(new StackValue.InRegisters(ValueWidth.WORD, false));
                default -> { }
            }
        }

        private void passArgument(StackValue value, ArgumentKind kind, boolean last) throws CompilationException {
            if (kind == ArgumentKind.DATA_WITH_LENGTH) {
                StackValue.DataAddress data = value instanceof StackValue.ArrayRef array
                        ? array.asData() : (StackValue.DataAddress) value;
                load(data, ValueWidth.WORD);
                emit(jsr(RuntimeLabels.PUSHAX));
                value = new StackValue.Constant(data.length());
                kind = ArgumentKind.WORD;
            }
            ValueWidth width = kind == ArgumentKind.BYTE ? ValueWidth.BYTE : ValueWidth.WORD;
            if (value instanceof StackValue.Pushed && !last) {
                return;
            }
            load(value, width);
            if (!last) {
                emit(jsr(width == ValueWidth.WORD ? RuntimeLabels.PUSHAX : RuntimeLabels.PUSHA));
            }
        }

        // endregion

        // region Control flow

        private void returnFromMain() {
            if (!stack.isEmpty()) {
                diagnostics.reportWarning(stack.size() + " value(s) left on the stack at ret", current.offset());
                stack.clear();
            }
            emit(imp(Opcode.RTS));
        }

        private void jump(int target) throws CompilationException {
            requireEmptyStack("at a branch");
            emit(jmp(ilLabel(target)));
        }

        private void branchOnValue(boolean whenNonZero, int target) throws CompilationException {
            StackValue value = pop();
            requireEmptyStack("at a branch");
            if (value instanceof StackValue.Constant constant) {
                if ((constant.value() != 0) == whenNonZero) {
                    jump(target);
                }
                return;
            }
            if (value.width() == null) {
                throw unsupported("value cannot be tested");
            }
            if (value.width() == ValueWidth.WORD) {
                load(value, ValueWidth.WORD);
                emit(zp(Opcode.STX, NesConstants.TEMP));
                emit(zp(Opcode.ORA, NesConstants.TEMP));
            } else if (!load(value, ValueWidth.BYTE)) {
                emit(imm(Opcode.CMP, 0x00));
            }
            emit(longBranch(whenNonZero ? Opcode.BNE : Opcode.BEQ, ilLabel(target)));
        }

        /**
         * Compares unsigned bytes; the right-hand side must be a constant.
         */
        private void compareAndBranch(Condition condition, int target) throws CompilationException {
            List<StackValue> operands = popOperands(2);
            requireEmptyStack("at a branch");
            StackValue left = operands.get(0);
            StackValue right = operands.get(1);
            if (left instanceof StackValue.Constant l && right instanceof StackValue.Constant r) {
                if (condition.test(l.value(), r.value())) {
                    jump(target);
                }
                return;
            }
            if (left instanceof StackValue.Constant) {
                left = operands.get(1);
                right = operands.get(0);
                condition = condition.mirror();
            }
            if (!(right instanceof StackValue.Constant constant) || constant.value() > 0xFF
                    || left.width() != ValueWidth.BYTE) {
                throw unsupported("comparison needs an 8-bit value and an 8-bit constant");
            }
            int value = constant.value();
            String label = ilLabel(target);
            load(left, ValueWidth.BYTE);
            switch (condition) {
                case EQ -> compare(value, Opcode.BEQ, label);
                case NE -> compare(value, Opcode.BNE, label);
                case LT -> {
                    if (value > 0) {
                        compare(value, Opcode.BCC, label);
                    }
                }
                case GE -> {
                    if (value == 0) {
                        emit(jmp(label));
                    } else {
                        compare(value, Opcode.BCS, label);
                    }
                }
                case GT -> {
                    if (value < 0xFF) {
                        compare(value + 1, Opcode.BCS, label);
                    }
                }
                case LE -> {
                    if (value == 0xFF) {
                        emit(jmp(label));
                    } else {
                        compare(value + 1, Opcode.BCC, label);
                    }
                }
                default -> throw new IllegalStateException("Unhandled condition " + condition);
            }
        }

        private void compare(int value, Opcode branch, String label) {
            emit(imm(Opcode.CMP, value));
            emit(longBranch(branch, label));
        }

        // endregion

        private void emit(TargetInstruction instruction) {
            main.emit(instruction);
        }

        private UnsupportedInstructionException unsupported(String reason) {
            return new UnsupportedInstructionException(current.offset(), current.opcode().mnemonic(), reason);
        }

        private UnsupportedInstructionException shapeError(String reason) {
            return new UnsupportedInstructionException(CompilerErrorCode.INVALID_CALL_SHAPE, current.offset(),
                    current.opcode().mnemonic(), reason);
        }
    }
}
