package org.dotnes.compiler.frontend;

import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.DecodeException;
import org.dotnes.compiler.diagnostics.CompilerLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes a method body into {@link StructuredInstruction}s.
 * <p>
 * The reader is stateless; {@link #read(byte[], MetadataResolver)} can be called any number of
 * times and returns equal results for equal input.
 */
public final class BytecodeReader {

    private static final Set<IlOpcode> METHOD_OPERANDS = EnumSet.of(
            IlOpcode.CALL, IlOpcode.CALLVIRT, IlOpcode.NEWOBJ, IlOpcode.JMP, IlOpcode.LDFTN, IlOpcode.LDVIRTFTN);

    /**
     * Decodes a complete method body.
     *
     * @param body The IL bytes.
     * @param metadata Resolves the tokens in the body.
     * @return The instructions in body order.
     * @throws DecodeException if an opcode is unknown, an operand is truncated or a token cannot
     *         be resolved.
     */
    public List<StructuredInstruction> read(byte[] body, MetadataResolver metadata) throws DecodeException {
        CompilerLogger.debug("BytecodeReader: decoding " + body.length + " bytes");
        List<StructuredInstruction> instructions = new ArrayList<>();
        Cursor cursor = new Cursor(body);
        while (cursor.hasMore()) {
            instructions.add(readInstruction(cursor, metadata));
        }
        CompilerLogger.debug("BytecodeReader: " + instructions.size() + " instructions");
        return Collections.unmodifiableList(instructions);
    }

    private StructuredInstruction readInstruction(Cursor cursor, MetadataResolver metadata) throws DecodeException {
        int offset = cursor.position;
        int first = cursor.u8(offset);
        int code = first;
        if (first == IlOpcode.EXTENSION_PREFIX) {
            code = 0xFE00 | cursor.u8(offset);
        }
        final int opcodeValue = code;
        IlOpcode opcode = IlOpcode.fromCode(code).orElseThrow(() -> new DecodeException(
                CompilerErrorCode.UNKNOWN_OPCODE, offset, String.format("Unknown opcode 0x%02X", opcodeValue)));
        IlOperand operand = readOperand(cursor, offset, opcode, metadata);
        StructuredInstruction instruction = new StructuredInstruction(offset, cursor.position - offset, opcode, operand);
        CompilerLogger.trace(instruction.toString());
        return instruction;
    }

    private IlOperand readOperand(Cursor cursor, int offset, IlOpcode opcode, MetadataResolver metadata)
            throws DecodeException {
        switch (opcode.operandKind()) {
            case NONE:
                return IlOperand.None.INSTANCE;
            case INT8:
                return new IlOperand.IntValue((byte) cursor.u8(offset));
            case UINT8:
                return new IlOperand.IntValue(cursor.u8(offset));
            case UINT16:
                return new IlOperand.IntValue(cursor.u16(offset));
            case INT32:
                return new IlOperand.IntValue(cursor.i32(offset));
            case INT64:
                return new IlOperand.IntValue(cursor.i64(offset));
            case FLOAT32:
                return new IlOperand.FloatValue(Float.intBitsToFloat(cursor.i32(offset)));
            case FLOAT64:
                return new IlOperand.FloatValue(Double.longBitsToDouble(cursor.i64(offset)));
            case BRANCH8: {
                int delta = (byte) cursor.u8(offset);
                return new IlOperand.BranchTarget(cursor.position + delta);
            }
            case BRANCH32: {
                int delta = cursor.i32(offset);
                return new IlOperand.BranchTarget(cursor.position + delta);
            }
            case SWITCH:
                return readSwitch(cursor, offset);
            case STRING: {
                int token = cursor.i32(offset);
                String value = resolve(metadata.userString(token), offset, token, "user string");
                return new IlOperand.StringLiteral(token, value);
            }
            case TOKEN:
                return readToken(cursor.i32(offset), offset, opcode, metadata);
            default:
                throw new IllegalStateException("Unhandled operand kind " + opcode.operandKind());
        }
    }

    private IlOperand readSwitch(Cursor cursor, int offset) throws DecodeException {
        long count = cursor.i32(offset) & 0xFFFFFFFFL;
        if (count * 4 > cursor.remaining()) {
            throw new DecodeException(CompilerErrorCode.TRUNCATED_OPERAND, offset,
                    "switch with " + count + " targets exceeds the method body");
        }
        int[] deltas = new int[(int) count];
        for (int i = 0; i < deltas.length; i++) {
            deltas[i] = cursor.i32(offset);
        }
        List<Integer> targets = new ArrayList<>(deltas.length);
        for (int delta : deltas) {
            targets.add(cursor.position + delta);
        }
        return new IlOperand.SwitchTargets(targets);
    }

    private IlOperand readToken(int token, int offset, IlOpcode opcode, MetadataResolver metadata)
            throws DecodeException {
        if (METHOD_OPERANDS.contains(opcode)) {
            return new IlOperand.Member(token, resolve(metadata.memberName(token), offset, token, "method"));
        }
        if (opcode == IlOpcode.LDTOKEN && MetadataTable.tableOf(token) == MetadataTable.FIELD_TABLE) {
            Optional<byte[]> data = metadata.fieldData(token);
            if (data.isPresent()) {
                return new IlOperand.FieldData(token, data.get());
            }
        }
        return new IlOperand.TypeName(token, resolve(metadata.typeName(token), offset, token, "type or field"));
    }

    private static <T> T resolve(Optional<T> value, int offset, int token, String what) throws DecodeException {
        if (value.isEmpty()) {
            throw new DecodeException(CompilerErrorCode.UNRESOLVED_TOKEN, offset,
                    String.format("Cannot resolve %s token 0x%08X", what, token));
        }
        return value.get();
    }

    /**
     * Read position in the body; every read checks the remaining length.
     */
    private static final class Cursor {
        private final byte[] body;
        private int position;

        Cursor(byte[] body) {
            this.body = body;
        }

        boolean hasMore() {
            return position < body.length;
        }

        int remaining() {
            return body.length - position;
        }

        private void require(int count, int instructionOffset) throws DecodeException {
            if (remaining() < count) {
                throw new DecodeException(CompilerErrorCode.TRUNCATED_OPERAND, instructionOffset,
                        "Method body ends " + (count - remaining()) + " byte(s) short of the operand");
            }
        }

        int u8(int instructionOffset) throws DecodeException {
            require(1, instructionOffset);
            return body[position++] & 0xFF;
        }

        int u16(int instructionOffset) throws DecodeException {
            require(2, instructionOffset);
            int value = (body[position] & 0xFF) | (body[position + 1] & 0xFF) << 8;
            position += 2;
            return value;
        }

        int i32(int instructionOffset) throws DecodeException {
            require(4, instructionOffset);
            int value = 0;
            for (int i = 3; i >= 0; i--) {
                value = (value << 8) | (body[position + i] & 0xFF);
            }
            position += 4;
            return value;
        }

        long i64(int instructionOffset) throws DecodeException {
            require(8, instructionOffset);
            long value = 0;
            for (int i = 7; i >= 0; i--) {
                value = (value << 8) | (body[position + i] & 0xFF);
            }
            position += 8;
            return value;
        }
    }
}
