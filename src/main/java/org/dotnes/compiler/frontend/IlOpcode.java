package org.dotnes.compiler.frontend;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The CIL instruction set (ECMA-335 partition III) with the operand encoding of every opcode.
 */
public enum IlOpcode {
    NOP(0x00, "nop", OperandKind.NONE),
    BREAK(0x01, "break", OperandKind.NONE),
    LDARG_0(0x02, "ldarg.0", OperandKind.NONE),
    LDARG_1(0x03, "ldarg.1", OperandKind.NONE),
    LDARG_2(0x04, "ldarg.2", OperandKind.NONE),
    LDARG_3(0x05, "ldarg.3", OperandKind.NONE),
    LDLOC_0(0x06, "ldloc.0", OperandKind.NONE),
    LDLOC_1(0x07, "ldloc.1", OperandKind.NONE),
    LDLOC_2(0x08, "ldloc.2", OperandKind.NONE),
    LDLOC_3(0x09, "ldloc.3", OperandKind.NONE),
    STLOC_0(0x0A, "stloc.0", OperandKind.NONE),
    STLOC_1(0x0B, "stloc.1", OperandKind.NONE),
    STLOC_2(0x0C, "stloc.2", OperandKind.NONE),
    STLOC_3(0x0D, "stloc.3", OperandKind.NONE),
    LDARG_S(0x0E, "ldarg.s", OperandKind.UINT8),
    LDARGA_S(0x0F, "ldarga.s", OperandKind.UINT8),
    STARG_S(0x10, "starg.s", OperandKind.UINT8),
    LDLOC_S(0x11, "ldloc.s", OperandKind.UINT8),
    LDLOCA_S(0x12, "ldloca.s", OperandKind.UINT8),
    STLOC_S(0x13, "stloc.s", OperandKind.UINT8),
    LDNULL(0x14, "ldnull", OperandKind.NONE),
    LDC_I4_M1(0x15, "ldc.i4.m1", OperandKind.NONE),
    LDC_I4_0(0x16, "ldc.i4.0", OperandKind.NONE),
    LDC_I4_1(0x17, "ldc.i4.1", OperandKind.NONE),
    LDC_I4_2(0x18, "ldc.i4.2", OperandKind.NONE),
    LDC_I4_3(0x19, "ldc.i4.3", OperandKind.NONE),
    LDC_I4_4(0x1A, "ldc.i4.4", OperandKind.NONE),
    LDC_I4_5(0x1B, "ldc.i4.5", OperandKind.NONE),
    LDC_I4_6(0x1C, "ldc.i4.6", OperandKind.NONE),
    LDC_I4_7(0x1D, "ldc.i4.7", OperandKind.NONE),
    LDC_I4_8(0x1E, "ldc.i4.8", OperandKind.NONE),
    LDC_I4_S(0x1F, "ldc.i4.s", OperandKind.INT8),
    LDC_I4(0x20, "ldc.i4", OperandKind.INT32),
    LDC_I8(0x21, "ldc.i8", OperandKind.INT64),
    LDC_R4(0x22, "ldc.r4", OperandKind.FLOAT32),
    LDC_R8(0x23, "ldc.r8", OperandKind.FLOAT64),
    DUP(0x25, "dup", OperandKind.NONE),
    POP(0x26, "pop", OperandKind.NONE),
    JMP(0x27, "jmp", OperandKind.TOKEN),
    CALL(0x28, "call", OperandKind.TOKEN),
    CALLI(0x29, "calli", OperandKind.TOKEN),
    RET(0x2A, "ret", OperandKind.NONE),
    BR_S(0x2B, "br.s", OperandKind.BRANCH8),
    BRFALSE_S(0x2C, "brfalse.s", OperandKind.BRANCH8),
    BRTRUE_S(0x2D, "brtrue.s", OperandKind.BRANCH8),
    BEQ_S(0x2E, "beq.s", OperandKind.BRANCH8),
    BGE_S(0x2F, "bge.s", OperandKind.BRANCH8),
    BGT_S(0x30, "bgt.s", OperandKind.BRANCH8),
    BLE_S(0x31, "ble.s", OperandKind.BRANCH8),
    BLT_S(0x32, "blt.s", OperandKind.BRANCH8),
    BNE_UN_S(0x33, "bne.un.s", OperandKind.BRANCH8),
    BGE_UN_S(0x34, "bge.un.s", OperandKind.BRANCH8),
    BGT_UN_S(0x35, "bgt.un.s", OperandKind.BRANCH8),
    BLE_UN_S(0x36, "ble.un.s", OperandKind.BRANCH8),
    BLT_UN_S(0x37, "blt.un.s", OperandKind.BRANCH8),
    BR(0x38, "br", OperandKind.BRANCH32),
    BRFALSE(0x39, "brfalse", OperandKind.BRANCH32),
    BRTRUE(0x3A, "brtrue", OperandKind.BRANCH32),
    BEQ(0x3B, "beq", OperandKind.BRANCH32),
    BGE(0x3C, "bge", OperandKind.BRANCH32),
    BGT(0x3D, "bgt", OperandKind.BRANCH32),
    BLE(0x3E, "ble", OperandKind.BRANCH32),
    BLT(0x3F, "blt", OperandKind.BRANCH32),
    BNE_UN(0x40, "bne.un", OperandKind.BRANCH32),
    BGE_UN(0x41, "bge.un", OperandKind.BRANCH32),
    BGT_UN(0x42, "bgt.un", OperandKind.BRANCH32),
    BLE_UN(0x43, "ble.un", OperandKind.BRANCH32),
    BLT_UN(0x44, "blt.un", OperandKind.BRANCH32),
    SWITCH(0x45, "switch", OperandKind.SWITCH),
    LDIND_I1(0x46, "ldind.i1", OperandKind.NONE),
    LDIND_U1(0x47, "ldind.u1", OperandKind.NONE),
    LDIND_I2(0x48, "ldind.i2", OperandKind.NONE),
    LDIND_U2(0x49, "ldind.u2", OperandKind.NONE),
    LDIND_I4(0x4A, "ldind.i4", OperandKind.NONE),
    LDIND_U4(0x4B, "ldind.u4", OperandKind.NONE),
    LDIND_I8(0x4C, "ldind.i8", OperandKind.NONE),
    LDIND_I(0x4D, "ldind.i", OperandKind.NONE),
    LDIND_R4(0x4E, "ldind.r4", OperandKind.NONE),
    LDIND_R8(0x4F, "ldind.r8", OperandKind.NONE),
    LDIND_REF(0x50, "ldind.ref", OperandKind.NONE),
    STIND_REF(0x51, "stind.ref", OperandKind.NONE),
    STIND_I1(0x52, "stind.i1", OperandKind.NONE),
    STIND_I2(0x53, "stind.i2", OperandKind.NONE),
    STIND_I4(0x54, "stind.i4", OperandKind.NONE),
    STIND_I8(0x55, "stind.i8", OperandKind.NONE),
    STIND_R4(0x56, "stind.r4", OperandKind.NONE),
    STIND_R8(0x57, "stind.r8", OperandKind.NONE),
    ADD(0x58, "add", OperandKind.NONE),
    SUB(0x59, "sub", OperandKind.NONE),
    MUL(0x5A, "mul", OperandKind.NONE),
    DIV(0x5B, "div", OperandKind.NONE),
    DIV_UN(0x5C, "div.un", OperandKind.NONE),
    REM(0x5D, "rem", OperandKind.NONE),
    REM_UN(0x5E, "rem.un", OperandKind.NONE),
    AND(0x5F, "and", OperandKind.NONE),
    OR(0x60, "or", OperandKind.NONE),
    XOR(0x61, "xor", OperandKind.NONE),
    SHL(0x62, "shl", OperandKind.NONE),
    SHR(0x63, "shr", OperandKind.NONE),
    SHR_UN(0x64, "shr.un", OperandKind.NONE),
    NEG(0x65, "neg", OperandKind.NONE),
    NOT(0x66, "not", OperandKind.NONE),
    CONV_I1(0x67, "conv.i1", OperandKind.NONE),
    CONV_I2(0x68, "conv.i2", OperandKind.NONE),
    CONV_I4(0x69, "conv.i4", OperandKind.NONE),
    CONV_I8(0x6A, "conv.i8", OperandKind.NONE),
    CONV_R4(0x6B, "conv.r4", OperandKind.NONE),
    CONV_R8(0x6C, "conv.r8", OperandKind.NONE),
    CONV_U4(0x6D, "conv.u4", OperandKind.NONE),
    CONV_U8(0x6E, "conv.u8", OperandKind.NONE),
    CALLVIRT(0x6F, "callvirt", OperandKind.TOKEN),
    CPOBJ(0x70, "cpobj", OperandKind.TOKEN),
    LDOBJ(0x71, "ldobj", OperandKind.TOKEN),
    LDSTR(0x72, "ldstr", OperandKind.STRING),
    NEWOBJ(0x73, "newobj", OperandKind.TOKEN),
    CASTCLASS(0x74, "castclass", OperandKind.TOKEN),
    ISINST(0x75, "isinst", OperandKind.TOKEN),
    CONV_R_UN(0x76, "conv.r.un", OperandKind.NONE),
    UNBOX(0x79, "unbox", OperandKind.TOKEN),
    THROW(0x7A, "throw", OperandKind.NONE),
    LDFLD(0x7B, "ldfld", OperandKind.TOKEN),
    LDFLDA(0x7C, "ldflda", OperandKind.TOKEN),
    STFLD(0x7D, "stfld", OperandKind.TOKEN),
    LDSFLD(0x7E, "ldsfld", OperandKind.TOKEN),
    LDSFLDA(0x7F, "ldsflda", OperandKind.TOKEN),
    STSFLD(0x80, "stsfld", OperandKind.TOKEN),
    STOBJ(0x81, "stobj", OperandKind.TOKEN),
    CONV_OVF_I1_UN(0x82, "conv.ovf.i1.un", OperandKind.NONE),
    CONV_OVF_I2_UN(0x83, "conv.ovf.i2.un", OperandKind.NONE),
    CONV_OVF_I4_UN(0x84, "conv.ovf.i4.un", OperandKind.NONE),
    CONV_OVF_I8_UN(0x85, "conv.ovf.i8.un", OperandKind.NONE),
    CONV_OVF_U1_UN(0x86, "conv.ovf.u1.un", OperandKind.NONE),
    CONV_OVF_U2_UN(0x87, "conv.ovf.u2.un", OperandKind.NONE),
    CONV_OVF_U4_UN(0x88, "conv.ovf.u4.un", OperandKind.NONE),
    CONV_OVF_U8_UN(0x89, "conv.ovf.u8.un", OperandKind.NONE),
    CONV_OVF_I_UN(0x8A, "conv.ovf.i.un", OperandKind.NONE),
    CONV_OVF_U_UN(0x8B, "conv.ovf.u.un", OperandKind.NONE),
    BOX(0x8C, "box", OperandKind.TOKEN),
    NEWARR(0x8D, "newarr", OperandKind.TOKEN),
    LDLEN(0x8E, "ldlen", OperandKind.NONE),
    LDELEMA(0x8F, "ldelema", OperandKind.TOKEN),
    LDELEM_I1(0x90, "ldelem.i1", OperandKind.NONE),
    LDELEM_U1(0x91, "ldelem.u1", OperandKind.NONE),
    LDELEM_I2(0x92, "ldelem.i2", OperandKind.NONE),
    LDELEM_U2(0x93, "ldelem.u2", OperandKind.NONE),
    LDELEM_I4(0x94, "ldelem.i4", OperandKind.NONE),
    LDELEM_U4(0x95, "ldelem.u4", OperandKind.NONE),
    LDELEM_I8(0x96, "ldelem.i8", OperandKind.NONE),
    LDELEM_I(0x97, "ldelem.i", OperandKind.NONE),
    LDELEM_R4(0x98, "ldelem.r4", OperandKind.NONE),
    LDELEM_R8(0x99, "ldelem.r8", OperandKind.NONE),
    LDELEM_REF(0x9A, "ldelem.ref", OperandKind.NONE),
    STELEM_I(0x9B, "stelem.i", OperandKind.NONE),
    STELEM_I1(0x9C, "stelem.i1", OperandKind.NONE),
    STELEM_I2(0x9D, "stelem.i2", OperandKind.NONE),
    STELEM_I4(0x9E, "stelem.i4", OperandKind.NONE),
    STELEM_I8(0x9F, "stelem.i8", OperandKind.NONE),
    STELEM_R4(0xA0, "stelem.r4", OperandKind.NONE),
    STELEM_R8(0xA1, "stelem.r8", OperandKind.NONE),
    STELEM_REF(0xA2, "stelem.ref", OperandKind.NONE),
    LDELEM(0xA3, "ldelem", OperandKind.TOKEN),
    STELEM(0xA4, "stelem", OperandKind.TOKEN),
    UNBOX_ANY(0xA5, "unbox.any", OperandKind.TOKEN),
    CONV_OVF_I1(0xB3, "conv.ovf.i1", OperandKind.NONE),
    CONV_OVF_U1(0xB4, "conv.ovf.u1", OperandKind.NONE),
    CONV_OVF_I2(0xB5, "conv.ovf.i2", OperandKind.NONE),
    CONV_OVF_U2(0xB6, "conv.ovf.u2", OperandKind.NONE),
    CONV_OVF_I4(0xB7, "conv.ovf.i4", OperandKind.NONE),
    CONV_OVF_U4(0xB8, "conv.ovf.u4", OperandKind.NONE),
    CONV_OVF_I8(0xB9, "conv.ovf.i8", OperandKind.NONE),
    CONV_OVF_U8(0xBA, "conv.ovf.u8", OperandKind.NONE),
    REFANYVAL(0xC2, "refanyval", OperandKind.TOKEN),
    CKFINITE(0xC3, "ckfinite", OperandKind.NONE),
    MKREFANY(0xC6, "mkrefany", OperandKind.TOKEN),
    LDTOKEN(0xD0, "ldtoken", OperandKind.TOKEN),
    CONV_U2(0xD1, "conv.u2", OperandKind.NONE),
    CONV_U1(0xD2, "conv.u1", OperandKind.NONE),
    CONV_I(0xD3, "conv.i", OperandKind.NONE),
    CONV_OVF_I(0xD4, "conv.ovf.i", OperandKind.NONE),
    CONV_OVF_U(0xD5, "conv.ovf.u", OperandKind.NONE),
    ADD_OVF(0xD6, "add.ovf", OperandKind.NONE),
    ADD_OVF_UN(0xD7, "add.ovf.un", OperandKind.NONE),
    MUL_OVF(0xD8, "mul.ovf", OperandKind.NONE),
    MUL_OVF_UN(0xD9, "mul.ovf.un", OperandKind.NONE),
    SUB_OVF(0xDA, "sub.ovf", OperandKind.NONE),
    SUB_OVF_UN(0xDB, "sub.ovf.un", OperandKind.NONE),
    ENDFINALLY(0xDC, "endfinally", OperandKind.NONE),
    LEAVE(0xDD, "leave", OperandKind.BRANCH32),
    LEAVE_S(0xDE, "leave.s", OperandKind.BRANCH8),
    STIND_I(0xDF, "stind.i", OperandKind.NONE),
    CONV_U(0xE0, "conv.u", OperandKind.NONE),

    // two-byte opcodes, prefixed with 0xFE
    ARGLIST(0xFE00, "arglist", OperandKind.NONE),
    CEQ(0xFE01, "ceq", OperandKind.NONE),
    CGT(0xFE02, "cgt", OperandKind.NONE),
    CGT_UN(0xFE03, "cgt.un", OperandKind.NONE),
    CLT(0xFE04, "clt", OperandKind.NONE),
    CLT_UN(0xFE05, "clt.un", OperandKind.NONE),
    LDFTN(0xFE06, "ldftn", OperandKind.TOKEN),
    LDVIRTFTN(0xFE07, "ldvirtftn", OperandKind.TOKEN),
    LDARG(0xFE09, "ldarg", OperandKind.UINT16),
    LDARGA(0xFE0A, "ldarga", OperandKind.UINT16),
    STARG(0xFE0B, "starg", OperandKind.UINT16),
    LDLOC(0xFE0C, "ldloc", OperandKind.UINT16),
    LDLOCA(0xFE0D, "ldloca", OperandKind.UINT16),
    STLOC(0xFE0E, "stloc", OperandKind.UINT16),
    LOCALLOC(0xFE0F, "localloc", OperandKind.NONE),
    ENDFILTER(0xFE11, "endfilter", OperandKind.NONE),
    UNALIGNED(0xFE12, "unaligned.", OperandKind.UINT8),
    VOLATILE(0xFE13, "volatile.", OperandKind.NONE),
    TAIL(0xFE14, "tail.", OperandKind.NONE),
    INITOBJ(0xFE15, "initobj", OperandKind.TOKEN),
    CONSTRAINED(0xFE16, "constrained.", OperandKind.TOKEN),
    CPBLK(0xFE17, "cpblk", OperandKind.NONE),
    INITBLK(0xFE18, "initblk", OperandKind.NONE),
    NO(0xFE19, "no.", OperandKind.UINT8),
    RETHROW(0xFE1A, "rethrow", OperandKind.NONE),
    SIZEOF(0xFE1C, "sizeof", OperandKind.TOKEN),
    REFANYTYPE(0xFE1D, "refanytype", OperandKind.NONE),
    READONLY(0xFE1E, "readonly.", OperandKind.NONE);

    /** First byte of every two-byte opcode. */
    public static final int EXTENSION_PREFIX = 0xFE;

    private static final Map<Integer, IlOpcode> BY_CODE = new HashMap<>();

    static {
        for (IlOpcode opcode : values()) {
            BY_CODE.put(opcode.code, opcode);
        }
    }

    private final int code;
    private final String mnemonic;
    private final OperandKind operandKind;

    IlOpcode(int code, String mnemonic, OperandKind operandKind) {
        this.code = code;
        this.mnemonic = mnemonic;
        this.operandKind = operandKind;
    }

    /**
     * @return The opcode value; two-byte opcodes are {@code 0xFE00 | second byte}.
     */
    public int code() {
        return code;
    }

    public String mnemonic() {
        return mnemonic;
    }

    public OperandKind operandKind() {
        return operandKind;
    }

    /**
     * @return The number of bytes the opcode itself occupies.
     */
    public int opcodeSize() {
        return code > 0xFF ? 2 : 1;
    }

    /**
     * @param code A one-byte opcode, or {@code 0xFE00 | b} for a two-byte opcode.
     * @return The opcode, or empty if the value is not assigned.
     */
    public static Optional<IlOpcode> fromCode(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
