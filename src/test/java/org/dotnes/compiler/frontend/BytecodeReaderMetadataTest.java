package org.dotnes.compiler.frontend;

import org.dotnes.compiler.api.CompilerErrorCode;
import org.dotnes.compiler.api.DecodeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Token resolution of the bytecode reader against a stubbed metadata source.
 */
@ExtendWith(MockitoExtension.class)
public class BytecodeReaderMetadataTest {

    @Mock
    private MetadataResolver metadata;

    private final BytecodeReader reader = new BytecodeReader();

    @Test
    @Tag("unit")
    void callTokensAreResolvedAsMethodNames() throws Exception {
        when(metadata.memberName(0x0A000001)).thenReturn(Optional.of("ppu_on_all"));
        byte[] body = new IlAssembler().op(IlOpcode.CALL).i32(0x0A000001).op(IlOpcode.RET).bytes();

        List<StructuredInstruction> instructions = reader.read(body, metadata);

        assertThat(instructions.get(0).operand()).isEqualTo(new IlOperand.Member(0x0A000001, "ppu_on_all"));
        verify(metadata).memberName(0x0A000001);
        verifyNoMoreInteractions(metadata);
    }

    @Test
    @Tag("unit")
    void fieldWithoutInitialDataFallsBackToItsName() throws Exception {
        when(metadata.fieldData(0x04000002)).thenReturn(Optional.empty());
        when(metadata.typeName(0x04000002)).thenReturn(Optional.of("buffer"));
        byte[] body = new IlAssembler().op(IlOpcode.LDTOKEN).i32(0x04000002).bytes();

        List<StructuredInstruction> instructions = reader.read(body, metadata);

        assertThat(instructions.get(0).operand()).isEqualTo(new IlOperand.TypeName(0x04000002, "buffer"));
        verify(metadata).fieldData(0x04000002);
    }

    @Test
    @Tag("unit")
    void typeTokensNeverAskForFieldData() throws Exception {
        when(metadata.typeName(0x01000003)).thenReturn(Optional.of("System.UInt16"));
        byte[] body = new IlAssembler().op(IlOpcode.LDTOKEN).i32(0x01000003).bytes();

        reader.read(body, metadata);

        verify(metadata, never()).fieldData(anyInt());
    }

    @Test
    @Tag("unit")
    void missingUserStringIsUnresolved() {
        byte[] body = new IlAssembler().op(IlOpcode.LDSTR).i32(0x70000007).bytes();

        assertThatThrownBy(() -> reader.read(body, metadata))
                .isInstanceOfSatisfying(DecodeException.class, e -> {
                    assertThat(e.getErrorCode()).isEqualTo(CompilerErrorCode.UNRESOLVED_TOKEN);
                    assertThat(e.getOffset()).isZero();
                });
        verify(metadata).userString(0x70000007);
    }
}
