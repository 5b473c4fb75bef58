package org.dotnes.cli.input;

import com.fasterxml.jackson.core.JacksonException;
import org.dotnes.compiler.frontend.MetadataTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProgramInputFileTest {

    @TempDir
    Path dir;

    @Test
    @Tag("unit")
    void readsBodyAndMetadata() throws Exception {
        Path file = dir.resolve("program.json");
        Files.writeString(file, "{\n"
                + "  \"il\": \"16 18 28 01 00 00 0A\\n2B FE\",\n"
                + "  \"members\": { \"0x0A000001\": \"pal_col\" },\n"
                + "  \"strings\": { \"70000001\": \"HI\" },\n"
                + "  \"fields\": { \"0x04000001\": \"0F 30\" },\n"
                + "  \"types\": { \"0X01000001\": \"System.Byte\" }\n"
                + "}");

        ProgramInputFile program = ProgramInputFile.read(file);
        MetadataTable metadata = program.metadata();

        assertThat(program.ilBytes()).containsExactly(0x16, 0x18, 0x28, 0x01, 0x00, 0x00, 0x0A, 0x2B, 0xFE);
        assertThat(metadata.memberName(0x0A000001)).contains("pal_col");
        assertThat(metadata.userString(0x70000001)).contains("HI");
        assertThat(metadata.fieldData(0x04000001)).hasValueSatisfying(data -> assertThat(data).containsExactly(0x0F, 0x30));
        assertThat(metadata.typeName(0x01000001)).contains("System.Byte");
    }

    @Test
    @Tag("unit")
    void metadataSectionsAreOptional() throws Exception {
        Path file = dir.resolve("minimal.json");
        Files.writeString(file, "{ \"il\": \"2A\" }");

        ProgramInputFile program = ProgramInputFile.read(file);

        assertThat(program.ilBytes()).containsExactly(0x2A);
        assertThat(program.metadata().memberName(0x0A000001)).isEmpty();
    }

    @Test
    @Tag("unit")
    void bodyIsRequired() throws Exception {
        Path file = dir.resolve("empty.json");
        Files.writeString(file, "{ \"members\": {} }");

        assertThatThrownBy(() -> ProgramInputFile.read(file)).isInstanceOf(JacksonException.class);
    }

    @Test
    @Tag("unit")
    void parsesTokens() {
        assertThat(ProgramInputFile.parseToken("0x0A000001")).isEqualTo(0x0A000001);
        assertThat(ProgramInputFile.parseToken(" 70000001 ")).isEqualTo(0x70000001);
        assertThat(ProgramInputFile.parseToken("0XFFFFFFFF")).isEqualTo(-1);
        assertThatThrownBy(() -> ProgramInputFile.parseToken("token"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid metadata token: token");
    }

    @Test
    @Tag("unit")
    void parsesHexData() {
        assertThat(ProgramInputFile.parseHex("")).isEmpty();
        assertThat(ProgramInputFile.parseHex("de AD\tbe\nEF")).containsExactly(0xDE, 0xAD, 0xBE, 0xEF);
        assertThatThrownBy(() -> ProgramInputFile.parseHex("ABC")).hasMessageContaining("odd number");
        assertThatThrownBy(() -> ProgramInputFile.parseHex("0G")).hasMessageContaining("position 0");
    }
}
