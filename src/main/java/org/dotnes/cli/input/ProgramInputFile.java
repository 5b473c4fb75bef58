package org.dotnes.cli.input;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dotnes.compiler.frontend.MetadataTable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * The JSON description of a program handed to the {@code compile} command:
 * <pre>
 * { "il": "16 18 28 01 00 00 0A ...",
 *   "members": { "0x0A000001": "pal_col" },
 *   "strings": { "0x70000001": "HELLO, .NET!" },
 *   "fields":  { "0x04000001": "00 01 02" },
 *   "types":   { "0x01000001": "System.Byte" } }
 * </pre>
 * Byte strings are hexadecimal, optionally separated by whitespace. Tokens are hexadecimal with an
 * optional {@code 0x} prefix.
 */
public final class ProgramInputFile {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String il;
    private final Map<String, String> members;
    private final Map<String, String> strings;
    private final Map<String, String> fields;
    private final Map<String, String> types;

    @JsonCreator
    public ProgramInputFile(@JsonProperty(value = "il", required = true) String il,
                            @JsonProperty("members") Map<String, String> members,
                            @JsonProperty("strings") Map<String, String> strings,
                            @JsonProperty("fields") Map<String, String> fields,
                            @JsonProperty("types") Map<String, String> types) {
        this.il = il;
        this.members = members != null ? Map.copyOf(members) : Map.of();
        this.strings = strings != null ? Map.copyOf(strings) : Map.of();
        this.fields = fields != null ? Map.copyOf(fields) : Map.of();
        this.types = types != null ? Map.copyOf(types) : Map.of();
    }

    /**
     * Reads a program description.
     *
     * @param path The JSON file.
     * @return The parsed description.
     * @throws IOException if the file cannot be read or is not valid JSON of this shape.
     */
    public static ProgramInputFile read(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), ProgramInputFile.class);
    }

    /**
     * @return The IL body.
     * @throws IllegalArgumentException if the hex string is malformed.
     */
    public byte[] ilBytes() {
        return parseHex(il);
    }

    /**
     * @return A metadata table holding every entry of the file.
     * @throws IllegalArgumentException if a token or a field's hex data is malformed.
     */
    public MetadataTable metadata() {
        MetadataTable table = new MetadataTable();
        members.forEach((token, name) -> table.member(parseToken(token), name));
        strings.forEach((token, value) -> table.string(parseToken(token), value));
        fields.forEach((token, data) -> table.field(parseToken(token), parseHex(data)));
        types.forEach((token, name) -> table.type(parseToken(token), name));
        return table;
    }

    static int parseToken(String token) {
        String digits = token.trim().toLowerCase(Locale.ROOT);
        if (digits.startsWith("0x")) {
            digits = digits.substring(2);
        }
        try {
            return Integer.parseUnsignedInt(digits, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid metadata token: " + token, e);
        }
    }

    static byte[] parseHex(String text) {
        String digits = text.replaceAll("\\s+", "");
        if (digits.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex data has an odd number of digits");
        }
        byte[] bytes = new byte[digits.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            int high = Character.digit(digits.charAt(2 * i), 16);
            int low = Character.digit(digits.charAt(2 * i + 1), 16);
            if (high < 0 || low < 0) {
                throw new IllegalArgumentException("Invalid hex digit near position " + (2 * i));
            }
            bytes[i] = (byte) (high << 4 | low);
        }
        return bytes;
    }
}
