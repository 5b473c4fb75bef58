package org.dotnes.compiler.frontend;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory token tables of one program.
 */
public final class MetadataTable implements MetadataResolver {

    /** Table number in the high byte of a field token. */
    public static final int FIELD_TABLE = 0x04;

    private final Map<Integer, String> members = new HashMap<>();
    private final Map<Integer, String> strings = new HashMap<>();
    private final Map<Integer, byte[]> fields = new HashMap<>();
    private final Map<Integer, String> types = new HashMap<>();

    public MetadataTable member(int token, String name) {
        members.put(token, name);
        return this;
    }

    public MetadataTable string(int token, String value) {
        strings.put(token, value);
        return this;
    }

    public MetadataTable field(int token, byte[] data) {
        fields.put(token, data.clone());
        return this;
    }

    public MetadataTable type(int token, String name) {
        types.put(token, name);
        return this;
    }

    @Override
    public Optional<String> memberName(int token) {
        return Optional.ofNullable(members.get(token));
    }

    @Override
    public Optional<String> userString(int token) {
        return Optional.ofNullable(strings.get(token));
    }

    @Override
    public Optional<byte[]> fieldData(int token) {
        return Optional.ofNullable(fields.get(token)).map(byte[]::clone);
    }

    @Override
    public Optional<String> typeName(int token) {
        return Optional.ofNullable(types.get(token));
    }

    /**
     * @param token A metadata token.
     * @return The table number encoded in its high byte.
     */
    public static int tableOf(int token) {
        return token >>> 24;
    }
}
