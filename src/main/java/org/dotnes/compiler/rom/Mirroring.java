package org.dotnes.compiler.rom;

import java.util.Locale;

/**
 * Nametable mirroring declared in the ROM header.
 */
public enum Mirroring {
    HORIZONTAL,
    VERTICAL;

    /**
     * @param value {@code horizontal} or {@code vertical}, case-insensitive.
     * @return The mirroring.
     * @throws IllegalArgumentException for any other value.
     */
    public static Mirroring parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
