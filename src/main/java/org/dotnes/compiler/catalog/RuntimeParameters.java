package org.dotnes.compiler.catalog;

/**
 * Program-dependent values some runtime routines are parameterized with.
 *
 * @param localBytes The number of RAM bytes occupied by local variables.
 */
public record RuntimeParameters(int localBytes) {

    public RuntimeParameters {
        if (localBytes < 0 || localBytes > 0xFF) {
            throw new IllegalArgumentException("localBytes must be in 0..255: " + localBytes);
        }
    }
}
