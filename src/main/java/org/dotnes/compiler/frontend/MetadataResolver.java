package org.dotnes.compiler.frontend;

import java.util.Optional;

/**
 * Resolves metadata tokens of the compiled program.
 */
public interface MetadataResolver {

    /**
     * @param token A MethodDef, MemberRef or MethodSpec token.
     * @return The simple name of the method.
     */
    Optional<String> memberName(int token);

    /**
     * @param token A user string token.
     * @return The string.
     */
    Optional<String> userString(int token);

    /**
     * @param token A field token.
     * @return The initial data of the field, if it has an RVA.
     */
    Optional<byte[]> fieldData(int token);

    /**
     * @param token A type or field token.
     * @return Its name.
     */
    Optional<String> typeName(int token);
}
