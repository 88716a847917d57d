package com.columnhierarchy.core.util;

import java.util.Set;

/**
 * Turns arbitrary field and type names into legal Java identifiers.
 */
public final class JavaIdentifiers {

    private static final Set<String> RESERVED = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
        "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
        "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
        "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
        "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
        "volatile", "while", "true", "false", "null", "var", "record", "yield", "sealed", "permits", "_"
    );

    private JavaIdentifiers() {
        // Utility class
    }

    /**
     * Converts a name to a Java identifier.
     *
     * <p>Illegal characters become {@code _}, a leading digit gets a {@code _} prefix and
     * reserved words get a {@code _} suffix. Legal names are returned unchanged.
     *
     * @param name original name
     * @return legal identifier
     * @throws IllegalArgumentException if name is null or empty
     */
    public static String toIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Name must not be null or empty");
        }

        StringBuilder sb = new StringBuilder(name.length() + 1);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) ? c : '_');
        }
        if (!Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }

        String identifier = sb.toString();
        return RESERVED.contains(identifier) ? identifier + "_" : identifier;
    }

    /**
     * Checks whether a name is already a legal identifier.
     *
     * @param name name to check
     * @return true if {@link #toIdentifier(String)} would return it unchanged
     */
    public static boolean isIdentifier(String name) {
        return name != null && !name.isEmpty() && toIdentifier(name).equals(name);
    }
}
