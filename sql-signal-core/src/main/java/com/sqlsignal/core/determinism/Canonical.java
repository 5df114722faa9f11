package com.sqlsignal.core.determinism;

import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Canonical key derivations shared by every list-producing step.
 */
public final class Canonical {

    private Canonical() {
        // Utility class
    }

    /**
     * Strips identifier quoting and surrounding whitespace: {@code [dbo] . [Users]} becomes {@code dbo.Users}.
     *
     * @param value identifier text
     * @return unquoted identifier
     */
    public static String unquote(String value) {
        if (value == null) {
            return "";
        }
        return value.trim()
            .replaceAll("\\s*\\.\\s*", ".")
            .replace("[", "")
            .replace("]", "")
            .replace("\"", "");
    }

    /**
     * Upper-case canonical form (table names, signals, keywords).
     *
     * @return canonicalizer
     */
    public static UnaryOperator<String> upper() {
        return value -> unquote(value).toUpperCase(Locale.ROOT);
    }

    /**
     * Lower-case canonical form (call graph ids, query terms).
     *
     * @return canonicalizer
     */
    public static UnaryOperator<String> lower() {
        return value -> unquote(value).toLowerCase(Locale.ROOT);
    }

    /**
     * Whitespace-collapsing lower-case form used for retrieval terms.
     *
     * @return canonicalizer
     */
    public static UnaryOperator<String> term() {
        return value -> value == null ? "" : value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Identity canonicalizer, for values that are already canonical.
     *
     * @return canonicalizer
     */
    public static UnaryOperator<String> asIs() {
        return value -> value;
    }
}
