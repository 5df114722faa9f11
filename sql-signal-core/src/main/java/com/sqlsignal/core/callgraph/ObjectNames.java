package com.sqlsignal.core.callgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Object name normalization shared by the call graph and the callers lookup.
 *
 * <p>{@code [dbo].[usp_Load]} normalizes to {@code dbo.usp_load} when case-insensitive.
 */
final class ObjectNames {

    private ObjectNames() {
        // Utility class
    }

    static String normalize(String name, boolean caseInsensitive) {
        return String.join(".", parts(name, caseInsensitive));
    }

    /**
     * Schema part of a name, the part before the last one; null when the name is unqualified.
     */
    static String schema(String name, boolean caseInsensitive) {
        List<String> parts = parts(name, caseInsensitive);
        return parts.size() >= 2 ? parts.get(parts.size() - 2) : null;
    }

    static String baseName(String name, boolean caseInsensitive) {
        List<String> parts = parts(name, caseInsensitive);
        return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
    }

    /**
     * Drops a trailing argument list, so that {@code dbo.fn_tax()} names {@code dbo.fn_tax}.
     */
    static String withoutArguments(String name) {
        int paren = name.indexOf('(');
        return paren >= 0 ? name.substring(0, paren) : name;
    }

    private static List<String> parts(String name, boolean caseInsensitive) {
        List<String> parts = new ArrayList<>();
        if (name == null) {
            return parts;
        }
        for (String raw : name.split("\\.")) {
            if (raw.isBlank()) {
                continue;
            }
            String part = clean(raw);
            parts.add(caseInsensitive ? part.toLowerCase(Locale.ROOT) : part);
        }
        return parts;
    }

    private static String clean(String part) {
        String trimmed = part.strip();
        if (trimmed.length() > 1
            && ((trimmed.startsWith("[") && trimmed.endsWith("]")) || (trimmed.startsWith("\"") && trimmed.endsWith("\"")))) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }
}
