package com.sqlsignal.core.model;

import java.util.Objects;

/**
 * One T-SQL object submitted for analysis.
 *
 * <p>Request-scoped and transient. The raw text is consumed by the parsing boundary and must never
 * be logged, persisted or echoed; {@link #toString()} therefore omits it.
 *
 * @param name object name as submitted (e.g. {@code dbo.usp_GetUser})
 * @param type object type ({@code procedure}, {@code function}, {@code trigger}, {@code view}, ...)
 * @param rawText raw SQL text
 * @param dialect SQL dialect, {@code tsql} by default
 */
public record SourceUnit(
    String name,
    String type,
    String rawText,
    String dialect
) {
    public static final String DEFAULT_DIALECT = "tsql";

    /**
     * Compact constructor with validation and defaults.
     */
    public SourceUnit {
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (name == null || name.isBlank()) {
            name = "anonymous";
        }
        if (type == null || type.isBlank()) {
            type = "procedure";
        }
        if (dialect == null || dialect.isBlank()) {
            dialect = DEFAULT_DIALECT;
        }
    }

    public static SourceUnit of(String name, String type, String rawText) {
        return new SourceUnit(name, type, rawText, DEFAULT_DIALECT);
    }

    public static SourceUnit anonymous(String rawText) {
        return new SourceUnit(null, null, rawText, DEFAULT_DIALECT);
    }

    public int length() {
        return rawText.length();
    }

    @Override
    public String toString() {
        return "SourceUnit[name=" + name + ", type=" + type + ", length=" + rawText.length() + ", dialect=" + dialect + "]";
    }
}
