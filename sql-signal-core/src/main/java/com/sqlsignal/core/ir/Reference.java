package com.sqlsignal.core.ir;

import java.util.Objects;

/**
 * A name or marker found inside one statement.
 *
 * <p>Table names are canonical (brackets stripped, upper case). Call and function names keep the
 * case they were written with so that case-sensitive call resolution stays possible.
 *
 * @param kind reference kind
 * @param name referenced name or marker code
 * @param detail optional qualifier, e.g. {@code EXEC} or {@code EXECUTE} for calls
 */
public record Reference(
    ReferenceKind kind,
    String name,
    String detail
) {
    public static final String MARKER_OUTPUT = "OUTPUT";
    public static final String MARKER_INSERTED = "INSERTED";
    public static final String MARKER_DELETED = "DELETED";
    public static final String MARKER_CURSOR = "CURSOR";
    public static final String MARKER_TEMP_TABLE = "TEMP_TABLE";
    public static final String MARKER_TABLE_VARIABLE = "TABLE_VARIABLE";
    public static final String MARKER_DYNAMIC_SQL = "DYNAMIC_SQL";

    public Reference {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Reference of(ReferenceKind kind, String name) {
        return new Reference(kind, name, null);
    }

    public static Reference marker(String code) {
        return new Reference(ReferenceKind.MARKER, code, null);
    }

    public static Reference marker(String code, String detail) {
        return new Reference(ReferenceKind.MARKER, code, detail);
    }
}
