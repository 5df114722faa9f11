package com.sqlsignal.core.ir;

/**
 * Kind of a name or marker referenced from within one statement.
 */
public enum ReferenceKind {
    /** Table or view read or written by the statement. */
    TABLE,
    /** Scalar or table-valued function invocation. */
    FUNCTION,
    /** EXEC/EXECUTE of a named procedure. */
    CALL,
    /** {@code @@NAME} global such as {@code @@ERROR}. */
    SYSTEM_VARIABLE,
    /** Parameter declared with OUTPUT in a routine header. */
    OUTPUT_PARAMETER,
    /** Structural marker such as OUTPUT clause, cursor, temp table or dynamic SQL. */
    MARKER
}
