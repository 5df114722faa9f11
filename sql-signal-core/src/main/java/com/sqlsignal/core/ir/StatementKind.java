package com.sqlsignal.core.ir;

/**
 * Kind tag of an IR statement node.
 */
public enum StatementKind {
    /** CREATE/ALTER header of a procedure, function, trigger or view. */
    ROUTINE,
    BRANCH,
    /** ELSE arm marker of the preceding branch at the same depth. */
    ELSE,
    LOOP,
    TRY,
    CATCH,
    RETURN,
    GOTO,
    LABEL,
    BREAK,
    CONTINUE,
    CALL,
    DML,
    QUERY,
    TRANSACTION,
    SET_OPTION,
    DECLARE,
    THROW,
    RAISERROR,
    PRINT,
    CURSOR,
    DDL,
    OTHER;

    /**
     * Returns whether this kind becomes a node of the control-flow graph.
     *
     * @return true for branch, loop, try, catch, return and goto
     */
    public boolean isControl() {
        return switch (this) {
            case BRANCH, LOOP, TRY, CATCH, RETURN, GOTO -> true;
            default -> false;
        };
    }
}
