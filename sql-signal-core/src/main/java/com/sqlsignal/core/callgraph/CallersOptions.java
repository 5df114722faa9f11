package com.sqlsignal.core.callgraph;

/**
 * @param caseInsensitive compare names case-insensitively
 * @param schemaSensitive require the schema to match when the target is qualified
 * @param includeSelf report the target itself when it calls itself
 */
public record CallersOptions(
    boolean caseInsensitive,
    boolean schemaSensitive,
    boolean includeSelf
) {
    public static CallersOptions defaults() {
        return new CallersOptions(true, false, false);
    }
}
