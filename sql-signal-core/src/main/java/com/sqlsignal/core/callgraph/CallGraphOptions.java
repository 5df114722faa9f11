package com.sqlsignal.core.callgraph;

/**
 * Call graph construction options.
 *
 * @param caseInsensitive compare object names case-insensitively
 * @param schemaSensitive only resolve schema-qualified calls to the exact object
 * @param includeFunctions add function objects and function-call edges
 * @param includeProcedures add procedure objects and EXEC edges
 * @param ignoreDynamicExec skip {@code sp_executesql} calls
 * @param maxNodes node cap, or null for the configured cap
 * @param maxEdges edge cap, or null for the configured cap
 */
public record CallGraphOptions(
    boolean caseInsensitive,
    boolean schemaSensitive,
    boolean includeFunctions,
    boolean includeProcedures,
    boolean ignoreDynamicExec,
    Integer maxNodes,
    Integer maxEdges
) {
    public CallGraphOptions {
        if (maxNodes != null && maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be positive: " + maxNodes);
        }
        if (maxEdges != null && maxEdges <= 0) {
            throw new IllegalArgumentException("maxEdges must be positive: " + maxEdges);
        }
    }

    public static CallGraphOptions defaults() {
        return new CallGraphOptions(true, false, true, true, true, null, null);
    }
}
