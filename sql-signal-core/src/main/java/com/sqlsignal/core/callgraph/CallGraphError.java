package com.sqlsignal.core.callgraph;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Structured, non-fatal call graph problem.
 *
 * @param id error code ({@code NODE_LIMIT_EXCEEDED}, {@code AMBIGUOUS_TARGET}, ...)
 * @param message human-readable message, never containing SQL text
 * @param object affected object name, or null for batch-wide errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallGraphError(
    String id,
    String message,
    String object
) {
    public static final String OBJECT_LIMIT_EXCEEDED = "OBJECT_LIMIT_EXCEEDED";
    public static final String NODE_LIMIT_EXCEEDED = "NODE_LIMIT_EXCEEDED";
    public static final String EDGE_LIMIT_EXCEEDED = "EDGE_LIMIT_EXCEEDED";
    public static final String AMBIGUOUS_TARGET = "AMBIGUOUS_TARGET";
    public static final String PARSE_DEGRADED = "PARSE_DEGRADED";

    public CallGraphError {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
