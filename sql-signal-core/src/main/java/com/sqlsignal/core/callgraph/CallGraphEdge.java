package com.sqlsignal.core.callgraph;

import java.util.List;

/**
 * Aggregated calls from one object to another.
 *
 * @param from caller node id
 * @param to callee node id
 * @param kind {@code exec}, {@code execute} or {@code function_call}
 * @param count number of call sites
 * @param signals sorted call signals (capped)
 */
public record CallGraphEdge(
    String from,
    String to,
    String kind,
    int count,
    List<String> signals
) {
    public CallGraphEdge {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
