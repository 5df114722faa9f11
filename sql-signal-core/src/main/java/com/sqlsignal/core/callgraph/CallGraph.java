package com.sqlsignal.core.callgraph;

import java.util.List;
import java.util.Objects;

/**
 * Cross-object call graph of one batch.
 *
 * <p>Only objects present in the batch become nodes; calls to anything else are omitted.
 *
 * @param summary counts and flags
 * @param nodes nodes sorted by id
 * @param edges edges sorted by (from, to, kind)
 * @param topology roots, leaves and degrees
 * @param errors structured problems in the order they were found
 */
public record CallGraph(
    CallGraphSummary summary,
    List<CallGraphNode> nodes,
    List<CallGraphEdge> edges,
    Topology topology,
    List<CallGraphError> errors
) {
    public CallGraph {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(topology, "topology must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasError(String id) {
        return errors.stream().anyMatch(error -> error.id().equals(id));
    }
}
