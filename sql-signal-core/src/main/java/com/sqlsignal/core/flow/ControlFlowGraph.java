package com.sqlsignal.core.flow;

import java.util.List;

/**
 * Bounded control-flow graph.
 *
 * @param nodes nodes in source order, {@code start} first and {@code end} last
 * @param edges edges ordered by source node
 */
public record ControlFlowGraph(
    List<FlowNode> nodes,
    List<FlowEdge> edges
) {
    public ControlFlowGraph {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }
}
