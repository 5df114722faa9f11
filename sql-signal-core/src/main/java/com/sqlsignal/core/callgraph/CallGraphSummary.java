package com.sqlsignal.core.callgraph;

/**
 * @param objectCount objects submitted, before any cap
 * @param nodeCount nodes in the graph
 * @param edgeCount edges in the graph
 * @param hasCycles true when the kept edges contain a cycle
 * @param truncated true when any object, node or edge cap was hit
 */
public record CallGraphSummary(
    int objectCount,
    int nodeCount,
    int edgeCount,
    boolean hasCycles,
    boolean truncated
) {
}
