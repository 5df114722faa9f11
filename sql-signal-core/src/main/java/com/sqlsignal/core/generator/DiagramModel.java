package com.sqlsignal.core.generator;

import com.sqlsignal.core.callgraph.CallGraph;
import com.sqlsignal.core.flow.ControlFlowGraph;

import java.util.Objects;

/**
 * Input of a {@link DiagramGenerator}: a named control-flow graph, call graph, or both.
 *
 * @param name diagram subject, used as the diagram name
 * @param controlFlow control-flow graph, or null
 * @param callGraph call graph, or null
 */
public record DiagramModel(
    String name,
    ControlFlowGraph controlFlow,
    CallGraph callGraph
) {
    public DiagramModel {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static DiagramModel ofControlFlow(String name, ControlFlowGraph controlFlow) {
        return new DiagramModel(name, Objects.requireNonNull(controlFlow, "controlFlow must not be null"), null);
    }

    public static DiagramModel ofCallGraph(String name, CallGraph callGraph) {
        return new DiagramModel(name, null, Objects.requireNonNull(callGraph, "callGraph must not be null"));
    }
}
