package com.sqlsignal.core.generator;

/**
 * Types of diagrams that can be generated.
 */
public enum DiagramType {
    /** Control-flow graph of one unit */
    CONTROL_FLOW,

    /** Call graph of a batch */
    CALL_GRAPH
}
