package com.sqlsignal.core.callgraph;

/**
 * @param id normalized full name
 * @param name name as submitted
 * @param type object type as submitted
 */
public record CallGraphNode(
    String id,
    String name,
    String type
) {
}
