package com.sqlsignal.core.flow;

import java.util.Objects;

/**
 * Directed control-flow edge.
 *
 * @param from source node id
 * @param to target node id
 * @param label transfer kind: {@code next}, {@code true}, {@code false}, {@code body}, {@code exit},
 *     {@code repeat}, {@code error}, {@code return} or {@code goto}
 */
public record FlowEdge(
    String from,
    String to,
    String label
) {
    public FlowEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }
}
