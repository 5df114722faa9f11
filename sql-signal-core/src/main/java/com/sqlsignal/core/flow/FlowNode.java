package com.sqlsignal.core.flow;

import java.util.Locale;
import java.util.Objects;

/**
 * Control-flow graph node.
 *
 * @param id stable id: {@code start}, {@code end} or {@code n<position>}
 * @param type {@code start}, {@code end}, {@code if}, {@code while}, {@code try}, {@code catch}, {@code return} or {@code goto}
 * @param label display label
 */
public record FlowNode(
    String id,
    String type,
    String label
) {
    public static final String START = "start";
    public static final String END = "end";

    public FlowNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (label == null) {
            label = type.toUpperCase(Locale.ROOT);
        }
    }
}
