package com.sqlsignal.core.ir;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Ordered, kind-tagged statement sequence of one unit.
 *
 * <p>Both parser paths produce this shape. Nodes are in source order and {@code nodes.get(i).position() == i}.
 *
 * @param nodes statement nodes in source order
 * @param path producer that built this IR
 */
public record SourceIr(
    List<IrNode> nodes,
    ParserPath path
) {
    public SourceIr {
        Objects.requireNonNull(path, "path must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
    }

    public static SourceIr empty(ParserPath path) {
        return new SourceIr(List.of(), path);
    }

    public int size() {
        return nodes.size();
    }

    public long count(StatementKind kind) {
        return nodes.stream().filter(node -> node.kind() == kind).count();
    }

    public long count(Predicate<IrNode> predicate) {
        return nodes.stream().filter(predicate).count();
    }

    public int maxDepth() {
        return nodes.stream().mapToInt(IrNode::depth).max().orElse(0);
    }
}
