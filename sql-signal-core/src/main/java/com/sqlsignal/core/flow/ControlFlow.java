package com.sqlsignal.core.flow;

import com.sqlsignal.core.model.TruncationNotice;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link ControlFlowGrapher#graph(com.sqlsignal.core.ir.SourceIr)}.
 *
 * @param summary metrics over the full IR
 * @param graph possibly truncated graph
 * @param signals sorted control-flow signals
 * @param errors error codes, e.g. {@code control_flow_graph_truncated}
 * @param truncations node/edge cap notices
 */
public record ControlFlow(
    FlowSummary summary,
    ControlFlowGraph graph,
    List<String> signals,
    List<String> errors,
    List<TruncationNotice> truncations
) {
    public ControlFlow {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        signals = signals == null ? List.of() : List.copyOf(signals);
        errors = errors == null ? List.of() : List.copyOf(errors);
        truncations = truncations == null ? List.of() : List.copyOf(truncations);
    }

    public boolean truncated() {
        return !errors.isEmpty();
    }
}
