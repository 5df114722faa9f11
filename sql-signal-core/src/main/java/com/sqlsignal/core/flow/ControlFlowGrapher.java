package com.sqlsignal.core.flow;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.determinism.Capped;
import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.ir.StatementKind;
import com.sqlsignal.core.model.TruncationNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds a control-flow graph and complexity metrics from an IR.
 *
 * <p>One node per control statement (IF, WHILE, BEGIN TRY, BEGIN CATCH, RETURN, GOTO) plus {@code start}
 * and {@code end}. Edges follow source order between control statements; ELSE and CATCH arms are skipped
 * when falling out of the arm before them, and leaving a loop body returns to the loop.
 *
 * <p>The graph is capped; {@link FlowSummary} is not. Truncation keeps {@code start}, the earliest control
 * nodes and {@code end}, then the earliest edges between kept nodes.
 */
public class ControlFlowGrapher {

    private static final Logger log = LoggerFactory.getLogger(ControlFlowGrapher.class);

    public static final String TRUNCATED = "control_flow_graph_truncated";

    private static final List<String> EDGE_LABELS = List.of(
        "next", "true", "false", "body", "exit", "repeat", "error", "return", "goto"
    );

    private final AnalyzerConfig.GraphLimits limits;

    public ControlFlowGrapher(AnalyzerConfig config) {
        this.limits = Objects.requireNonNull(config, "config must not be null").controlFlow();
    }

    /**
     * Builds the graph and metrics for one unit.
     *
     * @param ir intermediate representation
     * @return control flow with summary computed from the full IR
     */
    public ControlFlow graph(SourceIr ir) {
        Objects.requireNonNull(ir, "ir must not be null");
        FlowSummary summary = summarize(ir);

        Walk walk = new Walk(ir.nodes());
        List<IrNode> controls = ir.nodes().stream().filter(node -> node.kind().isControl()).toList();
        List<Ordered> edges = walk.edges(controls);

        int maxNodes = limits.maxNodes();
        int keptControls = Math.max(0, Math.min(controls.size(), maxNodes - 2));
        List<FlowNode> nodes = new ArrayList<>(keptControls + 2);
        Set<String> keptIds = new HashSet<>();
        nodes.add(new FlowNode(FlowNode.START, FlowNode.START, "START"));
        for (IrNode control : controls.subList(0, keptControls)) {
            FlowNode node = toFlowNode(control);
            nodes.add(node);
            keptIds.add(node.id());
        }
        nodes.add(new FlowNode(FlowNode.END, FlowNode.END, "END"));
        keptIds.add(FlowNode.START);
        keptIds.add(FlowNode.END);

        List<Ordered> reachable = edges.stream()
            .filter(edge -> keptIds.contains(edge.edge().from()) && keptIds.contains(edge.edge().to()))
            .toList();
        Capped<Ordered> keptEdges = DeterministicList.of(reachable, Ordered::key, limits.maxEdges());

        List<String> errors = new ArrayList<>();
        List<TruncationNotice> truncations = new ArrayList<>();
        int totalNodes = controls.size() + 2;
        int totalEdges = DeterministicList.of(edges, Ordered::key, DeterministicList.UNLIMITED).size();
        if (totalNodes > nodes.size()) {
            truncations.add(new TruncationNotice(TRUNCATED, "control_flow.graph.nodes", maxNodes, totalNodes));
        }
        if (totalEdges > keptEdges.size()) {
            truncations.add(new TruncationNotice(TRUNCATED, "control_flow.graph.edges", limits.maxEdges(), totalEdges));
        }
        if (!truncations.isEmpty()) {
            errors.add(TRUNCATED);
            log.debug("Control-flow graph truncated: {} of {} nodes, {} of {} edges kept",
                nodes.size(), totalNodes, keptEdges.size(), totalEdges);
        }

        ControlFlowGraph graph = new ControlFlowGraph(
            nodes,
            keptEdges.items().stream().map(Ordered::edge).toList()
        );
        return new ControlFlow(summary, graph, signals(summary), errors, truncations);
    }

    /**
     * Counts control constructs over the whole IR.
     *
     * <p>Cyclomatic complexity is the decision-point count {@code 1 + branches + loops}; TRY/CATCH and GOTO
     * do not add to it.
     *
     * @param ir intermediate representation
     * @return metrics
     */
    public static FlowSummary summarize(SourceIr ir) {
        int branches = (int) ir.count(StatementKind.BRANCH);
        int loops = (int) ir.count(StatementKind.LOOP);
        int returns = (int) ir.count(StatementKind.RETURN);
        int gotos = (int) ir.count(StatementKind.GOTO);
        boolean tryCatch = ir.count(StatementKind.TRY) > 0 || ir.count(StatementKind.CATCH) > 0;
        return new FlowSummary(
            branches > 0,
            loops > 0,
            tryCatch,
            gotos > 0,
            returns > 0,
            branches,
            loops,
            returns,
            gotos,
            ir.maxDepth(),
            1 + branches + loops
        );
    }

    private static List<String> signals(FlowSummary summary) {
        List<String> signals = new ArrayList<>();
        if (summary.hasBranching()) {
            signals.add("IF");
        }
        if (summary.hasLoops()) {
            signals.add("WHILE");
        }
        if (summary.hasTryCatch()) {
            signals.add("TRY/CATCH");
        }
        if (summary.hasReturn()) {
            signals.add("RETURN");
        }
        if (summary.hasGoto()) {
            signals.add("GOTO");
        }
        return DeterministicList.strings(signals, DeterministicList.UNLIMITED).items();
    }

    private static String nodeId(IrNode node) {
        return node == null ? FlowNode.END : "n" + node.position();
    }

    private static FlowNode toFlowNode(IrNode node) {
        return switch (node.kind()) {
            case BRANCH -> new FlowNode(nodeId(node), "if", "IF");
            case LOOP -> new FlowNode(nodeId(node), "while", "WHILE");
            case TRY -> new FlowNode(nodeId(node), "try", "BEGIN TRY");
            case CATCH -> new FlowNode(nodeId(node), "catch", "BEGIN CATCH");
            case RETURN -> new FlowNode(nodeId(node), "return", "RETURN");
            case GOTO -> new FlowNode(nodeId(node), "goto", node.hasTarget() ? "GOTO " + node.target() : "GOTO");
            default -> throw new IllegalArgumentException("Not a control statement: " + node.kind());
        };
    }

    /**
     * Edge with its source-order sort key.
     */
    private record Ordered(long key, FlowEdge edge) {
    }

    /**
     * Where control goes next: a node ({@code null} for {@code end}), and whether it loops back.
     */
    private record Jump(IrNode target, boolean repeat) {
    }

    /**
     * Edge derivation over one IR. Scans IR positions, not just control nodes, so that ELSE and CATCH
     * markers and block boundaries are visible.
     */
    private static final class Walk {
        private final List<IrNode> nodes;
        private final int[] loopBodyEnd;

        Walk(List<IrNode> nodes) {
            this.nodes = nodes;
            this.loopBodyEnd = new int[nodes.size()];
            for (int i = 0; i < nodes.size(); i++) {
                loopBodyEnd[i] = nodes.get(i).kind() == StatementKind.LOOP ? skipBody(i) - 1 : -1;
            }
        }

        List<Ordered> edges(List<IrNode> controls) {
            List<Ordered> edges = new ArrayList<>();
            add(edges, null, FlowNode.START, continuation(-1, 0, false), "next");

            for (IrNode node : controls) {
                int p = node.position();
                int d = node.depth();
                switch (node.kind()) {
                    case BRANCH -> {
                        add(edges, node, bodyOrAfter(p, d), "true");
                        int alternative = skipBody(p);
                        if (alternative < nodes.size() && nodes.get(alternative).kind() == StatementKind.ELSE
                            && nodes.get(alternative).depth() == d) {
                            add(edges, node, bodyOrAfter(alternative, d), "false");
                        } else {
                            add(edges, node, continuation(p, d, true), "false");
                        }
                    }
                    case LOOP -> {
                        IrNode first = firstControlInBody(p, d);
                        if (first != null) {
                            add(edges, node, new Jump(first, false), "body");
                        } else {
                            add(edges, node, new Jump(node, true), "body");
                        }
                        add(edges, node, continuation(p, d, true), "exit");
                    }
                    case TRY -> {
                        add(edges, node, bodyOrAfter(p, d), "next");
                        int handler = skipBody(p);
                        if (handler < nodes.size() && nodes.get(handler).kind() == StatementKind.CATCH
                            && nodes.get(handler).depth() == d) {
                            add(edges, node, new Jump(nodes.get(handler), false), "error");
                        }
                    }
                    case CATCH -> add(edges, node, bodyOrAfter(p, d), "next");
                    case RETURN -> add(edges, node, new Jump(null, false), "return");
                    case GOTO -> add(edges, node, gotoTarget(node), "goto");
                    default -> {
                        // Not a control statement
                    }
                }
                if (isLeaf(node) && node.kind() != StatementKind.RETURN && node.kind() != StatementKind.GOTO) {
                    add(edges, node, continuation(p, d, false), "next");
                }
            }
            return edges;
        }

        private boolean isLeaf(IrNode node) {
            return node.kind() != StatementKind.BRANCH && node.kind() != StatementKind.LOOP
                && node.kind() != StatementKind.TRY && node.kind() != StatementKind.CATCH;
        }

        private void add(List<Ordered> edges, IrNode from, Jump jump, String label) {
            add(edges, from, from == null ? FlowNode.START : nodeId(from), jump, label);
        }

        private void add(List<Ordered> edges, IrNode from, String fromId, Jump jump, String label) {
            String effective = jump.repeat() && label.equals("next") ? "repeat" : label;
            long span = nodes.size() + 2L;
            long fromOrder = from == null ? 0 : from.position() + 1L;
            long toOrder = jump.target() == null ? span - 1 : jump.target().position() + 1L;
            long key = (fromOrder * span + toOrder) * EDGE_LABELS.size() + EDGE_LABELS.indexOf(effective);
            edges.add(new Ordered(key, new FlowEdge(fromId, nodeId(jump.target()), effective)));
        }

        /**
         * First control inside the body opened at {@code position}, else where control goes after it.
         */
        private Jump bodyOrAfter(int position, int depth) {
            IrNode first = firstControlInBody(position, depth);
            return first != null ? new Jump(first, false) : continuation(position, depth, true);
        }

        private IrNode firstControlInBody(int position, int depth) {
            for (int p = position + 1; p < nodes.size() && nodes.get(p).depth() > depth; p++) {
                if (nodes.get(p).kind().isControl()) {
                    return nodes.get(p);
                }
            }
            return null;
        }

        /**
         * Index of the first node after {@code position} that is not nested deeper than it.
         */
        private int skipBody(int position) {
            int depth = nodes.get(position).depth();
            int p = position + 1;
            while (p < nodes.size() && nodes.get(p).depth() > depth) {
                p++;
            }
            return p;
        }

        /**
         * Next control statement reached after leaving {@code from}.
         *
         * @param from IR position being left, -1 for the unit entry
         * @param depth depth execution is at
         * @param skipNested whether the body nested under {@code from} is skipped first
         */
        private Jump continuation(int from, int depth, boolean skipNested) {
            IrNode loop = enclosingLoop(from);
            int limit = depth;
            int p = skipNested ? skipBody(from) : from + 1;

            while (p < nodes.size()) {
                if (loop != null && p > loopBodyEnd[loop.position()]) {
                    return new Jump(loop, true);
                }
                IrNode node = nodes.get(p);
                if ((node.kind() == StatementKind.ELSE || node.kind() == StatementKind.CATCH) && node.depth() <= limit) {
                    // Falling out of the arm before it
                    limit = node.depth();
                    p = skipBody(p);
                    continue;
                }
                if (node.depth() < limit) {
                    limit = node.depth();
                }
                if (node.kind().isControl()) {
                    return new Jump(node, false);
                }
                p++;
            }
            return loop != null ? new Jump(loop, true) : new Jump(null, false);
        }

        private IrNode enclosingLoop(int position) {
            if (position < 0) {
                return null;
            }
            for (int p = position - 1; p >= 0; p--) {
                IrNode candidate = nodes.get(p);
                if (candidate.kind() == StatementKind.LOOP && loopBodyEnd[p] >= position) {
                    return candidate;
                }
            }
            return null;
        }

        private Jump gotoTarget(IrNode jump) {
            for (IrNode node : nodes) {
                if (node.kind() == StatementKind.LABEL && Objects.equals(node.target(), jump.target())) {
                    return continuation(node.position(), node.depth(), false);
                }
            }
            return new Jump(null, false);
        }
    }
}
