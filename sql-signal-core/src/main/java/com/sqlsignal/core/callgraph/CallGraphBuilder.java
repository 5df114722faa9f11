package com.sqlsignal.core.callgraph;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.determinism.Capped;
import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.ir.ParseOutcome;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.parser.SourceParser;
import com.sqlsignal.core.redact.SqlRedactor;
import com.sqlsignal.core.signal.CallSite;
import com.sqlsignal.core.signal.SignalExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds a bounded call graph over a batch of objects.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Keep the first {@code maxObjects} objects in input order</li>
 *   <li>Register one node per distinct normalized name (first occurrence wins)</li>
 *   <li>Parse each object and resolve its call sites against the batch</li>
 *   <li>Keep the first {@code maxNodes} nodes in input order, then sort by id</li>
 *   <li>Aggregate edges, sort by (from, to, kind), cap at {@code maxEdges}</li>
 *   <li>Compute topology and cycles over what was kept</li>
 * </ol>
 */
public class CallGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(CallGraphBuilder.class);

    private final AnalyzerConfig config;
    private final SourceParser parser;
    private final SignalExtractor extractor;

    public CallGraphBuilder(AnalyzerConfig config) {
        this(config, new SourceParser(), new SignalExtractor(config));
    }

    public CallGraphBuilder(AnalyzerConfig config, SourceParser parser, SignalExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Builds the graph, reporting any cap overflow as data.
     *
     * @param units batch in input order
     * @param options construction options
     * @return call graph
     */
    public CallGraph build(List<SourceUnit> units, CallGraphOptions options) {
        Objects.requireNonNull(units, "units must not be null");
        Objects.requireNonNull(options, "options must not be null");

        int maxObjects = config.batch().maxObjects();
        int maxNodes = options.maxNodes() != null ? options.maxNodes() : config.callGraph().maxNodes();
        int maxEdges = options.maxEdges() != null ? options.maxEdges() : config.callGraph().maxEdges();
        log.info("Building call graph: {} objects (includeFunctions={}, includeProcedures={})",
            units.size(), options.includeFunctions(), options.includeProcedures());

        List<CallGraphError> errors = new ArrayList<>();
        boolean truncated = false;

        List<SourceUnit> processed = units.size() > maxObjects ? units.subList(0, maxObjects) : units;
        if (processed.size() < units.size()) {
            truncated = true;
            errors.add(new CallGraphError(CallGraphError.OBJECT_LIMIT_EXCEEDED,
                "Object limit exceeded. max_objects=" + maxObjects + ", provided=" + units.size()
                    + ", processed=" + processed.size() + ".", null));
            log.warn("Call graph batch exceeds {} objects ({} provided); processing the first {}",
                maxObjects, units.size(), processed.size());
        }

        Resolver resolver = new Resolver(options, errors);
        List<SourceUnit> included = new ArrayList<>();
        for (SourceUnit unit : processed) {
            if (isIncluded(unit, options) && resolver.register(unit)) {
                included.add(unit);
            }
        }

        Map<EdgeKey, EdgeStats> stats = new LinkedHashMap<>();
        for (SourceUnit unit : included) {
            String callerId = ObjectNames.normalize(unit.name(), options.caseInsensitive());
            log.debug("Resolving calls of {} ({})", unit.name(), SqlRedactor.digest(unit.rawText()));

            ParseOutcome outcome = parser.parse(unit);
            if (outcome.isDegraded()) {
                errors.add(new CallGraphError(CallGraphError.PARSE_DEGRADED,
                    "Grammar parse failed; fallback scanner used.", unit.name()));
            }
            for (CallSite call : extractor.extract(outcome.ir()).callSites()) {
                resolver.resolve(unit.name(), call).ifPresent(calleeId ->
                    stats.computeIfAbsent(new EdgeKey(callerId, calleeId, call.kind()), key -> new EdgeStats())
                        .record(call.signal()));
            }
        }

        List<CallGraphNode> registered = resolver.nodes();
        List<CallGraphNode> kept = registered.size() > maxNodes ? registered.subList(0, maxNodes) : registered;
        if (kept.size() < registered.size()) {
            truncated = true;
            errors.add(new CallGraphError(CallGraphError.NODE_LIMIT_EXCEEDED,
                "Node limit exceeded. max_nodes=" + maxNodes + ".", null));
        }
        List<CallGraphNode> nodes = DeterministicList.of(kept, CallGraphNode::id, DeterministicList.UNLIMITED).items();
        Set<String> nodeIds = new HashSet<>();
        nodes.forEach(node -> nodeIds.add(node.id()));

        List<CallGraphEdge> candidates = new ArrayList<>();
        stats.forEach((key, value) -> {
            if (nodeIds.contains(key.from()) && nodeIds.contains(key.to())) {
                candidates.add(new CallGraphEdge(key.from(), key.to(), key.kind(), value.count,
                    DeterministicList.strings(value.signals, config.lists().callSignals()).items()));
            }
        });
        Capped<CallGraphEdge> edges = DeterministicList.of(candidates,
            edge -> edge.from() + '\u0000' + edge.to() + '\u0000' + edge.kind(), maxEdges);
        if (edges.truncated()) {
            truncated = true;
            errors.add(new CallGraphError(CallGraphError.EDGE_LIMIT_EXCEEDED,
                "Edge limit exceeded. max_edges=" + maxEdges + ".", null));
        }

        GraphArena arena = new GraphArena();
        nodes.forEach(node -> arena.add(node.id()));
        edges.items().forEach(edge -> arena.connect(edge.from(), edge.to()));
        boolean hasCycles = arena.hasCycle();

        CallGraphSummary summary = new CallGraphSummary(units.size(), nodes.size(), edges.size(), hasCycles, truncated);
        log.info("Call graph built: {} nodes, {} edges, cycles={}, truncated={}",
            summary.nodeCount(), summary.edgeCount(), hasCycles, truncated);
        return new CallGraph(summary, nodes, edges.items(), topology(arena), errors);
    }

    /**
     * Builds the graph, rejecting an oversized batch instead of truncating it.
     *
     * @param units batch in input order
     * @param options construction options
     * @return call graph
     * @throws BatchLimitExceededException if the batch has more objects than allowed
     */
    public CallGraph buildStrict(List<SourceUnit> units, CallGraphOptions options) {
        requireWithinObjectLimit(units, config.batch().maxObjects());
        return build(units, options);
    }

    static void requireWithinObjectLimit(List<SourceUnit> units, int maxObjects) {
        if (units.size() > maxObjects) {
            throw new BatchLimitExceededException("object_limit_exceeded", maxObjects, units.size());
        }
    }

    private static boolean isIncluded(SourceUnit unit, CallGraphOptions options) {
        return switch (unit.type().toLowerCase(Locale.ROOT)) {
            case "procedure" -> options.includeProcedures();
            case "function" -> options.includeFunctions();
            default -> options.includeProcedures() || options.includeFunctions();
        };
    }

    private static Topology topology(GraphArena arena) {
        Map<String, Integer> inDegree = new TreeMap<>();
        Map<String, Integer> outDegree = new TreeMap<>();
        List<String> roots = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        for (int slot = 0; slot < arena.size(); slot++) {
            String id = arena.id(slot);
            inDegree.put(id, arena.inDegree(slot));
            outDegree.put(id, arena.outDegree(slot));
            if (arena.inDegree(slot) == 0) {
                roots.add(id);
            }
            if (arena.outDegree(slot) == 0) {
                leaves.add(id);
            }
        }
        return new Topology(
            DeterministicList.strings(roots, DeterministicList.UNLIMITED).items(),
            DeterministicList.strings(leaves, DeterministicList.UNLIMITED).items(),
            inDegree,
            outDegree
        );
    }

    private record EdgeKey(String from, String to, String kind) {
    }

    private static final class EdgeStats {
        private int count;
        private final List<String> signals = new ArrayList<>();

        void record(String signal) {
            count++;
            signals.add(signal);
        }
    }

    /**
     * Name resolution against the registered nodes of one batch.
     */
    private static final class Resolver {
        private final CallGraphOptions options;
        private final List<CallGraphError> errors;
        private final Map<String, CallGraphNode> nodesById = new LinkedHashMap<>();
        private final Map<String, List<String>> idsByBaseName = new HashMap<>();
        private final Set<String> reportedAmbiguities = new HashSet<>();

        Resolver(CallGraphOptions options, List<CallGraphError> errors) {
            this.options = options;
            this.errors = errors;
        }

        boolean register(SourceUnit unit) {
            String id = ObjectNames.normalize(unit.name(), options.caseInsensitive());
            if (id.isEmpty() || nodesById.containsKey(id)) {
                return false;
            }
            nodesById.put(id, new CallGraphNode(id, unit.name(), unit.type()));
            idsByBaseName.computeIfAbsent(ObjectNames.baseName(id, false), key -> new ArrayList<>()).add(id);
            return true;
        }

        List<CallGraphNode> nodes() {
            return new ArrayList<>(nodesById.values());
        }

        Optional<String> resolve(String callerName, CallSite call) {
            boolean functionCall = call.isFunctionCall();
            if (!functionCall && options.ignoreDynamicExec()
                && ObjectNames.normalize(call.name(), true).endsWith("sp_executesql")) {
                return Optional.empty();
            }
            String objectType = functionCall ? "function" : "procedure";
            String normalized = ObjectNames.normalize(call.name(), options.caseInsensitive());
            String schema = ObjectNames.schema(normalized, false);
            String baseName = ObjectNames.baseName(normalized, false);

            if (options.schemaSensitive()) {
                return schema != null && isType(normalized, objectType)
                    ? Optional.of(normalized)
                    : Optional.empty();
            }
            if (schema != null && isType(normalized, objectType)) {
                return Optional.of(normalized);
            }

            List<String> candidates = idsByBaseName.getOrDefault(baseName, List.of()).stream()
                .filter(id -> isType(id, objectType))
                .toList();
            if (candidates.size() == 1) {
                return Optional.of(candidates.get(0));
            }
            if (candidates.size() > 1 && reportedAmbiguities.add(callerName + '\u0000' + baseName)) {
                errors.add(new CallGraphError(CallGraphError.AMBIGUOUS_TARGET,
                    "Call to " + baseName + " is ambiguous across schemas.", callerName));
            }
            return Optional.empty();
        }

        private boolean isType(String id, String objectType) {
            CallGraphNode node = nodesById.get(id);
            return node != null && node.type().toLowerCase(Locale.ROOT).equals(objectType);
        }
    }
}
