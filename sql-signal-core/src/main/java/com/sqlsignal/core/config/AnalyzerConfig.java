package com.sqlsignal.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Process-wide limits of the analysis engine.
 *
 * <p>Loaded from {@code sql-signal.yaml}; missing sections fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * controlFlow:
 *   maxNodes: 200
 *   maxEdges: 400
 *
 * callGraph:
 *   maxNodes: 500
 *   maxEdges: 2000
 *
 * batch:
 *   maxObjects: 500
 *   maxTotalSqlLength: 1000000
 *
 * lists:
 *   errorFunctions: 10
 *   errorSignals: 15
 * }</pre>
 *
 * @param controlFlow control-flow graph caps
 * @param callGraph call graph caps
 * @param batch batch input caps
 * @param lists per-list caps
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("controlFlow") GraphLimits controlFlow,
    @JsonProperty("callGraph") GraphLimits callGraph,
    @JsonProperty("batch") BatchLimits batch,
    @JsonProperty("lists") ListLimits lists
) {
    public AnalyzerConfig {
        controlFlow = controlFlow == null
            ? GraphLimits.controlFlowDefaults()
            : controlFlow.withDefaults(GraphLimits.controlFlowDefaults());
        callGraph = callGraph == null
            ? GraphLimits.callGraphDefaults()
            : callGraph.withDefaults(GraphLimits.callGraphDefaults());
        batch = batch == null ? BatchLimits.defaults() : batch.withDefaults(BatchLimits.defaults());
        if (lists == null) {
            lists = ListLimits.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(null, null, null, null);
    }

    /**
     * Node/edge caps of a graph. Absent values take the defaults of the graph they apply to.
     *
     * @param maxNodes maximum nodes kept
     * @param maxEdges maximum edges kept
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GraphLimits(
        @JsonProperty("maxNodes") Integer maxNodes,
        @JsonProperty("maxEdges") Integer maxEdges
    ) {
        public GraphLimits {
            requirePositive(maxNodes, "maxNodes");
            requirePositive(maxEdges, "maxEdges");
        }

        GraphLimits withDefaults(GraphLimits defaults) {
            return new GraphLimits(
                maxNodes != null ? maxNodes : defaults.maxNodes(),
                maxEdges != null ? maxEdges : defaults.maxEdges());
        }

        public static GraphLimits controlFlowDefaults() {
            return new GraphLimits(200, 400);
        }

        public static GraphLimits callGraphDefaults() {
            return new GraphLimits(500, 2000);
        }
    }

    /**
     * Caps on a batch of objects.
     *
     * @param maxObjects maximum objects processed
     * @param maxTotalSqlLength maximum aggregate characters for single-target lookups
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BatchLimits(
        @JsonProperty("maxObjects") Integer maxObjects,
        @JsonProperty("maxTotalSqlLength") Integer maxTotalSqlLength
    ) {
        public BatchLimits {
            requirePositive(maxObjects, "maxObjects");
            requirePositive(maxTotalSqlLength, "maxTotalSqlLength");
        }

        BatchLimits withDefaults(BatchLimits defaults) {
            return new BatchLimits(
                maxObjects != null ? maxObjects : defaults.maxObjects(),
                maxTotalSqlLength != null ? maxTotalSqlLength : defaults.maxTotalSqlLength());
        }

        public static BatchLimits defaults() {
            return new BatchLimits(500, 1_000_000);
        }
    }

    /**
     * Per-list caps. A zero or negative value in YAML selects the default.
     *
     * @param errorFunctions ERROR_* function names
     * @param returnValues RETURN literals
     * @param outputParams OUTPUT error parameters
     * @param errorSignals aggregate error-handling signals
     * @param callSignals signals per call edge or caller
     * @param references table and function references, each
     * @param queryTerms retrieval query terms
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ListLimits(
        @JsonProperty("errorFunctions") int errorFunctions,
        @JsonProperty("returnValues") int returnValues,
        @JsonProperty("outputParams") int outputParams,
        @JsonProperty("errorSignals") int errorSignals,
        @JsonProperty("callSignals") int callSignals,
        @JsonProperty("references") int references,
        @JsonProperty("queryTerms") int queryTerms
    ) {
        public ListLimits {
            errorFunctions = orDefault(errorFunctions, 10);
            returnValues = orDefault(returnValues, 10);
            outputParams = orDefault(outputParams, 10);
            errorSignals = orDefault(errorSignals, 15);
            callSignals = orDefault(callSignals, 10);
            references = orDefault(references, 200);
            queryTerms = orDefault(queryTerms, 30);
        }

        public static ListLimits defaults() {
            return new ListLimits(0, 0, 0, 0, 0, 0, 0);
        }

        private static int orDefault(int value, int defaultValue) {
            return value > 0 ? value : defaultValue;
        }
    }

    private static void requirePositive(Integer value, String name) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
