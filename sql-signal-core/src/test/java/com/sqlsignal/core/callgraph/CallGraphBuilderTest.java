package com.sqlsignal.core.callgraph;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

/**
 * Tests for {@link CallGraphBuilder}.
 */
class CallGraphBuilderTest {

    private static final SourceUnit PROC_A = SourceUnit.of("dbo.A", "procedure",
        "CREATE PROCEDURE dbo.A AS BEGIN EXEC dbo.B; EXEC dbo.B; SELECT dbo.fn_x(1) END");
    private static final SourceUnit PROC_B = SourceUnit.of("dbo.B", "procedure",
        "CREATE PROCEDURE dbo.B AS EXEC dbo.C");
    private static final SourceUnit PROC_C = SourceUnit.of("dbo.C", "procedure",
        "CREATE PROCEDURE dbo.C AS SELECT 1");
    private static final SourceUnit FN_X = SourceUnit.of("dbo.fn_x", "function",
        "CREATE FUNCTION dbo.fn_x(@a INT) RETURNS INT AS BEGIN RETURN @a END");

    private final CallGraphBuilder builder = new CallGraphBuilder(AnalyzerConfig.defaults());

    @Test
    void build_chainWithFunction_nodesEdgesAndTopology() {
        // When
        CallGraph graph = builder.build(List.of(PROC_A, PROC_B, PROC_C, FN_X), CallGraphOptions.defaults());

        // Then
        assertThat(graph.nodes()).extracting(CallGraphNode::id)
            .containsExactly("dbo.a", "dbo.b", "dbo.c", "dbo.fn_x");
        assertThat(graph.edges())
            .extracting(CallGraphEdge::from, CallGraphEdge::to, CallGraphEdge::kind, CallGraphEdge::count)
            .containsExactly(
                tuple("dbo.a", "dbo.b", "exec", 2),
                tuple("dbo.a", "dbo.fn_x", "function_call", 1),
                tuple("dbo.b", "dbo.c", "exec", 1));
        assertThat(graph.edges().get(0).signals()).containsExactly("EXEC");
        assertThat(graph.topology().roots()).containsExactly("dbo.a");
        assertThat(graph.topology().leaves()).containsExactly("dbo.c", "dbo.fn_x");
        assertThat(graph.summary().hasCycles()).isFalse();
        assertThat(graph.summary().truncated()).isFalse();
        assertThat(graph.errors()).isEmpty();
    }

    @Test
    void build_anyGraph_degreeSumsMatchEdgeCount() {
        CallGraph graph = builder.build(List.of(PROC_A, PROC_B, PROC_C, FN_X), CallGraphOptions.defaults());

        int outSum = graph.topology().outDegree().values().stream().mapToInt(Integer::intValue).sum();
        int inSum = graph.topology().inDegree().values().stream().mapToInt(Integer::intValue).sum();
        assertThat(outSum).isEqualTo(graph.summary().edgeCount()).isEqualTo(inSum);
        assertThat(graph.topology().inDegree()).containsOnlyKeys("dbo.a", "dbo.b", "dbo.c", "dbo.fn_x");
    }

    @Test
    void build_mutualRecursion_detectsCycle() {
        List<SourceUnit> units = List.of(
            SourceUnit.of("dbo.Ping", "procedure", "CREATE PROCEDURE dbo.Ping AS EXEC dbo.Pong"),
            SourceUnit.of("dbo.Pong", "procedure", "CREATE PROCEDURE dbo.Pong AS EXEC dbo.Ping"));

        CallGraph graph = builder.build(units, CallGraphOptions.defaults());

        assertThat(graph.summary().hasCycles()).isTrue();
        assertThat(graph.topology().roots()).isEmpty();
        assertThat(graph.topology().leaves()).isEmpty();
    }

    @Test
    void build_unqualifiedCallAcrossSchemas_reportsAmbiguity() {
        // Given
        List<SourceUnit> units = List.of(
            SourceUnit.of("sales.Calc", "procedure", "CREATE PROCEDURE sales.Calc AS SELECT 1"),
            SourceUnit.of("hr.Calc", "procedure", "CREATE PROCEDURE hr.Calc AS SELECT 2"),
            SourceUnit.of("dbo.Main", "procedure", "CREATE PROCEDURE dbo.Main AS BEGIN EXEC Calc; EXEC Calc END"));

        // When
        CallGraph graph = builder.build(units, CallGraphOptions.defaults());

        // Then
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.errors())
            .containsExactly(new CallGraphError(CallGraphError.AMBIGUOUS_TARGET,
                "Call to calc is ambiguous across schemas.", "dbo.Main"));
    }

    @Test
    void build_unqualifiedCallWithOneCandidate_resolves() {
        List<SourceUnit> units = List.of(
            SourceUnit.of("sales.Calc", "procedure", "CREATE PROCEDURE sales.Calc AS SELECT 1"),
            SourceUnit.of("dbo.Main", "procedure", "CREATE PROCEDURE dbo.Main AS EXEC Calc"));

        CallGraph graph = builder.build(units, CallGraphOptions.defaults());

        assertThat(graph.edges()).extracting(CallGraphEdge::from, CallGraphEdge::to)
            .containsExactly(tuple("dbo.main", "sales.calc"));
    }

    @Test
    void build_schemaSensitive_ignoresUnqualifiedCalls() {
        List<SourceUnit> units = List.of(
            SourceUnit.of("sales.Calc", "procedure", "CREATE PROCEDURE sales.Calc AS SELECT 1"),
            SourceUnit.of("dbo.Main", "procedure", "CREATE PROCEDURE dbo.Main AS EXEC Calc"));
        CallGraphOptions options = new CallGraphOptions(true, true, true, true, true, null, null);

        CallGraph graph = builder.build(units, options);

        assertThat(graph.edges()).isEmpty();
        assertThat(graph.errors()).isEmpty();
    }

    @Test
    void build_caseSensitive_keepsNamesAsWritten() {
        CallGraphOptions options = new CallGraphOptions(false, false, true, true, true, null, null);
        List<SourceUnit> units = List.of(PROC_B, PROC_C,
            SourceUnit.of("dbo.D", "procedure", "CREATE PROCEDURE dbo.D AS EXEC dbo.c"));

        CallGraph graph = builder.build(units, options);

        assertThat(graph.nodes()).extracting(CallGraphNode::id).containsExactly("dbo.B", "dbo.C", "dbo.D");
        assertThat(graph.edges()).extracting(CallGraphEdge::from, CallGraphEdge::to)
            .containsExactly(tuple("dbo.B", "dbo.C"));
    }

    @Test
    void build_proceduresOnly_dropsFunctions() {
        CallGraphOptions options = new CallGraphOptions(true, false, false, true, true, null, null);

        CallGraph graph = builder.build(List.of(PROC_A, PROC_B, PROC_C, FN_X), options);

        assertThat(graph.nodes()).extracting(CallGraphNode::id).doesNotContain("dbo.fn_x");
        assertThat(graph.edges()).extracting(CallGraphEdge::kind).containsOnly("exec");
    }

    @Test
    void build_overObjectLimit_processesFirstObjects() {
        // Given
        List<SourceUnit> units = new ArrayList<>();
        for (int i = 0; i < 501; i++) {
            units.add(SourceUnit.of("dbo.p" + i, "procedure", "CREATE PROCEDURE dbo.p" + i + " AS SELECT 1"));
        }

        // When
        CallGraph graph = builder.build(units, CallGraphOptions.defaults());

        // Then
        assertThat(graph.summary().truncated()).isTrue();
        assertThat(graph.summary().objectCount()).isEqualTo(501);
        assertThat(graph.summary().nodeCount()).isEqualTo(500);
        assertThat(graph.hasError(CallGraphError.OBJECT_LIMIT_EXCEEDED)).isTrue();
        assertThat(graph.errors().get(0).message())
            .isEqualTo("Object limit exceeded. max_objects=500, provided=501, processed=500.");
        assertThat(graph.nodes()).extracting(CallGraphNode::id).doesNotContain("dbo.p500");
    }

    @Test
    void buildStrict_overObjectLimit_throws() {
        AnalyzerConfig config = new AnalyzerConfig(null, null, new AnalyzerConfig.BatchLimits(2, null), null);
        CallGraphBuilder strict = new CallGraphBuilder(config);

        assertThatThrownBy(() -> strict.buildStrict(List.of(PROC_A, PROC_B, PROC_C), CallGraphOptions.defaults()))
            .isInstanceOf(BatchLimitExceededException.class)
            .hasMessage("object_limit_exceeded: max=2 provided=3")
            .extracting(e -> ((BatchLimitExceededException) e).getLimit())
            .isEqualTo("object_limit_exceeded");
    }

    @Test
    void build_overNodeLimit_keepsEarliestInputNodes() {
        CallGraphOptions options = new CallGraphOptions(true, false, true, true, true, 2, null);

        CallGraph graph = builder.build(List.of(PROC_C, PROC_A, PROC_B), options);

        assertThat(graph.nodes()).extracting(CallGraphNode::id).containsExactly("dbo.a", "dbo.c");
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.hasError(CallGraphError.NODE_LIMIT_EXCEEDED)).isTrue();
        assertThat(graph.summary().truncated()).isTrue();
    }

    @Test
    void build_overEdgeLimit_keepsEarliestSortedEdges() {
        CallGraphOptions options = new CallGraphOptions(true, false, true, true, true, null, 1);

        CallGraph graph = builder.build(List.of(PROC_A, PROC_B, PROC_C, FN_X), options);

        assertThat(graph.edges()).extracting(CallGraphEdge::to).containsExactly("dbo.b");
        assertThat(graph.hasError(CallGraphError.EDGE_LIMIT_EXCEEDED)).isTrue();
    }

    @Test
    void build_unparseableObject_reportsDegradedParse() {
        SourceUnit broken = SourceUnit.of("dbo.Broken", "procedure", "CREATE PROCEDURE dbo.Broken AS BEGIN EXEC dbo.C");

        CallGraph graph = builder.build(List.of(broken, PROC_C), CallGraphOptions.defaults());

        assertThat(graph.hasError(CallGraphError.PARSE_DEGRADED)).isTrue();
        assertThat(graph.edges()).extracting(CallGraphEdge::from, CallGraphEdge::to)
            .containsExactly(tuple("dbo.broken", "dbo.c"));
    }

    @Test
    void build_shuffledInput_sameGraph() {
        CallGraph first = builder.build(List.of(PROC_A, PROC_B, PROC_C, FN_X), CallGraphOptions.defaults());
        CallGraph second = builder.build(List.of(FN_X, PROC_C, PROC_B, PROC_A), CallGraphOptions.defaults());

        assertThat(second).isEqualTo(first);
    }
}
