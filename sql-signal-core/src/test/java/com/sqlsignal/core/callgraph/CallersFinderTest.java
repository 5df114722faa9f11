package com.sqlsignal.core.callgraph;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.model.SourceUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;

class CallersFinderTest {

    private static final SourceUnit PROC_A = SourceUnit.of("dbo.A", "procedure",
        "CREATE PROCEDURE dbo.A AS BEGIN EXEC dbo.B; EXEC dbo.B; SELECT dbo.fn_x(1) END");
    private static final SourceUnit PROC_B = SourceUnit.of("dbo.B", "procedure",
        "CREATE PROCEDURE dbo.B AS EXEC dbo.B");
    private static final SourceUnit PROC_D = SourceUnit.of("dbo.D", "procedure",
        "CREATE PROCEDURE dbo.D AS EXECUTE B");

    private final CallersFinder finder = new CallersFinder(AnalyzerConfig.defaults());

    @Test
    void find_procedureTarget_rankedByCallCount() {
        // When
        CallersResult result = finder.find("dbo.B", null, List.of(PROC_D, PROC_A, PROC_B), CallersOptions.defaults());

        // Then
        assertThat(result.target()).isEqualTo(new CallersResult.Target("dbo.B", "procedure", "dbo.b"));
        assertThat(result.callers())
            .extracting(Caller::name, Caller::callCount, Caller::callKinds, Caller::signals)
            .containsExactly(
                tuple("dbo.A", 2, List.of("exec"), List.of("EXEC")),
                tuple("dbo.D", 1, List.of("execute"), List.of("EXECUTE")));
        assertThat(result.summary()).isEqualTo(new CallersResult.Summary(true, 2, 3));
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void find_unparseableCaller_reportsDegradedParse() {
        SourceUnit broken = SourceUnit.of("dbo.Broken", "procedure", "CREATE PROCEDURE dbo.Broken AS BEGIN EXEC dbo.C");

        CallersResult result = finder.find("dbo.C", null, List.of(broken), CallersOptions.defaults());

        assertThat(result.callers()).extracting(Caller::name).containsExactly("dbo.Broken");
        assertThat(result.errors()).containsExactly("parse_degraded: object=dbo.Broken");
    }

    @Test
    void find_sameNamedUnits_keptAsSeparateCallers() {
        // Given two batch members sharing a name and a call count
        SourceUnit first = SourceUnit.of("dbo.Dup", "procedure", "CREATE PROCEDURE dbo.Dup AS EXEC dbo.B");
        SourceUnit second = SourceUnit.of("dbo.Dup", "procedure", "CREATE PROCEDURE dbo.Dup AS EXECUTE dbo.B");

        // When
        CallersResult result = finder.find("dbo.B", null, List.of(first, second), CallersOptions.defaults());

        // Then
        assertThat(result.callers())
            .extracting(Caller::name, Caller::callKinds)
            .containsExactly(
                tuple("dbo.Dup", List.of("exec")),
                tuple("dbo.Dup", List.of("execute")));
        assertThat(result.summary()).isEqualTo(new CallersResult.Summary(true, 2, 2));
    }

    @Test
    void find_includeSelf_countsRecursiveCall() {
        CallersOptions options = new CallersOptions(true, false, true);

        CallersResult result = finder.find("dbo.B", null, List.of(PROC_B), options);

        assertThat(result.callers()).extracting(Caller::name).containsExactly("dbo.B");
    }

    @Test
    void find_functionTarget_matchesFunctionCallsOnly() {
        CallersResult result = finder.find("dbo.fn_x()", null, List.of(PROC_A, PROC_D), CallersOptions.defaults());

        assertThat(result.target().type()).isEqualTo("function");
        assertThat(result.target().normalized()).isEqualTo("dbo.fn_x");
        assertThat(result.callers())
            .extracting(Caller::name, Caller::callKinds, Caller::signals)
            .containsExactly(tuple("dbo.A", List.of("function_call"), List.of("FUNCTION")));
    }

    @ParameterizedTest
    @CsvSource({
        "dbo.fn_x(),,function",
        "dbo.usp_x,,procedure",
        "dbo.fn_x,FUNCTION,function",
        "dbo.usp_x(),procedure,procedure"
    })
    void inferTargetType_givenTargetAndType_returnsExpected(String target, String type, String expected) {
        assertThat(CallersFinder.inferTargetType(target, type)).isEqualTo(expected);
    }

    @Test
    void find_equalCallCounts_tieBrokenByLowerName() {
        List<SourceUnit> units = List.of(
            SourceUnit.of("dbo.Zed", "procedure", "CREATE PROCEDURE dbo.Zed AS EXEC dbo.B"),
            SourceUnit.of("dbo.alpha", "procedure", "CREATE PROCEDURE dbo.alpha AS EXEC dbo.B"));

        CallersResult result = finder.find("dbo.B", "procedure", units, CallersOptions.defaults());

        assertThat(result.callers()).extracting(Caller::name).containsExactly("dbo.alpha", "dbo.Zed");
    }

    @Test
    void find_schemaSensitive_requiresMatchingSchema() {
        CallersOptions options = new CallersOptions(true, true, false);
        List<SourceUnit> units = List.of(
            SourceUnit.of("dbo.X", "procedure", "CREATE PROCEDURE dbo.X AS EXEC sales.B"),
            SourceUnit.of("dbo.Y", "procedure", "CREATE PROCEDURE dbo.Y AS EXEC dbo.B"));

        CallersResult result = finder.find("dbo.B", null, units, options);

        assertThat(result.callers()).extracting(Caller::name).containsExactly("dbo.Y");
    }

    @Test
    void find_noCallers_emptySummary() {
        CallersResult result = finder.find("dbo.Nobody", null, List.of(PROC_A), CallersOptions.defaults());

        assertThat(result.callers()).isEmpty();
        assertThat(result.summary()).isEqualTo(new CallersResult.Summary(false, 0, 0));
    }

    @Test
    void find_overObjectLimit_reportsErrorAndProcessesFirst() {
        CallersFinder limited = new CallersFinder(
            new AnalyzerConfig(null, null, new AnalyzerConfig.BatchLimits(1, null), null));

        CallersResult result = limited.find("dbo.B", null, List.of(PROC_A, PROC_D), CallersOptions.defaults());

        assertThat(result.errors()).containsExactly("object_limit_exceeded: max=1 provided=2 processed=1");
        assertThat(result.callers()).extracting(Caller::name).containsExactly("dbo.A");
    }

    @Test
    void find_overSqlLengthLimit_reportsError() {
        // Given
        CallersFinder limited = new CallersFinder(
            new AnalyzerConfig(null, null, new AnalyzerConfig.BatchLimits(null, 50), null));
        int provided = PROC_A.length() + PROC_D.length();

        // When
        CallersResult result = limited.find("dbo.B", null, List.of(PROC_A, PROC_D), CallersOptions.defaults());

        // Then
        assertThat(result.errors()).containsExactly("sql_limit_exceeded: max_total_len=50 provided=" + provided);
        assertThat(result.callers()).isEmpty();
    }

    @Test
    void findStrict_overSqlLengthLimit_throws() {
        CallersFinder limited = new CallersFinder(
            new AnalyzerConfig(null, null, new AnalyzerConfig.BatchLimits(null, 50), null));

        assertThatThrownBy(() -> limited.findStrict("dbo.B", null, List.of(PROC_A), CallersOptions.defaults()))
            .isInstanceOf(BatchLimitExceededException.class)
            .hasMessageStartingWith("sql_limit_exceeded: max=50");
    }
}
