package com.sqlsignal.core.analysis;

import com.sqlsignal.core.callgraph.CallGraph;
import com.sqlsignal.core.callgraph.CallGraphOptions;
import com.sqlsignal.core.callgraph.CallersOptions;
import com.sqlsignal.core.callgraph.CallersResult;
import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.redact.SqlRedactor;
import com.sqlsignal.core.renderer.JsonReportFormatter;
import com.sqlsignal.core.signal.MigrationImpact;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link SqlAnalyzer}.
 */
class SqlAnalyzerTest {

    private static final String ORDER_PROC = """
        CREATE PROCEDURE dbo.usp_PlaceOrder @id INT, @err_msg NVARCHAR(4000) OUTPUT AS
        BEGIN
            SET XACT_ABORT ON;
            BEGIN TRY
                BEGIN TRAN;
                IF @id > 0
                BEGIN
                    UPDATE dbo.Orders SET Status = 'PLACED-SECRET' WHERE Id = @id;
                    INSERT INTO dbo.OrderLog (Id, Note) VALUES (@id, N'placed by api');
                END
                ELSE
                    RETURN -1;
                COMMIT;
            END TRY
            BEGIN CATCH
                ROLLBACK;
                SET @err_msg = ERROR_MESSAGE();
                THROW;
            END CATCH
            RETURN 0;
        END
        """;

    private final SqlAnalyzer analyzer = new SqlAnalyzer(AnalyzerConfig.defaults());

    @Test
    void analyze_trivialProcedure_noSignals() {
        // When
        AnalysisReport report = analyzer.analyze(
            SourceUnit.of("dbo.usp_demo", "procedure", "CREATE PROCEDURE dbo.usp_demo AS SELECT 1"));

        // Then
        assertThat(report.parser()).isEqualTo("grammar");
        assertThat(report.transactions().usesTransaction()).isFalse();
        assertThat(report.dataChanges().hasWrites()).isFalse();
        assertThat(report.controlFlow().summary().cyclomaticComplexity()).isEqualTo(1);
        assertThat(report.references().tables()).isEmpty();
        assertThat(report.migrationImpacts().hasImpact()).isFalse();
        assertThat(report.errors()).isEmpty();
        assertThat(report.truncations()).isEmpty();
    }

    @Test
    void analyze_transactionalProcedure_collectsAllFamilies() {
        // When
        AnalysisReport report = analyzer.analyze(SourceUnit.of("dbo.usp_PlaceOrder", "procedure", ORDER_PROC));

        // Then
        assertThat(report.name()).isEqualTo("dbo.usp_PlaceOrder");
        assertThat(report.digest()).isEqualTo(SqlRedactor.digest(ORDER_PROC));
        assertThat(report.parser()).isEqualTo("grammar");
        assertThat(report.transactions().beginCount()).isEqualTo(1);
        assertThat(report.transactions().commitCount()).isEqualTo(1);
        assertThat(report.transactions().rollbackCount()).isEqualTo(1);
        assertThat(report.transactions().hasTryCatch()).isTrue();
        assertThat(report.transactions().xactAbort()).isEqualTo("ON");
        assertThat(report.dataChanges().operation("update").tables()).containsExactly("DBO.ORDERS");
        assertThat(report.dataChanges().operation("insert").tables()).containsExactly("DBO.ORDERLOG");
        assertThat(report.errorHandling().usesThrow()).isTrue();
        assertThat(report.errorHandling().notes()).isEmpty();
        assertThat(report.errorHandling().returnValues()).containsExactly(-1, 0);
        assertThat(report.errorHandling().outputErrorParams()).containsExactly("@err_msg");
        assertThat(report.controlFlow().summary().branchCount()).isEqualTo(1);
        assertThat(report.controlFlow().summary().cyclomaticComplexity()).isEqualTo(2);
        assertThat(report.migrationImpacts().items()).extracting(MigrationImpact::id).containsExactly("IMP_XACT_ABORT");
        assertThat(report.queryTerms()).contains("begin tran", "commit", "rollback", "try/catch", "if")
            .isSorted();
    }

    @Test
    void analyze_literalsAndComments_neverSerialized() {
        // Given
        String sql = "/* owner: SENTINEL_COMMENT */ UPDATE dbo.T SET secret = 'SENTINEL_LITERAL' -- SENTINEL_LINE";

        // When
        String json = JsonReportFormatter.format(analyzer.analyze(SourceUnit.anonymous(sql)));

        // Then
        assertThat(json)
            .doesNotContain("SENTINEL_COMMENT")
            .doesNotContain("SENTINEL_LITERAL")
            .doesNotContain("SENTINEL_LINE")
            .contains("\"hash8\"");
    }

    @Test
    void analyze_sameInputTwice_byteIdenticalJson() {
        SourceUnit unit = SourceUnit.of("dbo.usp_PlaceOrder", "procedure", ORDER_PROC);

        String first = JsonReportFormatter.format(analyzer.analyze(unit));
        String second = JsonReportFormatter.format(new SqlAnalyzer(AnalyzerConfig.defaults()).analyze(unit));

        assertThat(second).isEqualTo(first);
        assertThat(first).contains("\"cyclomatic_complexity\" : 2");
    }

    @Test
    void analyze_unbalancedBlock_fallsBackWithParseError() {
        AnalysisReport report = analyzer.analyze(
            SourceUnit.anonymous("CREATE PROCEDURE dbo.p AS BEGIN IF 1 = 1 UPDATE dbo.T SET x = 1"));

        assertThat(report.parser()).isEqualTo("fallback");
        assertThat(report.errors()).first().asString().startsWith("parse_error");
        assertThat(report.dataChanges().operation("update").tables()).containsExactly("DBO.T");
        assertThat(report.controlFlow().summary().branchCount()).isEqualTo(1);
    }

    @Test
    void analyze_emptyInput_emptyReport() {
        AnalysisReport report = analyzer.analyze(SourceUnit.anonymous(""));

        assertThat(report.dataChanges().hasWrites()).isFalse();
        assertThat(report.controlFlow().summary().cyclomaticComplexity()).isEqualTo(1);
        assertThat(report.queryTerms()).isEmpty();
    }

    @Test
    void callGraphAndCallers_shareOneBatch() {
        List<SourceUnit> units = List.of(
            SourceUnit.of("dbo.A", "procedure", "CREATE PROCEDURE dbo.A AS EXEC dbo.B"),
            SourceUnit.of("dbo.B", "procedure", "CREATE PROCEDURE dbo.B AS SELECT 1"));

        CallGraph graph = analyzer.callGraph(units, CallGraphOptions.defaults());
        CallersResult callers = analyzer.callers("dbo.B", null, units, CallersOptions.defaults());

        assertThat(graph.summary().edgeCount()).isEqualTo(1);
        assertThat(callers.summary().totalCalls()).isEqualTo(1);
    }
}
