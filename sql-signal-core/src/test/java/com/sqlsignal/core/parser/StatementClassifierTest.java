package com.sqlsignal.core.parser;

import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.StatementKind;
import com.sqlsignal.core.redact.SqlRedactor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

/**
 * Tests for {@link StatementClassifier} and the reference scan it delegates to.
 */
class StatementClassifierTest {

    private static IrNode classify(String sql) {
        return StatementClassifier.classify(SqlTokenizer.tokenize(SqlRedactor.mask(sql)), 0, 0);
    }

    @ParameterizedTest
    @CsvSource({
        "'INSERT INTO dbo.Orders (Id) VALUES (1)',      INSERT,      DBO.ORDERS",
        "'UPDATE [dbo].[Orders] SET Status = 2',        UPDATE,      DBO.ORDERS",
        "'DELETE FROM dbo.Orders WHERE Id = 1',         DELETE,      DBO.ORDERS",
        "'DELETE o FROM dbo.Orders o WHERE o.Id = 1',   DELETE,      DBO.ORDERS",
        "'TRUNCATE TABLE dbo.Staging',                  TRUNCATE,    DBO.STAGING",
        "'MERGE INTO dbo.Stock AS t USING s ON 1 = 1;', MERGE,       DBO.STOCK",
        "'SELECT Id INTO #work FROM dbo.Orders',        SELECT INTO, #WORK",
        "'INSERT @rows (Id) SELECT 1',                  INSERT,      @ROWS"
    })
    void classify_dataChange_resolvesVerbAndTarget(String sql, String keyword, String target) {
        IrNode node = classify(sql);

        assertThat(node.kind()).isEqualTo(StatementKind.DML);
        assertThat(node.keyword()).isEqualTo(keyword);
        assertThat(node.target()).isEqualTo(target);
    }

    @Test
    void classify_selectWithoutInto_isQuery() {
        IrNode node = classify("SELECT o.Id FROM dbo.Orders o JOIN dbo.Lines l ON l.OrderId = o.Id");

        assertThat(node.kind()).isEqualTo(StatementKind.QUERY);
        assertThat(node.references())
            .filteredOn(reference -> reference.kind() == ReferenceKind.TABLE)
            .extracting(Reference::name)
            .containsExactly("DBO.ORDERS", "DBO.LINES");
    }

    @Test
    void classify_transactionStatements_normalizedKeywords() {
        assertThat(classify("BEGIN TRANSACTION t1").keyword()).isEqualTo("BEGIN TRAN");
        assertThat(classify("COMMIT TRAN").keyword()).isEqualTo("COMMIT");
        assertThat(classify("ROLLBACK").keyword()).isEqualTo("ROLLBACK");
        assertThat(classify("SAVE TRANSACTION sp1").keyword()).isEqualTo("SAVE TRAN");
        assertThat(classify("COMMIT").kind()).isEqualTo(StatementKind.TRANSACTION);
    }

    @Test
    void classify_setOptions_captureValues() {
        IrNode xactAbort = classify("SET XACT_ABORT ON");
        IrNode isolation = classify("SET TRANSACTION ISOLATION LEVEL READ COMMITTED");

        assertThat(xactAbort.keyword()).isEqualTo("XACT_ABORT");
        assertThat(xactAbort.target()).isEqualTo("ON");
        assertThat(isolation.keyword()).isEqualTo("ISOLATION LEVEL");
        assertThat(isolation.target()).isEqualTo("READ COMMITTED");
    }

    @Test
    void classify_returnValues_parsedAsIntegers() {
        assertThat(classify("RETURN -1").target()).isEqualTo("-1");
        assertThat(classify("RETURN (42)").target()).isEqualTo("42");
        assertThat(classify("RETURN @rc").target()).isNull();
        assertThat(classify("RETURN").kind()).isEqualTo(StatementKind.RETURN);
    }

    @Test
    void classify_exec_readsCalleeAndKind() {
        IrNode exec = classify("EXEC @rc = [sales].[usp_Recalc] @id = 1");
        IrNode execute = classify("EXECUTE dbo.usp_Log");

        assertThat(exec.kind()).isEqualTo(StatementKind.CALL);
        assertThat(exec.target()).isEqualTo("sales.usp_Recalc");
        assertThat(execute.keyword()).isEqualTo("EXECUTE");
        assertThat(execute.references())
            .extracting(Reference::kind, Reference::name, Reference::detail)
            .containsExactly(tuple(ReferenceKind.CALL, "dbo.usp_Log", "EXECUTE"));
    }

    @Test
    void classify_dynamicExec_marksDynamicSql() {
        assertThat(classify("EXEC (@sql)").references())
            .extracting(Reference::name, Reference::detail)
            .containsExactly(tuple(Reference.MARKER_DYNAMIC_SQL, "EXEC("));
        assertThat(classify("EXEC @sql").references())
            .extracting(Reference::name, Reference::detail)
            .containsExactly(tuple(Reference.MARKER_DYNAMIC_SQL, "EXEC @VAR"));
        assertThat(classify("EXEC sp_executesql @sql, N'@id INT', @id").references())
            .extracting(Reference::name)
            .containsExactly("sp_executesql", Reference.MARKER_DYNAMIC_SQL);
    }

    @Test
    void classify_functionCalls_collectedButKeywordsIgnored() {
        IrNode node = classify("SELECT dbo.fn_Tax(@amount), COUNT(*), CAST(1 AS INT) FROM dbo.Orders WHERE Id IN (1, 2)");

        assertThat(node.references())
            .filteredOn(reference -> reference.kind() == ReferenceKind.FUNCTION)
            .extracting(Reference::name)
            .containsExactly("dbo.fn_Tax", "COUNT", "CAST");
    }

    @Test
    void classify_tableValuedFunctionInFrom_isNotATable() {
        IrNode node = classify("SELECT * FROM dbo.fn_Rows(1)");

        assertThat(node.references())
            .filteredOn(reference -> reference.kind() == ReferenceKind.TABLE)
            .isEmpty();
    }

    @Test
    void classify_declareCursorAndTableVariable_emitMarkers() {
        assertThat(classify("DECLARE c CURSOR FOR SELECT Id FROM dbo.Orders").references())
            .extracting(Reference::name)
            .contains(Reference.MARKER_CURSOR);
        assertThat(classify("DECLARE @t TABLE (Id INT)").references())
            .extracting(Reference::name)
            .containsExactly(Reference.MARKER_TABLE_VARIABLE);
    }

    @Test
    void classify_outputClause_marksOutputAndPseudoTables() {
        IrNode node = classify("UPDATE dbo.Stock SET Qty = Qty - 1 OUTPUT inserted.Qty, deleted.Qty");

        assertThat(node.references())
            .extracting(Reference::name)
            .contains(Reference.MARKER_OUTPUT, Reference.MARKER_INSERTED, Reference.MARKER_DELETED);
    }

    @Test
    void classify_procedureHeader_collectsOutputParameters() {
        IrNode node = classify("CREATE PROCEDURE dbo.usp_x @id INT, @err_msg NVARCHAR(200) OUTPUT, @rc INT OUT");

        assertThat(node.kind()).isEqualTo(StatementKind.ROUTINE);
        assertThat(node.keyword()).isEqualTo("PROCEDURE");
        assertThat(node.references())
            .extracting(Reference::name)
            .containsExactly("@err_msg", "@rc");
    }

    @Test
    void classify_label_keepsUpperCaseName() {
        IrNode node = StatementClassifier.classify(SqlTokenizer.tokenize("retry:"), 3, 1);

        assertThat(node.kind()).isEqualTo(StatementKind.LABEL);
        assertThat(node.target()).isEqualTo("RETRY");
        assertThat(node.position()).isEqualTo(3);
        assertThat(node.depth()).isEqualTo(1);
    }
}
