package com.sqlsignal.core.signal;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.ParserPath;
import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.ir.StatementKind;
import com.sqlsignal.core.model.SourceUnit;
import com.sqlsignal.core.parser.SourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MigrationImpactDetectorTest {

    private final MigrationImpactDetector detector = new MigrationImpactDetector();
    private final SignalExtractor extractor = new SignalExtractor(AnalyzerConfig.defaults());

    private MigrationImpacts detect(SourceIr ir) {
        return detector.detect(ir, extractor.extract(ir));
    }

    @Test
    void detect_plainStatements_noImpact() {
        SourceIr ir = new SourceIr(List.of(
            new IrNode(0, StatementKind.QUERY, 0, "SELECT", null,
                List.of(Reference.of(ReferenceKind.TABLE, "DBO.ORDERS")))
        ), ParserPath.GRAMMAR);

        MigrationImpacts impacts = detect(ir);

        assertThat(impacts.hasImpact()).isFalse();
        assertThat(impacts.items()).isEmpty();
    }

    @Test
    void detect_portabilityConstructs_sortedById() {
        // Given
        SourceIr ir = new SourceIr(List.of(
            new IrNode(0, StatementKind.DECLARE, 0, "DECLARE", null,
                List.of(Reference.marker(Reference.MARKER_CURSOR))),
            new IrNode(1, StatementKind.CALL, 0, "EXEC", "sp_executesql",
                List.of(Reference.marker(Reference.MARKER_DYNAMIC_SQL, "sp_executesql"))),
            new IrNode(2, StatementKind.DML, 0, "MERGE", "DBO.TARGET", List.of()),
            new IrNode(3, StatementKind.SET_OPTION, 0, "XACT_ABORT", "ON", List.of()),
            new IrNode(4, StatementKind.QUERY, 0, "SELECT", null,
                List.of(Reference.of(ReferenceKind.FUNCTION, "SCOPE_IDENTITY"))),
            new IrNode(5, StatementKind.DML, 0, "INSERT", "#STAGE",
                List.of(Reference.marker(Reference.MARKER_TEMP_TABLE, "#STAGE")))
        ), ParserPath.GRAMMAR);

        // When
        MigrationImpacts impacts = detect(ir);

        // Then
        assertThat(impacts.hasImpact()).isTrue();
        assertThat(impacts.items()).extracting(MigrationImpact::id).containsExactly(
            "IMP_CURSOR", "IMP_DYN_SQL", "IMP_IDENTITY", "IMP_MERGE", "IMP_TEMP_TABLE", "IMP_XACT_ABORT");
        assertThat(impacts.items().get(1).signals()).containsExactly("sp_executesql");
        assertThat(impacts.items().get(2).signals()).containsExactly("SCOPE_IDENTITY()");
        assertThat(impacts.items().get(5).signals()).containsExactly("XACT_ABORT ON");
        assertThat(impacts.items().get(5).category()).isEqualTo("transaction");
    }

    @Test
    void detect_sameRuleTwice_signalsDeduplicated() {
        SourceIr ir = new SourceIr(List.of(
            new IrNode(0, StatementKind.QUERY, 0, "SELECT", null,
                List.of(Reference.of(ReferenceKind.SYSTEM_VARIABLE, "@@IDENTITY"))),
            new IrNode(1, StatementKind.QUERY, 0, "SELECT", null,
                List.of(Reference.of(ReferenceKind.SYSTEM_VARIABLE, "@@IDENTITY"),
                    Reference.of(ReferenceKind.FUNCTION, "dbo.IDENT_CURRENT")))
        ), ParserPath.FALLBACK);

        MigrationImpacts impacts = detect(ir);

        assertThat(impacts.items()).hasSize(1);
        MigrationImpact identity = impacts.items().get(0);
        assertThat(identity.id()).isEqualTo("IMP_IDENTITY");
        assertThat(identity.severity()).isEqualTo("medium");
        assertThat(identity.signals()).containsExactly("@@IDENTITY", "IDENT_CURRENT()");
    }

    @Test
    void detect_parsedCursorLoop_flagsCursor() {
        String sql = """
            DECLARE c CURSOR FOR SELECT Id FROM dbo.Orders;
            OPEN c;
            FETCH NEXT FROM c INTO @id;
            CLOSE c;
            DEALLOCATE c;
            """;
        SourceIr ir = new SourceParser().parse(SourceUnit.anonymous(sql)).ir();

        MigrationImpacts impacts = detect(ir);

        assertThat(impacts.items()).extracting(MigrationImpact::id).contains("IMP_CURSOR");
    }
}
