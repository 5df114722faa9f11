package com.sqlsignal.core.signal;

import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.ir.StatementKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Flags T-SQL constructs that have no direct counterpart on other platforms.
 */
public class MigrationImpactDetector {

    private enum Rule {
        IMP_CURSOR("cursor", "high", "Cursor-based row processing",
            "Rewrite as set-based statements or iterate in application code."),
        IMP_DYN_SQL("dynamic_sql", "high", "Dynamic SQL execution",
            "Statement text is built at runtime; move to parameterized queries or a query builder."),
        IMP_IDENTITY("identity", "medium", "Identity value retrieval",
            "Replace with generated-key retrieval or sequences on the target platform."),
        IMP_MERGE("merge", "medium", "MERGE statement",
            "Split into explicit insert/update paths or use the target's upsert syntax."),
        IMP_OUTPUT_CLAUSE("output_clause", "medium", "OUTPUT clause",
            "Capture affected rows with RETURNING or a follow-up query."),
        IMP_TABLE_VARIABLE("table_variable", "low", "Table variable",
            "Replace with a collection in application code or a temporary table."),
        IMP_TEMP_TABLE("temp_table", "medium", "Temporary table",
            "Session-scoped temp tables need an equivalent on the target platform."),
        IMP_XACT_ABORT("transaction", "low", "XACT_ABORT setting",
            "Map automatic rollback behaviour to explicit transaction handling.");

        private final String category;
        private final String severity;
        private final String title;
        private final String details;

        Rule(String category, String severity, String title, String details) {
            this.category = category;
            this.severity = severity;
            this.title = title;
            this.details = details;
        }
    }

    /**
     * Detects impacts from an IR and the signals already extracted from it.
     *
     * @param ir intermediate representation
     * @param bundle signals extracted from the same IR
     * @return impacts sorted by id
     */
    public MigrationImpacts detect(SourceIr ir, SignalBundle bundle) {
        Objects.requireNonNull(ir, "ir must not be null");
        Objects.requireNonNull(bundle, "bundle must not be null");

        Map<Rule, List<String>> evidence = new TreeMap<>();
        for (IrNode node : ir.nodes()) {
            if (node.kind() == StatementKind.CURSOR) {
                add(evidence, Rule.IMP_CURSOR, node.keyword());
            }
            for (Reference reference : node.references()) {
                collect(evidence, reference);
            }
        }
        if (bundle.dataChanges().operation("merge").count() > 0) {
            add(evidence, Rule.IMP_MERGE, "MERGE");
        }
        if (bundle.transactions().xactAbort() != null) {
            add(evidence, Rule.IMP_XACT_ABORT, "XACT_ABORT " + bundle.transactions().xactAbort());
        }

        List<MigrationImpact> items = new ArrayList<>();
        evidence.forEach((rule, signals) -> items.add(new MigrationImpact(
            rule.name(),
            rule.category,
            rule.severity,
            rule.title,
            DeterministicList.strings(signals, DeterministicList.UNLIMITED).items(),
            rule.details
        )));

        List<MigrationImpact> sorted = DeterministicList.of(items, MigrationImpact::id, DeterministicList.UNLIMITED).items();
        return new MigrationImpacts(!sorted.isEmpty(), sorted);
    }

    private static void collect(Map<Rule, List<String>> evidence, Reference reference) {
        if (reference.kind() == ReferenceKind.MARKER) {
            switch (reference.name()) {
                case Reference.MARKER_DYNAMIC_SQL -> add(evidence, Rule.IMP_DYN_SQL,
                    reference.detail() != null ? reference.detail() : "EXEC");
                case Reference.MARKER_CURSOR -> add(evidence, Rule.IMP_CURSOR, "DECLARE CURSOR");
                case Reference.MARKER_TEMP_TABLE -> add(evidence, Rule.IMP_TEMP_TABLE, "TEMP_TABLE");
                case Reference.MARKER_TABLE_VARIABLE -> add(evidence, Rule.IMP_TABLE_VARIABLE, "TABLE_VARIABLE");
                case Reference.MARKER_OUTPUT -> add(evidence, Rule.IMP_OUTPUT_CLAUSE, "OUTPUT");
                default -> {
                    // INSERTED/DELETED only matter alongside OUTPUT or triggers
                }
            }
        } else if (reference.kind() == ReferenceKind.SYSTEM_VARIABLE && reference.name().equals("@@IDENTITY")) {
            add(evidence, Rule.IMP_IDENTITY, "@@IDENTITY");
        } else if (reference.kind() == ReferenceKind.FUNCTION) {
            String upper = reference.name().toUpperCase(Locale.ROOT);
            if (upper.endsWith("SCOPE_IDENTITY") || upper.endsWith("IDENT_CURRENT")) {
                add(evidence, Rule.IMP_IDENTITY, upper.substring(upper.lastIndexOf('.') + 1) + "()");
            }
        }
    }

    private static void add(Map<Rule, List<String>> evidence, Rule rule, String signal) {
        evidence.computeIfAbsent(rule, key -> new ArrayList<>()).add(signal);
    }
}
