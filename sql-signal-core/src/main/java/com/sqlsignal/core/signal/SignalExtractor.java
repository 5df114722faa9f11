package com.sqlsignal.core.signal;

import com.sqlsignal.core.config.AnalyzerConfig;
import com.sqlsignal.core.determinism.Canonical;
import com.sqlsignal.core.determinism.Capped;
import com.sqlsignal.core.determinism.DeterministicList;
import com.sqlsignal.core.ir.IrNode;
import com.sqlsignal.core.ir.Reference;
import com.sqlsignal.core.ir.ReferenceKind;
import com.sqlsignal.core.ir.SourceIr;
import com.sqlsignal.core.ir.StatementKind;
import com.sqlsignal.core.model.TruncationNotice;
import com.sqlsignal.core.parser.StatementClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives a {@link SignalBundle} from one IR in a single pass.
 *
 * <p>Thread-safe: the extractor holds only immutable limits, all state lives in a per-call walk.
 */
public class SignalExtractor {

    private static final Logger log = LoggerFactory.getLogger(SignalExtractor.class);

    /**
     * Operation keys of {@link DataChangeSignals#operations()}, mapped from IR keywords.
     */
    private static final Map<String, String> OPERATION_KEYS = Map.of(
        "INSERT", "insert",
        "UPDATE", "update",
        "DELETE", "delete",
        "MERGE", "merge",
        "TRUNCATE", "truncate",
        StatementClassifier.SELECT_INTO, "select_into"
    );

    private static final Set<String> WRITE_MARKERS = Set.of(
        Reference.MARKER_OUTPUT, Reference.MARKER_INSERTED, Reference.MARKER_DELETED
    );

    private static final Set<String> ERROR_PARAM_HINTS = Set.of("err", "msg", "message", "status", "retcode", "returncode");

    private final AnalyzerConfig.ListLimits limits;

    public SignalExtractor(AnalyzerConfig config) {
        this.limits = Objects.requireNonNull(config, "config must not be null").lists();
    }

    /**
     * Walks the IR once and collects every signal family.
     *
     * @param ir intermediate representation of one unit
     * @return signal bundle
     */
    public SignalBundle extract(SourceIr ir) {
        Objects.requireNonNull(ir, "ir must not be null");
        Walk walk = new Walk();
        for (IrNode node : ir.nodes()) {
            walk.visit(node);
        }

        List<TruncationNotice> truncations = new ArrayList<>();
        SignalBundle bundle = new SignalBundle(
            walk.transactions(),
            walk.dataChanges(truncations),
            walk.errorHandling(truncations),
            walk.references(truncations),
            walk.callSites,
            DeterministicList.strings(walk.markers, DeterministicList.UNLIMITED).items(),
            truncations
        );

        log.debug("Extracted signals from {} statements ({} path): {} call sites, {} markers, {} truncations",
            ir.size(), ir.path().label(), bundle.callSites().size(), bundle.markers().size(), truncations.size());
        return bundle;
    }

    private static String functionBaseName(String written) {
        String unquoted = Canonical.unquote(written);
        int dot = unquoted.lastIndexOf('.');
        return (dot >= 0 ? unquoted.substring(dot + 1) : unquoted).toUpperCase(Locale.ROOT);
    }

    private static boolean isErrorParameter(String name) {
        String bare = name.startsWith("@") ? name.substring(1) : name;
        String lower = bare.toLowerCase(Locale.ROOT);
        return ERROR_PARAM_HINTS.stream().anyMatch(lower::contains) || lower.equals("rc");
    }

    private static <T> List<T> capped(Capped<T> list, String context, List<TruncationNotice> truncations) {
        list.notice(context).ifPresent(truncations::add);
        return list.items();
    }

    /**
     * Mutable accumulator of one {@link #extract(SourceIr)} call.
     */
    private final class Walk {
        private int beginCount;
        private int commitCount;
        private int rollbackCount;
        private int savepointCount;
        private int tryCount;
        private int catchCount;
        private int throwCount;
        private int raiserrorCount;
        private int printCount;
        private int returnCount;
        private int atAtErrorCount;
        private String xactAbort;
        private String isolationLevel;

        private final List<String> transactionSignals = new ArrayList<>();
        private final Map<String, List<String>> tablesByOperation = new LinkedHashMap<>();
        private final Map<String, Set<String>> operationsByTable = new TreeMap<>();
        private final Map<String, Integer> operationCounts = new LinkedHashMap<>();
        private final List<String> writeSignals = new ArrayList<>();
        private final List<String> writeNotes = new ArrayList<>();
        private final List<String> errorFunctions = new ArrayList<>();
        private final List<Integer> returnValues = new ArrayList<>();
        private final List<String> outputErrorParams = new ArrayList<>();
        private final List<String> tables = new ArrayList<>();
        private final List<String> functions = new ArrayList<>();
        private final List<CallSite> callSites = new ArrayList<>();
        private final List<String> markers = new ArrayList<>();

        Walk() {
            for (String key : OPERATION_KEYS.values()) {
                tablesByOperation.put(key, new ArrayList<>());
                operationCounts.put(key, 0);
            }
        }

        void visit(IrNode node) {
            switch (node.kind()) {
                case TRANSACTION -> visitTransaction(node);
                case TRY -> tryCount++;
                case CATCH -> catchCount++;
                case THROW -> throwCount++;
                case RAISERROR -> raiserrorCount++;
                case PRINT -> printCount++;
                case RETURN -> {
                    returnCount++;
                    if (node.hasTarget()) {
                        returnValues.add(Integer.valueOf(node.target()));
                    }
                }
                case SET_OPTION -> visitSetOption(node);
                case DML -> visitDataChange(node);
                default -> {
                    // Other kinds contribute references only
                }
            }
            node.references().forEach(reference -> visitReference(node, reference));
        }

        private void visitTransaction(IrNode node) {
            transactionSignals.add(node.keyword());
            switch (node.keyword()) {
                case "BEGIN TRAN" -> beginCount++;
                case "COMMIT" -> commitCount++;
                case "ROLLBACK" -> rollbackCount++;
                case "SAVE TRAN" -> savepointCount++;
                default -> {
                    // No counter
                }
            }
        }

        private void visitSetOption(IrNode node) {
            if (node.isKeyword("XACT_ABORT") && node.hasTarget()) {
                xactAbort = node.target();
            } else if (node.isKeyword("ISOLATION LEVEL") && node.hasTarget()) {
                isolationLevel = node.target();
            }
        }

        private void visitDataChange(IrNode node) {
            String operation = OPERATION_KEYS.get(node.keyword());
            if (operation == null) {
                return;
            }
            operationCounts.merge(operation, 1, Integer::sum);
            writeSignals.add(node.keyword());

            if (!node.hasTarget()) {
                writeNotes.add("unresolved_target: " + operation + " at statement " + node.position());
                return;
            }
            if (node.target().startsWith("@")) {
                writeNotes.add("table_variable_target: " + operation + " " + node.target());
                return;
            }
            tablesByOperation.get(operation).add(node.target());
            operationsByTable.computeIfAbsent(node.target(), table -> new TreeSet<>()).add(operation);
        }

        private void visitReference(IrNode node, Reference reference) {
            switch (reference.kind()) {
                case TABLE -> tables.add(reference.name());
                case FUNCTION -> {
                    String base = functionBaseName(reference.name());
                    functions.add(base);
                    callSites.add(new CallSite(CallSite.FUNCTION_CALL, Canonical.unquote(reference.name())));
                    if (base.startsWith("ERROR_")) {
                        errorFunctions.add(base);
                    }
                    if (base.equals("XACT_STATE")) {
                        transactionSignals.add("XACT_STATE()");
                    }
                }
                case CALL -> {
                    String kind = "EXECUTE".equals(reference.detail()) ? CallSite.EXECUTE : CallSite.EXEC;
                    callSites.add(new CallSite(kind, Canonical.unquote(reference.name())));
                }
                case SYSTEM_VARIABLE -> {
                    if (reference.name().equals("@@ERROR")) {
                        atAtErrorCount++;
                    } else if (reference.name().equals("@@TRANCOUNT")) {
                        transactionSignals.add("@@TRANCOUNT");
                    }
                }
                case OUTPUT_PARAMETER -> {
                    if (isErrorParameter(reference.name())) {
                        outputErrorParams.add(reference.name());
                    }
                }
                case MARKER -> {
                    markers.add(reference.name());
                    if (node.kind() == StatementKind.DML && WRITE_MARKERS.contains(reference.name())) {
                        writeSignals.add(reference.name());
                    }
                }
            }
        }

        TransactionSignals transactions() {
            List<String> signals = new ArrayList<>(transactionSignals);
            if (tryCount > 0 || catchCount > 0) {
                signals.add("TRY/CATCH");
            }
            if (throwCount > 0) {
                signals.add("THROW");
            }
            if (xactAbort != null) {
                signals.add("XACT_ABORT " + xactAbort);
            }
            if (isolationLevel != null) {
                signals.add("ISOLATION LEVEL " + isolationLevel);
            }
            return new TransactionSignals(
                beginCount > 0,
                beginCount,
                commitCount,
                rollbackCount,
                savepointCount,
                tryCount > 0 || catchCount > 0,
                xactAbort,
                isolationLevel,
                DeterministicList.strings(signals, DeterministicList.UNLIMITED).items()
            );
        }

        DataChangeSignals dataChanges(List<TruncationNotice> truncations) {
            Map<String, OperationSummary> operations = new TreeMap<>();
            boolean hasWrites = false;
            for (Map.Entry<String, Integer> entry : operationCounts.entrySet()) {
                String operation = entry.getKey();
                List<String> targets = capped(
                    DeterministicList.strings(tablesByOperation.get(operation), limits.references()),
                    "data_changes.operations." + operation + ".tables", truncations);
                operations.put(operation, new OperationSummary(entry.getValue(), targets));
                hasWrites |= entry.getValue() > 0;
            }

            List<TableOperations> perTable = new ArrayList<>();
            operationsByTable.forEach((table, ops) -> perTable.add(new TableOperations(table, List.copyOf(ops))));

            return new DataChangeSignals(
                hasWrites,
                operations,
                capped(DeterministicList.of(perTable, TableOperations::table, limits.references()),
                    "data_changes.table_operations", truncations),
                DeterministicList.strings(writeSignals, DeterministicList.UNLIMITED).items(),
                capped(DeterministicList.strings(writeNotes, limits.references()), "data_changes.notes", truncations)
            );
        }

        ErrorHandlingSignals errorHandling(List<TruncationNotice> truncations) {
            boolean hasTryCatch = tryCount > 0 || catchCount > 0;
            List<String> functionNames = capped(
                DeterministicList.strings(errorFunctions, limits.errorFunctions()),
                "error_handling.uses_error_functions", truncations);
            List<Integer> values = capped(
                DeterministicList.of(returnValues, value -> value, limits.returnValues()),
                "error_handling.return_values", truncations);
            List<String> params = capped(
                DeterministicList.strings(outputErrorParams, limits.outputParams()),
                "error_handling.output_error_params", truncations);

            List<String> signals = new ArrayList<>(errorFunctions);
            if (hasTryCatch) {
                signals.add("TRY/CATCH");
            }
            if (throwCount > 0) {
                signals.add("THROW");
            }
            if (raiserrorCount > 0) {
                signals.add("RAISERROR");
            }
            if (atAtErrorCount > 0) {
                signals.add("@@ERROR");
            }
            if (printCount > 0) {
                signals.add("PRINT");
            }
            if (returnCount > 0) {
                signals.add("RETURN");
            }
            if (!outputErrorParams.isEmpty()) {
                signals.add("OUTPUT PARAM");
            }

            List<String> notes = new ArrayList<>();
            if (catchCount > 0 && throwCount == 0 && raiserrorCount == 0) {
                notes.add("catch_without_rethrow");
            }
            if (atAtErrorCount > 0 && !hasTryCatch) {
                notes.add("at_at_error_without_try_catch");
            }

            return new ErrorHandlingSignals(
                hasTryCatch,
                tryCount,
                catchCount,
                throwCount > 0,
                throwCount,
                raiserrorCount > 0,
                raiserrorCount,
                atAtErrorCount > 0,
                atAtErrorCount,
                functionNames,
                printCount > 0,
                printCount,
                returnCount > 0,
                returnCount,
                values,
                !params.isEmpty(),
                params,
                capped(DeterministicList.strings(signals, limits.errorSignals()), "error_handling.signals", truncations),
                DeterministicList.strings(notes, DeterministicList.UNLIMITED).items()
            );
        }

        ReferenceSignals references(List<TruncationNotice> truncations) {
            return new ReferenceSignals(
                capped(DeterministicList.strings(tables, Canonical.upper(), limits.references()),
                    "references.tables", truncations),
                capped(DeterministicList.strings(functions, limits.references()),
                    "references.functions", truncations)
            );
        }
    }
}
