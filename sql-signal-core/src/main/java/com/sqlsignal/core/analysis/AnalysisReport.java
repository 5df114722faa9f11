package com.sqlsignal.core.analysis;

import com.sqlsignal.core.flow.ControlFlow;
import com.sqlsignal.core.model.Digest;
import com.sqlsignal.core.model.TruncationNotice;
import com.sqlsignal.core.signal.DataChangeSignals;
import com.sqlsignal.core.signal.ErrorHandlingSignals;
import com.sqlsignal.core.signal.MigrationImpacts;
import com.sqlsignal.core.signal.ReferenceSignals;
import com.sqlsignal.core.signal.TransactionSignals;

import java.util.List;
import java.util.Objects;

/**
 * Complete analysis of one unit. Carries the digest of the input, never its text.
 *
 * @param name object name
 * @param type object type
 * @param digest length and hash prefix of the raw text
 * @param parser {@code grammar} or {@code fallback}
 * @param references table and function references
 * @param transactions transaction signals
 * @param dataChanges write-operation signals
 * @param errorHandling error-handling signals
 * @param controlFlow control-flow summary and graph
 * @param migrationImpacts migration impacts
 * @param queryTerms sorted retrieval terms
 * @param errors error codes ({@code parse_error: ...}, {@code control_flow_graph_truncated})
 * @param truncations every cap that was hit
 */
public record AnalysisReport(
    String name,
    String type,
    Digest digest,
    String parser,
    ReferenceSignals references,
    TransactionSignals transactions,
    DataChangeSignals dataChanges,
    ErrorHandlingSignals errorHandling,
    ControlFlow controlFlow,
    MigrationImpacts migrationImpacts,
    List<String> queryTerms,
    List<String> errors,
    List<TruncationNotice> truncations
) {
    public AnalysisReport {
        Objects.requireNonNull(digest, "digest must not be null");
        Objects.requireNonNull(controlFlow, "controlFlow must not be null");
        queryTerms = queryTerms == null ? List.of() : List.copyOf(queryTerms);
        errors = errors == null ? List.of() : List.copyOf(errors);
        truncations = truncations == null ? List.of() : List.copyOf(truncations);
    }
}
