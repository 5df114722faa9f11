package com.sqlsignal.core.signal;

import com.sqlsignal.core.model.TruncationNotice;

import java.util.List;
import java.util.Objects;

/**
 * Everything {@link SignalExtractor} derives from one IR.
 *
 * @param transactions transaction signals
 * @param dataChanges write-operation signals
 * @param errorHandling error-handling signals
 * @param references table and function references
 * @param callSites calls in source order, input to call graph construction
 * @param markers sorted structural markers ({@code CURSOR}, {@code DYNAMIC_SQL}, ...)
 * @param truncations notices for capped lists
 */
public record SignalBundle(
    TransactionSignals transactions,
    DataChangeSignals dataChanges,
    ErrorHandlingSignals errorHandling,
    ReferenceSignals references,
    List<CallSite> callSites,
    List<String> markers,
    List<TruncationNotice> truncations
) {
    public SignalBundle {
        Objects.requireNonNull(transactions, "transactions must not be null");
        Objects.requireNonNull(dataChanges, "dataChanges must not be null");
        Objects.requireNonNull(errorHandling, "errorHandling must not be null");
        Objects.requireNonNull(references, "references must not be null");
        callSites = callSites == null ? List.of() : List.copyOf(callSites);
        markers = markers == null ? List.of() : List.copyOf(markers);
        truncations = truncations == null ? List.of() : List.copyOf(truncations);
    }

    public boolean hasMarker(String marker) {
        return markers.contains(marker);
    }
}
