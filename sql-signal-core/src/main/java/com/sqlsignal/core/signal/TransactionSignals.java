package com.sqlsignal.core.signal;

import java.util.List;

/**
 * Transaction usage of one unit.
 *
 * @param usesTransaction true when at least one BEGIN TRAN is present
 * @param beginCount BEGIN TRAN statements
 * @param commitCount COMMIT statements
 * @param rollbackCount ROLLBACK statements
 * @param savepointCount SAVE TRAN statements
 * @param hasTryCatch true when a TRY/CATCH block is present
 * @param xactAbort {@code ON}/{@code OFF} from the last SET XACT_ABORT, or null
 * @param isolationLevel isolation level from the last SET TRANSACTION ISOLATION LEVEL, or null
 * @param signals sorted, deduplicated transaction signals
 */
public record TransactionSignals(
    boolean usesTransaction,
    int beginCount,
    int commitCount,
    int rollbackCount,
    int savepointCount,
    boolean hasTryCatch,
    String xactAbort,
    String isolationLevel,
    List<String> signals
) {
    public TransactionSignals {
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
