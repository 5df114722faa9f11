package com.sqlsignal.core.signal;

import java.util.List;

/**
 * Statements of one write verb and the tables they target.
 *
 * @param count number of statements
 * @param tables sorted, deduplicated canonical target tables
 */
public record OperationSummary(
    int count,
    List<String> tables
) {
    public OperationSummary {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static OperationSummary empty() {
        return new OperationSummary(0, List.of());
    }
}
