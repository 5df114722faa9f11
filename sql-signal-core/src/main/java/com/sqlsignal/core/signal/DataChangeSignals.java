package com.sqlsignal.core.signal;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Write operations of one unit.
 *
 * <p>{@code operations} is keyed by {@code insert}, {@code update}, {@code delete}, {@code merge},
 * {@code truncate} and {@code select_into}; every key is always present.
 *
 * @param hasWrites true when any operation count is positive
 * @param operations per-verb summaries
 * @param tableOperations per-table verbs, sorted by table
 * @param signals sorted write signals ({@code INSERT}, {@code OUTPUT}, {@code SELECT INTO}, ...)
 * @param notes unresolved-target notes
 */
public record DataChangeSignals(
    boolean hasWrites,
    Map<String, OperationSummary> operations,
    List<TableOperations> tableOperations,
    List<String> signals,
    List<String> notes
) {
    public DataChangeSignals {
        operations = Collections.unmodifiableMap(new TreeMap<>(operations == null ? Map.of() : operations));
        tableOperations = tableOperations == null ? List.of() : List.copyOf(tableOperations);
        signals = signals == null ? List.of() : List.copyOf(signals);
        notes = notes == null ? List.of() : List.copyOf(notes);
    }

    public OperationSummary operation(String name) {
        return operations.getOrDefault(name, OperationSummary.empty());
    }
}
