package com.sqlsignal.core.signal;

import java.util.List;
import java.util.Objects;

/**
 * Write verbs applied to one table.
 *
 * @param table canonical table name
 * @param ops sorted operation names ({@code delete}, {@code insert}, ...)
 */
public record TableOperations(
    String table,
    List<String> ops
) {
    public TableOperations {
        Objects.requireNonNull(table, "table must not be null");
        ops = ops == null ? List.of() : List.copyOf(ops);
    }
}
