package com.sqlsignal.core.signal;

import java.util.List;

/**
 * Objects referenced by one unit.
 *
 * @param tables sorted canonical table names
 * @param functions sorted upper-case function names (last name part)
 */
public record ReferenceSignals(
    List<String> tables,
    List<String> functions
) {
    public ReferenceSignals {
        tables = tables == null ? List.of() : List.copyOf(tables);
        functions = functions == null ? List.of() : List.copyOf(functions);
    }
}
