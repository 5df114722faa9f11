package com.sqlsignal.core.signal;

import java.util.List;

/**
 * Migration impacts of one unit.
 *
 * @param hasImpact true when at least one impact was detected
 * @param items impacts sorted by id
 */
public record MigrationImpacts(
    boolean hasImpact,
    List<MigrationImpact> items
) {
    public MigrationImpacts {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
