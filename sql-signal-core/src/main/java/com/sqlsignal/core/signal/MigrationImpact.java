package com.sqlsignal.core.signal;

import java.util.List;
import java.util.Objects;

/**
 * One construct that needs attention when migrating off T-SQL.
 *
 * @param id stable impact id ({@code IMP_DYN_SQL}, {@code IMP_CURSOR}, ...)
 * @param category impact category
 * @param severity {@code high}, {@code medium} or {@code low}
 * @param title short description
 * @param signals sorted evidence signals
 * @param details migration guidance
 */
public record MigrationImpact(
    String id,
    String category,
    String severity,
    String title,
    List<String> signals,
    String details
) {
    public MigrationImpact {
        Objects.requireNonNull(id, "id must not be null");
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
