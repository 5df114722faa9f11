package com.sqlsignal.core.model;

import java.util.Objects;

/**
 * Structured record of a capped collection.
 *
 * @param code resource-specific code ({@code max_items_exceeded}, {@code control_flow_graph_truncated}, ...)
 * @param context dotted path of the capped field (e.g. {@code error_handling.return_values})
 * @param limit configured cap
 * @param actual number of distinct entries before the cap was applied
 */
public record TruncationNotice(
    String code,
    String context,
    int limit,
    int actual
) {
    public static final String MAX_ITEMS_EXCEEDED = "max_items_exceeded";

    public TruncationNotice {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(context, "context must not be null");
    }
}
