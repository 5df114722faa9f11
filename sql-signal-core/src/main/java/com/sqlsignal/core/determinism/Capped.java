package com.sqlsignal.core.determinism;

import com.sqlsignal.core.model.TruncationNotice;

import java.util.List;
import java.util.Optional;

/**
 * Sorted, deduplicated and capped list, plus what the cap removed.
 *
 * @param items kept entries in key order
 * @param distinctCount number of distinct entries before capping
 * @param limit cap that was applied
 * @param <T> entry type
 */
public record Capped<T>(
    List<T> items,
    int distinctCount,
    int limit
) {
    public Capped {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean truncated() {
        return distinctCount > items.size();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Truncation notice for this list, if the cap removed anything.
     *
     * @param code notice code
     * @param context dotted field path
     * @return notice when truncated, otherwise empty
     */
    public Optional<TruncationNotice> notice(String code, String context) {
        return truncated()
            ? Optional.of(new TruncationNotice(code, context, limit, distinctCount))
            : Optional.empty();
    }

    public Optional<TruncationNotice> notice(String context) {
        return notice(TruncationNotice.MAX_ITEMS_EXCEEDED, context);
    }
}
