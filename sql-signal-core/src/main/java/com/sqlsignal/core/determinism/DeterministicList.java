package com.sqlsignal.core.determinism;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * The single ordering routine behind every documented output list.
 *
 * <p>Steps, always in this order: canonicalize, stable sort by key, dedupe on equal keys (first
 * occurrence wins), cap at the limit, flag the cut. Because deduplication precedes the cap, the
 * kept entries and the reported {@code distinctCount} depend only on the input values, never on
 * input order or iteration order of internal collections.
 */
public final class DeterministicList {

    public static final int UNLIMITED = Integer.MAX_VALUE;

    private DeterministicList() {
        // Utility class
    }

    /**
     * Orders arbitrary entries by a comparable key.
     *
     * @param values entries, any order
     * @param key canonical key of an entry
     * @param limit maximum number of entries kept
     * @param <T> entry type
     * @param <K> key type
     * @return capped list in key order
     */
    public static <T, K extends Comparable<? super K>> Capped<T> of(Collection<? extends T> values,
                                                                   Function<? super T, ? extends K> key,
                                                                   int limit) {
        Objects.requireNonNull(key, "key must not be null");
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (values == null || values.isEmpty()) {
            return new Capped<>(List.of(), 0, limit);
        }

        List<T> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.comparing(key));

        List<T> distinct = new ArrayList<>(sorted.size());
        K previous = null;
        for (T value : sorted) {
            K current = key.apply(value);
            if (previous == null || previous.compareTo(current) != 0) {
                distinct.add(value);
                previous = current;
            }
        }

        List<T> kept = distinct.size() > limit ? distinct.subList(0, limit) : distinct;
        return new Capped<>(kept, distinct.size(), limit);
    }

    /**
     * Orders strings after mapping each through a canonicalizer.
     *
     * @param values raw strings, any order; nulls and blanks are dropped
     * @param canonical canonicalizer producing both output value and key
     * @param limit maximum number of entries kept
     * @return capped canonical strings in natural order
     */
    public static Capped<String> strings(Collection<String> values, UnaryOperator<String> canonical, int limit) {
        List<String> canonicalValues = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value == null) {
                    continue;
                }
                String mapped = canonical.apply(value);
                if (mapped != null && !mapped.isBlank()) {
                    canonicalValues.add(mapped);
                }
            }
        }
        return of(canonicalValues, Function.identity(), limit);
    }

    /**
     * Orders strings that are already canonical.
     *
     * @param values strings
     * @param limit maximum number of entries kept
     * @return capped strings in natural order
     */
    public static Capped<String> strings(Collection<String> values, int limit) {
        return strings(values, Canonical.asIs(), limit);
    }
}
