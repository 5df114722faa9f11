package com.sqlsignal.core.callgraph;

import java.util.List;
import java.util.Objects;

/**
 * Result of a callers lookup.
 *
 * @param target looked-up object
 * @param summary totals
 * @param callers callers by call count descending, then name
 * @param errors limit messages ({@code object_limit_exceeded: ...}, {@code sql_limit_exceeded: ...}) and
 *     {@code parse_degraded: object=<name>} per unit parsed by the fallback scanner
 */
public record CallersResult(
    Target target,
    Summary summary,
    List<Caller> callers,
    List<String> errors
) {
    public CallersResult {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        callers = callers == null ? List.of() : List.copyOf(callers);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * @param name target as given
     * @param type {@code procedure} or {@code function}
     * @param normalized lower-case normalized name
     */
    public record Target(String name, String type, String normalized) {
    }

    /**
     * @param hasCallers true when any call was found
     * @param callerCount number of callers
     * @param totalCalls sum of call counts
     */
    public record Summary(boolean hasCallers, int callerCount, int totalCalls) {
    }
}
