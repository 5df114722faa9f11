package com.sqlsignal.core.callgraph;

import java.util.List;

/**
 * One object that calls the target.
 *
 * @param name caller name as submitted
 * @param type caller type as submitted
 * @param callCount matching call sites
 * @param callKinds sorted call kinds
 * @param signals sorted call signals (capped)
 */
public record Caller(
    String name,
    String type,
    int callCount,
    List<String> callKinds,
    List<String> signals
) {
    public Caller {
        callKinds = callKinds == null ? List.of() : List.copyOf(callKinds);
        signals = signals == null ? List.of() : List.copyOf(signals);
    }
}
