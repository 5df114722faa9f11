package com.sqlsignal.core.callgraph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Roots, leaves and degrees of a call graph.
 *
 * @param roots sorted ids of nodes nobody calls
 * @param leaves sorted ids of nodes that call nobody
 * @param inDegree incoming edge count per node id, sorted by id
 * @param outDegree outgoing edge count per node id, sorted by id
 */
public record Topology(
    List<String> roots,
    List<String> leaves,
    Map<String, Integer> inDegree,
    Map<String, Integer> outDegree
) {
    public Topology {
        roots = roots == null ? List.of() : List.copyOf(roots);
        leaves = leaves == null ? List.of() : List.copyOf(leaves);
        inDegree = Collections.unmodifiableMap(new TreeMap<>(inDegree == null ? Map.of() : inDegree));
        outDegree = Collections.unmodifiableMap(new TreeMap<>(outDegree == null ? Map.of() : outDegree));
    }
}
