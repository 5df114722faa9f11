package com.sqlsignal.core.callgraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed graph over integer-indexed nodes with adjacency lists.
 *
 * <p>Nodes are addressed by insertion index; ids map to indices once. Nothing here depends on hash
 * iteration order, so traversal results are reproducible.
 */
final class GraphArena {

    private final List<String> ids = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final List<List<Integer>> successors = new ArrayList<>();
    private final List<Integer> inDegree = new ArrayList<>();

    int add(String id) {
        Integer existing = index.get(id);
        if (existing != null) {
            return existing;
        }
        int slot = ids.size();
        ids.add(id);
        index.put(id, slot);
        successors.add(new ArrayList<>());
        inDegree.add(0);
        return slot;
    }

    void connect(String from, String to) {
        int source = index.get(from);
        int target = index.get(to);
        successors.get(source).add(target);
        inDegree.set(target, inDegree.get(target) + 1);
    }

    int size() {
        return ids.size();
    }

    String id(int slot) {
        return ids.get(slot);
    }

    int inDegree(int slot) {
        return inDegree.get(slot);
    }

    int outDegree(int slot) {
        return successors.get(slot).size();
    }

    /**
     * Detects a directed cycle (self-loops included) with an iterative three-colour depth-first search.
     *
     * @return true if any cycle exists
     */
    boolean hasCycle() {
        final int white = 0;
        final int grey = 1;
        final int black = 2;
        int[] colour = new int[ids.size()];
        int[] cursor = new int[ids.size()];
        int[] stack = new int[ids.size()];

        for (int root = 0; root < ids.size(); root++) {
            if (colour[root] != white) {
                continue;
            }
            int top = 0;
            stack[top] = root;
            colour[root] = grey;
            while (top >= 0) {
                int node = stack[top];
                List<Integer> next = successors.get(node);
                if (cursor[node] < next.size()) {
                    int target = next.get(cursor[node]++);
                    if (colour[target] == grey) {
                        return true;
                    }
                    if (colour[target] == white) {
                        colour[target] = grey;
                        stack[++top] = target;
                    }
                } else {
                    colour[node] = black;
                    top--;
                }
            }
        }
        return false;
    }
}
