package com.plang.conflict;

import com.plang.ir.IrFunction;
import com.plang.ir.IrModule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Routing graph between policies of one module: an edge A -&gt; B exists when A contains
 * {@code route to B} and B is a policy of the module.
 * <p>
 * Nodes are held in an index arena in declaration order. All traversal state is local to a
 * call, so a graph can be queried repeatedly.
 */
final class RouteGraph {

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final List<String> nodes;
    private final Map<String, Integer> index;
    private final int[][] successors;
    private final int[] components;

    private RouteGraph(List<String> nodes, Map<String, Integer> index, int[][] successors) {
        this.nodes = nodes;
        this.index = index;
        this.successors = successors;
        this.components = weakComponents();
    }

    static RouteGraph of(IrModule module) {
        List<String> nodes = module.ids();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }

        int[][] successors = new int[nodes.size()][];
        int i = 0;
        for (IrFunction function : module.functions()) {
            List<Integer> targets = new ArrayList<>();
            for (String target : function.routeTargets()) {
                Integer to = index.get(target);
                if (to != null) {
                    targets.add(to);
                }
            }
            successors[i++] = targets.stream().mapToInt(Integer::intValue).toArray();
        }
        return new RouteGraph(nodes, index, successors);
    }

    int size() {
        return nodes.size();
    }

    int edgeCount() {
        int count = 0;
        for (int[] targets : successors) {
            count += targets.length;
        }
        return count;
    }

    /**
     * Weakly connected component id of a policy.
     */
    int componentOf(String policyId) {
        Integer i = index.get(policyId);
        if (i == null) {
            throw new IllegalArgumentException("Unknown policy: " + policyId);
        }
        return components[i];
    }

    /**
     * Find the first cycle in each weakly connected component.
     *
     * @param excluded Edges to ignore
     * @return Cycles as policy ids in edge order; the last one routes back to the first
     */
    List<List<String>> findCycles(Set<RouteEdge> excluded) {
        int n = nodes.size();
        int[] color = new int[n];
        boolean[] reported = new boolean[n];
        int[] stack = new int[n];
        int[] cursor = new int[n];
        List<List<String>> cycles = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (color[root] != WHITE) {
                continue;
            }
            int depth = 0;
            stack[depth++] = root;
            color[root] = GRAY;
            cursor[root] = 0;

            while (depth > 0) {
                int u = stack[depth - 1];
                if (cursor[u] < successors[u].length) {
                    int v = successors[u][cursor[u]++];
                    if (excluded.contains(new RouteEdge(nodes.get(u), nodes.get(v)))) {
                        continue;
                    }
                    if (color[v] == GRAY) {
                        int component = components[u];
                        if (!reported[component]) {
                            reported[component] = true;
                            cycles.add(cycleOnStack(stack, depth, v));
                        }
                    } else if (color[v] == WHITE) {
                        color[v] = GRAY;
                        cursor[v] = 0;
                        stack[depth++] = v;
                    }
                } else {
                    color[u] = BLACK;
                    depth--;
                }
            }
        }
        return cycles;
    }

    private List<String> cycleOnStack(int[] stack, int depth, int start) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (int i = 0; i < depth; i++) {
            if (stack[i] == start) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(nodes.get(stack[i]));
            }
        }
        return cycle;
    }

    private int[] weakComponents() {
        int n = nodes.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        for (int u = 0; u < n; u++) {
            for (int v : successors[u]) {
                int ru = find(parent, u);
                int rv = find(parent, v);
                if (ru != rv) {
                    parent[Math.max(ru, rv)] = Math.min(ru, rv);
                }
            }
        }
        int[] component = new int[n];
        for (int i = 0; i < n; i++) {
            component[i] = find(parent, i);
        }
        return component;
    }

    private static int find(int[] parent, int i) {
        int root = i;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[i] != root) {
            int next = parent[i];
            parent[i] = root;
            i = next;
        }
        return root;
    }

    /**
     * Directed routing edge.
     */
    record RouteEdge(String from, String to) {
        @Override
        public String toString() {
            return from + " -> " + to;
        }
    }
}
