package com.hcltech.vocab.hierarchy;

import java.util.*;

/**
 * Cycle basis of a graph's undirected view (spanning-tree method).
 * <p>
 * Each connected component is walked depth-first from its most recently added node; every non-tree link closes one
 * elementary cycle, reported as the list of its nodes. Self-loops are one-node cycles. A mutual pair
 * {@code a→b, b→a} is a single undirected link and never forms a cycle.
 */
public final class CycleBasis {
    private CycleBasis() {}

    public static <N> List<List<N>> of(HierarchyGraph<N> graph) {
        Map<N, Set<N>> adj = graph.undirectedNeighbours();
        Set<N> remaining = new LinkedHashSet<>(adj.keySet());
        List<List<N>> cycles = new ArrayList<>();

        while (!remaining.isEmpty()) {
            N root = last(remaining);
            Deque<N> stack = new ArrayDeque<>();
            stack.push(root);
            Map<N, N> pred = new HashMap<>();
            pred.put(root, root);
            Map<N, Set<N>> used = new HashMap<>();
            used.put(root, new HashSet<>());

            while (!stack.isEmpty()) {
                N z = stack.pop();
                Set<N> zUsed = used.get(z);
                for (N nbr : adj.get(z)) {
                    if (!used.containsKey(nbr)) {
                        pred.put(nbr, z);
                        stack.push(nbr);
                        used.put(nbr, new HashSet<>(Set.of(z)));
                    } else if (nbr.equals(z)) {
                        cycles.add(List.of(z));
                    } else if (!zUsed.contains(nbr)) {
                        Set<N> nbrUsed = used.get(nbr);
                        List<N> cycle = new ArrayList<>();
                        cycle.add(nbr);
                        cycle.add(z);
                        N p = pred.get(z);
                        while (!nbrUsed.contains(p)) {
                            cycle.add(p);
                            p = pred.get(p);
                        }
                        cycle.add(p);
                        cycles.add(List.copyOf(cycle));
                        nbrUsed.add(z);
                    }
                }
            }
            remaining.removeAll(pred.keySet());
        }
        return cycles;
    }

    public static <N> boolean hasCycle(HierarchyGraph<N> graph) {
        return !of(graph).isEmpty();
    }

    private static <N> N last(Set<N> ordered) {
        N last = null;
        for (N n : ordered) last = n;
        return last;
    }
}
