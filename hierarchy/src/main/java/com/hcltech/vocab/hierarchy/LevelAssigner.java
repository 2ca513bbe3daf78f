package com.hcltech.vocab.hierarchy;

import java.util.*;

/**
 * Linearises a graph into {@code (node, level)} rows suitable for indented text.
 * <p>
 * Every weakly-connected component of the original graph is rendered from each of its roots (in node order):
 * a breadth-first walk of the cycle-free part decides which parent claims each node, and the claimed tree is
 * then emitted depth-first so that children follow their parent. Each broken edge is appended afterwards as a
 * two-row block {@code (parent, base)}, {@code (child, base + 1)}.
 */
public final class LevelAssigner {
    private LevelAssigner() {}

    public static <N> HierarchyRendering<N> render(HierarchyGraph<N> graph, int baseLevel) {
        CycleResolution<N> resolution = CycleResolver.resolve(graph);
        return new HierarchyRendering<>(assign(graph, resolution, baseLevel), resolution.brokenEdges());
    }

    public static <N> List<NodeLevel<N>> assign(HierarchyGraph<N> original, CycleResolution<N> resolution, int baseLevel) {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(resolution, "resolution");
        if (baseLevel < 0) throw new IllegalArgumentException("Base level must not be negative but was " + baseLevel);

        Set<Edge<N>> broken = new LinkedHashSet<>(resolution.brokenEdges());
        List<NodeLevel<N>> out = new ArrayList<>();
        for (Set<N> component : components(original)) {
            HierarchyGraph<N> clean = resolution.residual().subgraph(component).withoutEdges(broken);
            for (N node : clean.nodes()) {
                if (clean.inDegree(node) == 0) appendTree(clean, node, baseLevel, out);
            }
        }
        for (Edge<N> e : resolution.brokenEdges()) {
            out.add(new NodeLevel<>(e.from(), baseLevel));
            out.add(new NodeLevel<>(e.to(), baseLevel + 1));
        }
        return out;
    }

    /** Weakly-connected components, each started from the first unvisited node in graph order. */
    public static <N> List<Set<N>> components(HierarchyGraph<N> graph) {
        Map<N, Set<N>> adj = graph.undirectedNeighbours();
        Set<N> seen = new HashSet<>();
        List<Set<N>> components = new ArrayList<>();
        for (N start : graph.nodes()) {
            if (!seen.add(start)) continue;
            Set<N> component = new LinkedHashSet<>();
            Deque<N> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                N n = queue.poll();
                component.add(n);
                for (N nbr : adj.get(n)) if (seen.add(nbr)) queue.add(nbr);
            }
            components.add(component);
        }
        return components;
    }

    private static <N> void appendTree(HierarchyGraph<N> clean, N root, int baseLevel, List<NodeLevel<N>> out) {
        // breadth-first: first arrival claims the node
        Map<N, List<N>> claimed = new HashMap<>();
        Set<N> visited = new HashSet<>();
        visited.add(root);
        Deque<N> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            N n = queue.poll();
            List<N> children = new ArrayList<>();
            for (N s : clean.successors(n)) {
                if (visited.add(s)) {
                    children.add(s);
                    queue.add(s);
                }
            }
            claimed.put(n, children);
        }

        Deque<NodeLevel<N>> stack = new ArrayDeque<>();
        stack.push(new NodeLevel<>(root, baseLevel));
        while (!stack.isEmpty()) {
            NodeLevel<N> row = stack.pop();
            out.add(row);
            List<N> children = claimed.get(row.node());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new NodeLevel<>(children.get(i), row.level() + 1));
            }
        }
    }
}
