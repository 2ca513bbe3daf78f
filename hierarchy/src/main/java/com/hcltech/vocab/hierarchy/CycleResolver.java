package com.hcltech.vocab.hierarchy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Deterministically removes edges until no cycle remains in the graph's undirected view.
 * <p>
 * For the first cycle of the current basis, every edge between two of its members is a candidate; the one
 * maximising {@code outDegree(to) - outDegree(from)} in the current graph is removed, the first in
 * {@link HierarchyGraph#orderedEdges()} winning ties. Each round removes one edge, so the loop terminates.
 */
public final class CycleResolver {
    private static final Logger log = LoggerFactory.getLogger(CycleResolver.class);

    private CycleResolver() {}

    public static <N> CycleResolution<N> resolve(HierarchyGraph<N> graph) {
        Objects.requireNonNull(graph, "graph");
        HierarchyGraph<N> current = graph;
        List<Edge<N>> broken = new ArrayList<>();

        List<List<N>> cycles = CycleBasis.of(current);
        while (!cycles.isEmpty()) {
            List<N> cycle = cycles.get(0);
            Edge<N> edge = edgeToBreak(current, cycle);
            current = current.withoutEdges(List.of(edge));
            Edge<N> original = graph.hasEdge(edge.from(), edge.to()) ? edge : edge.reversed();
            broken.add(original);
            log.debug("Broke cycle {} at edge {}", cycle, original);
            cycles = CycleBasis.of(current);
        }
        if (!broken.isEmpty()) {
            log.info("Removed {} edge(s) to make {} node(s) acyclic: {}", broken.size(), graph.nodes().size(), broken);
        }
        return new CycleResolution<>(current, broken);
    }

    static <N> Edge<N> edgeToBreak(HierarchyGraph<N> graph, Collection<N> cycle) {
        Set<N> members = new HashSet<>(cycle);
        Edge<N> best = null;
        int bestDiff = Integer.MIN_VALUE;
        for (Edge<N> e : graph.orderedEdges()) {
            if (!members.contains(e.from()) || !members.contains(e.to())) continue;
            int diff = graph.outDegree(e.to()) - graph.outDegree(e.from());
            if (best == null || diff > bestDiff) {
                best = e;
                bestDiff = diff;
            }
        }
        if (best == null) throw new IllegalStateException("No edge found among cycle members " + cycle);
        return best;
    }
}
