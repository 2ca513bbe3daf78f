package com.hcltech.vocab.hierarchy;

import java.util.*;

/**
 * Renders a graph as relation mappings. The graph is taken as given: cycles are not broken here.
 */
public final class RelationSerializer {
    private RelationSerializer() {}

    /** Each node (graph order) → its sorted direct successors. */
    public static <N extends Comparable<? super N>> Map<N, List<N>> toNarrower(HierarchyGraph<N> graph) {
        return toNarrower(graph, Comparator.naturalOrder());
    }

    public static <N> Map<N, List<N>> toNarrower(HierarchyGraph<N> graph, Comparator<? super N> order) {
        Map<N, List<N>> out = new LinkedHashMap<>();
        for (N node : graph.nodes()) out.put(node, sorted(graph.successors(node), order));
        return out;
    }

    /** Each node (graph order) → its sorted direct predecessors. */
    public static <N extends Comparable<? super N>> Map<N, List<N>> toBroader(HierarchyGraph<N> graph) {
        return toBroader(graph, Comparator.naturalOrder());
    }

    public static <N> Map<N, List<N>> toBroader(HierarchyGraph<N> graph, Comparator<? super N> order) {
        Map<N, List<N>> out = new LinkedHashMap<>();
        for (N node : graph.nodes()) out.put(node, sorted(graph.predecessors(node), order));
        return out;
    }

    private static <N> List<N> sorted(Collection<N> nodes, Comparator<? super N> order) {
        List<N> list = new ArrayList<>(nodes);
        list.sort(order);
        return List.copyOf(list);
    }
}
