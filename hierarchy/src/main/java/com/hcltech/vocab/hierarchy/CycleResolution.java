package com.hcltech.vocab.hierarchy;

import java.util.List;
import java.util.Objects;

/**
 * Result of breaking cycles: the residual graph has no cycle in its undirected view (apart from mutual pairs),
 * and {@code brokenEdges} lists the removed edges in removal order, each in its original direction.
 */
public record CycleResolution<N>(HierarchyGraph<N> residual, List<Edge<N>> brokenEdges) {
    public CycleResolution {
        Objects.requireNonNull(residual, "residual");
        brokenEdges = List.copyOf(brokenEdges);
    }

    public boolean hadCycles() {
        return !brokenEdges.isEmpty();
    }
}
