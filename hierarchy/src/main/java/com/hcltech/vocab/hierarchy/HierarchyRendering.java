package com.hcltech.vocab.hierarchy;

import java.util.List;

/** Immutable result you can display or inspect: the level rows and the edges that had to be re-emitted. */
public record HierarchyRendering<N>(List<NodeLevel<N>> levels, List<Edge<N>> brokenEdges) {
    public HierarchyRendering {
        levels = List.copyOf(levels);
        brokenEdges = List.copyOf(brokenEdges);
    }
}
