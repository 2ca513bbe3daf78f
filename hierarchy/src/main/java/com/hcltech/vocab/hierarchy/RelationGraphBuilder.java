package com.hcltech.vocab.hierarchy;

import java.util.*;

/** Builds a graph from a mapping concept → ordered narrower concepts. Node order is the mapping's key order. */
public final class RelationGraphBuilder {
    private RelationGraphBuilder() {}

    /**
     * @throws StructuralException naming the first child that is not a key of the mapping
     */
    public static <N> HierarchyGraph<N> fromRelations(Map<N, ? extends Collection<N>> relations) {
        Objects.requireNonNull(relations, "relations");
        List<Edge<N>> edges = new ArrayList<>();
        for (var en : relations.entrySet()) {
            for (N child : RelationValidation.childrenOf(en.getValue())) {
                if (!relations.containsKey(child)) throw StructuralException.undefinedChild(String.valueOf(child));
                edges.add(new Edge<>(en.getKey(), child));
            }
        }
        return new HierarchyGraph<>(relations.keySet(), edges);
    }
}
