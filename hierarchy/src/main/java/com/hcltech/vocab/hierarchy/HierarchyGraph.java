package com.hcltech.vocab.hierarchy;

import java.util.*;

/**
 * Immutable directed graph of concepts: ordered unique nodes plus (parent→child) edges.
 * <p>
 * Nodes keep first-seen order and each node's successors keep edge insertion order. That order is the
 * canonical edge enumeration every algorithm in this package relies on for reproducible output.
 * Cycles, multiple parents and isolated nodes are all allowed.
 */
public final class HierarchyGraph<N> {
    private final List<N> nodes;
    private final Set<Edge<N>> edges;
    private final Map<N, Set<N>> successors;
    private final Map<N, Set<N>> predecessors;

    public HierarchyGraph(Collection<N> nodes, Collection<Edge<N>> edges) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        Map<N, Set<N>> succ = new LinkedHashMap<>();
        Map<N, Set<N>> pred = new LinkedHashMap<>();
        for (N n : nodes) {
            Objects.requireNonNull(n, "node");
            succ.putIfAbsent(n, new LinkedHashSet<>());
            pred.putIfAbsent(n, new LinkedHashSet<>());
        }
        Set<Edge<N>> edgeSet = new LinkedHashSet<>();
        for (Edge<N> e : edges) {
            if (!succ.containsKey(e.from()) || !succ.containsKey(e.to())) {
                throw new IllegalArgumentException("Edge " + e + " references a node that is not part of the graph");
            }
            if (edgeSet.add(e)) {
                succ.get(e.from()).add(e.to());
                pred.get(e.to()).add(e.from());
            }
        }
        this.nodes = List.copyOf(succ.keySet());
        this.edges = Collections.unmodifiableSet(edgeSet);
        this.successors = succ;
        this.predecessors = pred;
    }

    public static <N> HierarchyGraph<N> empty() {
        return new HierarchyGraph<>(List.of(), List.of());
    }

    public List<N> nodes() {
        return nodes;
    }

    /** Edges in insertion order. */
    public Set<Edge<N>> edges() {
        return edges;
    }

    /** Edges grouped by source node (node order), then by successor insertion order. */
    public List<Edge<N>> orderedEdges() {
        List<Edge<N>> out = new ArrayList<>(edges.size());
        for (var en : successors.entrySet()) {
            for (N to : en.getValue()) out.add(new Edge<>(en.getKey(), to));
        }
        return out;
    }

    public boolean hasEdge(N from, N to) {
        Set<N> s = successors.get(from);
        return s != null && s.contains(to);
    }

    public Set<N> successors(N node) {
        return Collections.unmodifiableSet(successors.getOrDefault(node, Set.of()));
    }

    public Set<N> predecessors(N node) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(node, Set.of()));
    }

    public int outDegree(N node) {
        return successors.getOrDefault(node, Set.of()).size();
    }

    public int inDegree(N node) {
        return predecessors.getOrDefault(node, Set.of()).size();
    }

    /**
     * Undirected view: for each node, every node joined to it by an edge in either direction. Neighbours are
     * added while walking {@link #orderedEdges()}, so a mutual pair {@code a→b, b→a} becomes a single link.
     */
    public Map<N, Set<N>> undirectedNeighbours() {
        Map<N, Set<N>> adj = new LinkedHashMap<>();
        for (N n : nodes) adj.put(n, new LinkedHashSet<>());
        for (Edge<N> e : orderedEdges()) {
            adj.get(e.from()).add(e.to());
            adj.get(e.to()).add(e.from());
        }
        return adj;
    }

    /** Nodes in {@code keep} (in this graph's order) and the edges among them. */
    public HierarchyGraph<N> subgraph(Collection<N> keep) {
        Set<N> keepSet = keep instanceof Set<N> s ? s : new HashSet<>(keep);
        List<N> kept = new ArrayList<>();
        for (N n : nodes) if (keepSet.contains(n)) kept.add(n);
        List<Edge<N>> keptEdges = new ArrayList<>();
        for (Edge<N> e : edges) {
            if (keepSet.contains(e.from()) && keepSet.contains(e.to())) keptEdges.add(e);
        }
        return new HierarchyGraph<>(kept, keptEdges);
    }

    public HierarchyGraph<N> withoutEdges(Collection<Edge<N>> removed) {
        if (removed.isEmpty()) return this;
        Set<Edge<N>> removedSet = removed instanceof Set<Edge<N>> s ? s : new HashSet<>(removed);
        List<Edge<N>> kept = new ArrayList<>(edges.size());
        for (Edge<N> e : edges) if (!removedSet.contains(e)) kept.add(e);
        return new HierarchyGraph<>(nodes, kept);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HierarchyGraph<?> other && nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "HierarchyGraph[nodes=" + nodes + ", edges=" + edges + "]";
    }
}
