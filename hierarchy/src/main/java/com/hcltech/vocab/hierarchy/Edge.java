package com.hcltech.vocab.hierarchy;

import java.util.Objects;

/** Directed parent→child ("broader→narrower") relation. */
public record Edge<N>(N from, N to) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public Edge<N> reversed() {
        return new Edge<>(to, from);
    }

    @Override
    public String toString() {
        return "(" + from + " -> " + to + ")";
    }
}
