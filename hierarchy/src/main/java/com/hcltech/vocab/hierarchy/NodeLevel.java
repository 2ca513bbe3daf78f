package com.hcltech.vocab.hierarchy;

import java.util.Objects;

/** One row of an indented rendering: a node and its nesting depth. */
public record NodeLevel<N>(N node, int level) {
    public NodeLevel {
        Objects.requireNonNull(node, "node");
        if (level < 0) throw new IllegalArgumentException("Level must not be negative but was " + level + " for " + node);
    }
}
