package com.hcltech.vocab.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for reading and writing indented hierarchies.
 *
 * @param separator the indent unit, or {@code null} when lines carry no nesting (every line is level 0)
 * @param baseLevel the level given to root concepts when rendering
 */
public record HierarchyConfig(
        @JsonProperty("separator") String separator,
        @JsonProperty("baseLevel") int baseLevel
) {
    public static final String DEFAULT_SEPARATOR = " ";

    public static HierarchyConfig defaults() {
        return new HierarchyConfig(DEFAULT_SEPARATOR, 0);
    }

    public static HierarchyConfig withoutNesting() {
        return new HierarchyConfig(null, 0);
    }

    public boolean hasSeparator() {
        return separator != null;
    }

    public HierarchyConfig withSeparator(String newSeparator) {
        return new HierarchyConfig(newSeparator, baseLevel);
    }

    public HierarchyConfig withBaseLevel(int newBaseLevel) {
        return new HierarchyConfig(separator, newBaseLevel);
    }
}
