package com.hcltech.vocab.hierarchy;

import java.util.*;

/**
 * Builds a graph from indented text, where nesting depth encodes parent/child relations.
 * <p>
 * Each line becomes a child of the closest preceding line one level up. A label repeated elsewhere in the text
 * is the same node, so re-indenting it under another parent gives it a second parent.
 */
public final class TextGraphBuilder {
    private TextGraphBuilder() {}

    /** Parses every non-blank line with {@code parser}, then builds as {@link #fromIndentedLines(List)}. */
    public static HierarchyGraph<String> fromLines(List<String> lines, IndentParser parser) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(parser, "parser");
        List<NodeLevel<String>> parsed = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) continue;
            parsed.add(parser.parse(line));
        }
        return fromIndentedLines(parsed);
    }

    /**
     * Builds from labels whose level is already known (for example a spreadsheet cell's indent).
     *
     * @throws StructuralException if the first line is not at the lowest level, or a line is more than one level
     *                             deeper than the line before it
     */
    public static HierarchyGraph<String> fromIndentedLines(List<NodeLevel<String>> lines) {
        Objects.requireNonNull(lines, "lines");
        if (lines.isEmpty()) return HierarchyGraph.empty();

        int baseLevel = Integer.MAX_VALUE;
        Set<String> nodes = new LinkedHashSet<>();
        for (NodeLevel<String> line : lines) {
            baseLevel = Math.min(baseLevel, line.level());
            nodes.add(line.node());
        }
        validate(lines, baseLevel);
        return new HierarchyGraph<>(nodes, edges(lines, baseLevel));
    }

    private static void validate(List<NodeLevel<String>> lines, int baseLevel) {
        NodeLevel<String> first = lines.get(0);
        if (first.level() != baseLevel) throw StructuralException.firstLineNotAtBaseLevel(first.node());
        for (int i = 1; i < lines.size(); i++) {
            NodeLevel<String> line = lines.get(i);
            if (line.level() > lines.get(i - 1).level() + 1) throw StructuralException.indentationJump(line.node());
        }
    }

    // Holder of each open level: the most recent label seen at that level.
    private static List<Edge<String>> edges(List<NodeLevel<String>> lines, int baseLevel) {
        List<Edge<String>> edges = new ArrayList<>();
        NavigableMap<Integer, String> holders = new TreeMap<>();
        for (NodeLevel<String> line : lines) {
            int level = line.level();
            if (!holders.isEmpty() && level <= holders.lastKey()) {
                holders.tailMap(level, false).clear(); // deeper levels are closed
            }
            holders.put(level, line.node());
            if (level > baseLevel) edges.add(new Edge<>(holders.get(level - 1), line.node()));
        }
        return edges;
    }
}
