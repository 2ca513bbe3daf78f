package com.hcltech.vocab.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.hcltech.vocab.hierarchy.HierarchyFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TextGraphBuilder tests:
 * - nesting depth becomes parent→child edges, nodes keep first-seen order
 * - repeated labels collapse into one node but still contribute edges
 * - first line must be at the lowest level; indentation may grow by one level at a time
 */
public class TextGraphBuilderTest {

    private static HierarchyGraph<String> build(String text, String sep) {
        return TextGraphBuilder.fromLines(List.of(text.split("\n")), new IndentParser(IndentSeparator.of(sep)));
    }

    @Test
    void chain_text1() {
        var graph = build(TEXT1, " ");
        assertEquals(NODES1, graph.nodes());
        assertEquals(EDGES1, graph.edges());
    }

    @Test
    void siblings_and_returns_to_shallower_levels_text2() {
        var graph = build(TEXT2, " ");
        assertEquals(NODES2, graph.nodes());
        assertEquals(EDGES2, graph.edges());
    }

    @Test
    void redefinition_within_text_adds_edge_to_existing_node() {
        var graph = build("\na1\na2\na2\n-a1\n", "-");
        assertEquals(List.of("a1", "a2"), graph.nodes());
        assertEquals(List.of(edge("a2>a1")), List.copyOf(graph.edges()));
    }

    @Test
    void label_indented_under_two_parents_has_two_parents() {
        var graph = build("p1\n-shared\np2\n-shared", "-");
        assertEquals(List.of("p1", "shared", "p2"), graph.nodes());
        assertEquals(Set.of("p1", "p2"), graph.predecessors("shared"));
    }

    @Test
    void empty_text_is_empty_graph() {
        var graph = build("", "x");
        assertTrue(graph.nodes().isEmpty());
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void blank_lines_are_ignored() {
        var graph = build("\n  \na\n\n b\n\t\n", " ");
        assertEquals(List.of("a", "b"), graph.nodes());
        assertEquals(Set.of(edge("a>b")), graph.edges());
    }

    @Test
    void one_node() {
        assertEquals(List.of("n1"), build("n1", " ").nodes());
    }

    @Test
    void no_separator_gives_flat_list() {
        var graph = TextGraphBuilder.fromLines(List.of("n1", "  n2"), new IndentParser(IndentSeparator.NONE));
        assertEquals(List.of("n1", "n2"), graph.nodes());
        assertTrue(graph.edges().isEmpty());
    }

    @Test
    void first_line_not_at_base_level_is_error() {
        var ex = assertThrows(StructuralException.class, () -> build(" x1\nx2", " "));
        assertEquals(StructuralException.Kind.FIRST_LINE_NOT_AT_BASE_LEVEL, ex.kind());
        assertEquals("x1", ex.label());
        assertEquals("First line \"x1\" must be at lowest indentation level.", ex.getMessage());
    }

    @Test
    void indentation_jump_is_error() {
        var ex = assertThrows(StructuralException.class, () -> build("x1\n--x2", "-"));
        assertEquals(StructuralException.Kind.INDENTATION_JUMP, ex.kind());
        assertEquals("x2", ex.label());
        assertEquals("Indentation increases by more than one level for \"x2\".", ex.getMessage());
    }

    @Test
    void jump_later_in_text_names_offending_label() {
        var ex = assertThrows(StructuralException.class, () -> build("a\n-b\n--c\n-d\n---e", "-"));
        assertEquals("e", ex.label());
    }

    @Test
    void prelevelled_lines_use_their_minimum_as_base_level() {
        var graph = TextGraphBuilder.fromIndentedLines(List.of(
                row("root", 2), row("child", 3), row("grandchild", 4), row("second", 2), row("child2", 3)));
        assertEquals(set(edge("root>child"), edge("child>grandchild"), edge("second>child2")), graph.edges());
    }

    @Test
    void deep_dedent_closes_all_deeper_levels() {
        var graph = build("a\n-b\n--c\n---d\n-e\n--f", "-");
        assertEquals(set(edge("a>b"), edge("b>c"), edge("c>d"), edge("a>e"), edge("e>f")), graph.edges());
    }

    @Test
    void incomplete_separator_still_builds() {
        SeparatorWarningListener ignore = w -> {};
        var graph = TextGraphBuilder.fromLines(List.of("n1", "--n2", "---n3"),
                new IndentParser(IndentSeparator.of("--"), ignore));
        assertEquals(List.of("n1", "n2", "-n3"), graph.nodes());
        assertEquals(set(edge("n1>n2"), edge("n1>-n3")), graph.edges());
    }
}
