package com.hcltech.vocab.hierarchy;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

import static com.hcltech.vocab.hierarchy.HierarchyFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class SerializersTest {

    @Test
    void indented_text_repeats_separator_per_level() {
        var rows = List.of(row("a1", 0), row("b1", 1), row("c1", 2), row("L1", 3));
        assertEquals(List.of("a1", "..b1", "....c1", "......L1"),
                IndentedTextSerializer.toLines(rows, IndentSeparator.of("..")));
    }

    @Test
    void indented_text_without_separator_is_flat() {
        assertEquals(List.of("a", "b"), IndentedTextSerializer.toLines(List.of(row("a", 0), row("b", 0)), IndentSeparator.NONE));
    }

    @Test
    void nested_rows_without_separator_are_rejected() {
        var rows = List.of(row("a", 0), row("b", 1));
        var ex = assertThrows(IllegalArgumentException.class,
                () -> IndentedTextSerializer.toLines(rows, IndentSeparator.NONE));
        assertEquals("Cannot write \"b\" at level 1 without a separator", ex.getMessage());
    }

    @Test
    void narrower_lists_are_sorted_and_cover_every_node() {
        var g = graph(List.of("p", "z", "a", "m"), "p>z", "p>a", "p>m");
        assertEquals(relations(rel("p", "a", "m", "z"), rel("z"), rel("a"), rel("m")), RelationSerializer.toNarrower(g));
        assertEquals(List.of("p", "z", "a", "m"), List.copyOf(RelationSerializer.toNarrower(g).keySet()));
    }

    @Test
    void narrower_reflects_cycles_as_given() {
        var g = RelationGraphBuilder.fromRelations(TRIANGLE_WITH_TAIL);
        assertEquals(TRIANGLE_WITH_TAIL, RelationSerializer.toNarrower(g));
    }

    @Test
    void broader_is_the_inverse_relation() {
        var g = RelationGraphBuilder.fromRelations(DIAMOND);
        assertEquals(relations(rel("ex:1"), rel("ex:2", "ex:1"), rel("ex:3", "ex:1"), rel("ex:4", "ex:2", "ex:3")),
                RelationSerializer.toBroader(g));
    }

    @Test
    void custom_order() {
        var g = graph(List.of("p", "a", "b"), "p>a", "p>b");
        Map<String, List<String>> narrower = RelationSerializer.toNarrower(g, Comparator.reverseOrder());
        assertEquals(List.of("b", "a"), narrower.get("p"));
    }

    @Test
    void relations_roundtrip_up_to_sorted_children() {
        var unsorted = relations(rel("a2", "b2", "L2", "b1", "L1"), rel("b2"), rel("L2"), rel("b1"), rel("L1"));
        var back = RelationSerializer.toNarrower(RelationGraphBuilder.fromRelations(unsorted));
        assertEquals(List.copyOf(unsorted.keySet()), List.copyOf(back.keySet()));
        assertEquals(List.of("L1", "L2", "b1", "b2"), back.get("a2"));
    }
}
