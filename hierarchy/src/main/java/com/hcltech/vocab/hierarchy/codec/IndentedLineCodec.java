package com.hcltech.vocab.hierarchy.codec;

import com.hcltech.vocab.common.codec.Codec;
import com.hcltech.vocab.common.errorsor.ErrorsOr;
import com.hcltech.vocab.hierarchy.IndentParser;
import com.hcltech.vocab.hierarchy.IndentedTextSerializer;
import com.hcltech.vocab.hierarchy.NodeLevel;

import java.util.List;
import java.util.Objects;

/** A single line of indented text ↔ {@code (label, level)}. */
public final class IndentedLineCodec implements Codec<NodeLevel<String>, String> {
    private final IndentParser parser;

    public IndentedLineCodec(IndentParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /** Whole texts: one row per non-blank line. */
    public static Codec<List<NodeLevel<String>>, String> text(IndentParser parser) {
        return Codec.lines(new IndentedLineCodec(parser));
    }

    @Override
    public ErrorsOr<String> encode(NodeLevel<String> row) {
        return ErrorsOr.trying(() -> IndentedTextSerializer.toLine(row, parser.separator()));
    }

    @Override
    public ErrorsOr<NodeLevel<String>> decode(String line) {
        return ErrorsOr.lift(parser.parse(line));
    }
}
