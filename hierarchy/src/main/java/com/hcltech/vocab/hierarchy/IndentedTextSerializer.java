package com.hcltech.vocab.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class IndentedTextSerializer {
    private IndentedTextSerializer() {}

    /** One line per row: {@code level} copies of the separator followed by the label. */
    public static List<String> toLines(List<NodeLevel<String>> levels, IndentSeparator separator) {
        Objects.requireNonNull(levels, "levels");
        Objects.requireNonNull(separator, "separator");
        List<String> out = new ArrayList<>(levels.size());
        for (NodeLevel<String> row : levels) out.add(toLine(row, separator));
        return out;
    }

    /** @throws IllegalArgumentException if the row is nested and the separator is {@link IndentSeparator#NONE} */
    public static String toLine(NodeLevel<String> row, IndentSeparator separator) {
        if (separator.isNone() && row.level() > 0) {
            throw new IllegalArgumentException(
                    "Cannot write \"" + row.node() + "\" at level " + row.level() + " without a separator");
        }
        return separator.indent(row.level()) + row.node();
    }
}
