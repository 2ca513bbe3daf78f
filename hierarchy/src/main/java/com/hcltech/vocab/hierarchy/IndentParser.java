package com.hcltech.vocab.hierarchy;

import java.util.Objects;

/**
 * Turns one line of indented text into a label and a level.
 * <p>
 * The line is right-trimmed, then every leading repetition of the separator counts as one level and the rest is
 * the label. Without a separator the whole trimmed line is the label at level 0.
 */
public final class IndentParser {
    private final IndentSeparator separator;
    private final SeparatorWarningListener warnings;

    public IndentParser(IndentSeparator separator, SeparatorWarningListener warnings) {
        this.separator = Objects.requireNonNull(separator, "separator");
        this.warnings = Objects.requireNonNull(warnings, "warnings");
    }

    public IndentParser(IndentSeparator separator) {
        this(separator, SeparatorWarningListener.LOGGING);
    }

    public IndentSeparator separator() {
        return separator;
    }

    public NodeLevel<String> parse(String line) {
        Objects.requireNonNull(line, "line");
        if (separator.isNone()) return new NodeLevel<>(line.strip(), 0);

        String unit = separator.unit();
        String rest = line.stripTrailing();
        int level = 0;
        while (rest.startsWith(unit)) {
            rest = rest.substring(unit.length());
            level++;
        }
        if (unit.length() > 1 && rest.startsWith(unit.substring(0, 1))) {
            warnings.onWarning(new SeparatorAmbiguityWarning(rest, unit));
        }
        return new NodeLevel<>(rest, level);
    }
}
