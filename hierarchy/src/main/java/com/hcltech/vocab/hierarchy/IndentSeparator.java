package com.hcltech.vocab.hierarchy;

import com.hcltech.vocab.config.HierarchyConfig;

/**
 * The indent unit of a text hierarchy. {@link #NONE} means lines carry no nesting: every line is level 0.
 */
public record IndentSeparator(String unit) {
    public static final IndentSeparator NONE = new IndentSeparator(null);

    public IndentSeparator {
        if (unit != null && unit.isEmpty()) {
            throw new IllegalArgumentException("Setting the indent separator to zero length is not allowed.");
        }
    }

    public static IndentSeparator of(String unit) {
        return unit == null ? NONE : new IndentSeparator(unit);
    }

    public static IndentSeparator from(HierarchyConfig config) {
        return of(config.separator());
    }

    public boolean isNone() {
        return unit == null;
    }

    /**
     * {@code level} copies of the unit.
     *
     * @throws IllegalArgumentException for a level above 0 with {@link #NONE}, which cannot express nesting
     */
    public String indent(int level) {
        if (!isNone()) return unit.repeat(level);
        if (level > 0) throw new IllegalArgumentException("Cannot indent to level " + level + " without a separator");
        return "";
    }

    @Override
    public String toString() {
        return isNone() ? "IndentSeparator[none]" : "IndentSeparator[\"" + unit + "\"]";
    }
}
