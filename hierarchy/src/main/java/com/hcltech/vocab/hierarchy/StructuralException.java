package com.hcltech.vocab.hierarchy;

import java.util.Objects;

/** Fatal violation of hierarchy structure. No partial graph is produced when this is thrown. */
public final class StructuralException extends IllegalArgumentException {

    public enum Kind {
        FIRST_LINE_NOT_AT_BASE_LEVEL,
        INDENTATION_JUMP,
        UNDEFINED_CHILD
    }

    private final Kind kind;
    private final String label;

    public StructuralException(Kind kind, String label, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = Objects.requireNonNull(label, "label");
    }

    static StructuralException firstLineNotAtBaseLevel(String label) {
        return new StructuralException(Kind.FIRST_LINE_NOT_AT_BASE_LEVEL, label,
                "First line \"" + label + "\" must be at lowest indentation level.");
    }

    static StructuralException indentationJump(String label) {
        return new StructuralException(Kind.INDENTATION_JUMP, label,
                "Indentation increases by more than one level for \"" + label + "\".");
    }

    static StructuralException undefinedChild(String label) {
        return new StructuralException(Kind.UNDEFINED_CHILD, label,
                "Concept \"" + label + "\" needs to defined if used as narrower concept.");
    }

    public Kind kind() {
        return kind;
    }

    /** The offending label. */
    public String label() {
        return label;
    }
}
