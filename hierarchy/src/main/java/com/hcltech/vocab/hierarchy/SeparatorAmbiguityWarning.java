package com.hcltech.vocab.hierarchy;

/**
 * A parsed label still starts with the first character of a multi-character separator, which usually means
 * the indentation of that line was miscounted. Non-fatal.
 */
public record SeparatorAmbiguityWarning(String label, String separator) {
    public String message() {
        return "Line \"" + label + "\": Incomplete separator \"" + separator + "\"?";
    }
}
