package com.keywatch.shared.model;

import java.util.Locale;

/**
 * A monitored pattern. Patterns that look like regular expressions are compiled as such,
 * anything else is matched literally.
 */
public record Keyword(String pattern) {

    public Keyword {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Keyword pattern must not be blank");
        }
        pattern = pattern.strip();
    }

    public boolean isRegex() {
        return pattern.startsWith("(?") || pattern.contains("(") || pattern.contains("[");
    }

    /** Uniqueness ignores case even for case-sensitive patterns. */
    public boolean sameAs(Keyword other) {
        return other != null && normalized().equals(other.normalized());
    }

    public boolean sameAs(String literal) {
        return literal != null && normalized().equals(literal.strip().toLowerCase(Locale.ROOT));
    }

    private String normalized() {
        return pattern.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
