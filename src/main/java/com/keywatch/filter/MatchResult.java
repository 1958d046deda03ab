package com.keywatch.filter;

import java.util.List;

/** Matched keyword labels in keyword-list order. */
public record MatchResult(List<String> keywords) {

    public MatchResult {
        keywords = keywords.stream().distinct().toList();
    }

    public static MatchResult none() {
        return new MatchResult(List.of());
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }

    public String joined() {
        return String.join(", ", keywords);
    }
}
