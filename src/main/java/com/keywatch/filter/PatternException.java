package com.keywatch.filter;

public class PatternException extends Exception {

    private final String pattern;

    public PatternException(String pattern, String message, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    public String pattern() {
        return pattern;
    }
}
