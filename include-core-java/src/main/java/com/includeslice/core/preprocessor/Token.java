package com.includeslice.core.preprocessor;

import com.includeslice.core.source.SourceLocation;

/**
 * A preprocessing token. {@code identifier} is false for punctuation and literals.
 */
public record Token(String spelling, SourceLocation location, boolean identifier) {

    public static Token identifier(String name, SourceLocation location) {
        return new Token(name, location, true);
    }

    public static Token punctuation(String spelling, SourceLocation location) {
        return new Token(spelling, location, false);
    }
}
