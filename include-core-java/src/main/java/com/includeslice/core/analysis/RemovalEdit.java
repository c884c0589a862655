package com.includeslice.core.analysis;

/**
 * Deletes whole lines: from the start of {@code startLine} to the start of {@code endLine}.
 * Lines are 1-based.
 */
public record RemovalEdit(int startLine, int endLine) {

    public static RemovalEdit forInclude(Include include) {
        return new RemovalEdit(include.line(), include.line() + 1);
    }
}
