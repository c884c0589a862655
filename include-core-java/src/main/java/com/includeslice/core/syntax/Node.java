package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * A node of the syntax tree handed over by the front end.
 * Nodes are owned by the front end; analysis code only holds references to them.
 */
public abstract class Node {

    private final SourceLocation location;

    protected Node(SourceLocation location) {
        this.location = Objects.requireNonNull(location, "location");
    }

    public SourceLocation getLocation() { return location; }

    /** Lexically nested nodes, in source order. */
    public abstract List<Node> children();

    /** Dispatches to the matching {@code traverse*} method of the visitor. */
    protected abstract boolean accept(SyntaxVisitor visitor);
}
