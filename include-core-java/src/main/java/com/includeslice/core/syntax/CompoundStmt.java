package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/** A block of statements, or any grouping node with no meaning of its own. */
public class CompoundStmt extends Node {

    private final List<Node> body;

    public CompoundStmt(SourceLocation location, List<Node> body) {
        super(location);
        this.body = List.copyOf(body);
    }

    @Override
    public List<Node> children() { return body; }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseCompoundStmt(this);
    }
}
