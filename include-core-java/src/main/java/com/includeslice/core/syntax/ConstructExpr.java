package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * Construction of an object of {@code type}, explicit or implicit
 * (e.g. {@code Foo x;} or the conversion in {@code takesFoo({1, 2})}).
 * The constructed type is not a child: it is only reached when construction counts as a use.
 */
public class ConstructExpr extends Node {

    private final Type type;
    private final List<Node> args;

    public ConstructExpr(SourceLocation location, Type type, List<Node> args) {
        super(location);
        this.type = type;
        this.args = List.copyOf(args);
    }

    public Type getType() { return type; }

    @Override
    public List<Node> children() { return args; }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseConstructExpr(this);
    }
}
