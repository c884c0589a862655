package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/** A type as written in source, starting at {@link #getLocation()}. */
public class TypeLoc extends Node {

    private final Type type;

    public TypeLoc(SourceLocation beginLocation, Type type) {
        super(beginLocation);
        this.type = type;
    }

    public Type getType() { return type; }

    @Override
    public List<Node> children() { return List.of(); }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseTypeLoc(this);
    }
}
