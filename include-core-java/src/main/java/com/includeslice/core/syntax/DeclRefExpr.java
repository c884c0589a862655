package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/** A name that refers to a declaration, e.g. {@code foo} in {@code foo(1)}. */
public class DeclRefExpr extends Node {

    private final NamedDecl decl;

    public DeclRefExpr(SourceLocation location, NamedDecl decl) {
        super(location);
        this.decl = decl;
    }

    /** The declaration found by name lookup (may be a using-shadow). */
    public NamedDecl getFoundDecl() { return decl; }

    @Override
    public List<Node> children() { return List.of(); }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseDeclRefExpr(this);
    }
}
