package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * A name whose overload resolution is deferred (dependent code): it refers to a
 * set of candidate declarations. Member overload sets come from {@code x.f} forms.
 */
public class OverloadExpr extends Node {

    private final List<NamedDecl> candidates;
    private final boolean member;

    public OverloadExpr(SourceLocation location, List<NamedDecl> candidates, boolean member) {
        super(location);
        this.candidates = List.copyOf(candidates);
        this.member = member;
    }

    public List<NamedDecl> decls() { return candidates; }
    public boolean isMemberOverload() { return member; }

    @Override
    public List<Node> children() { return List.of(); }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseOverloadExpr(this);
    }
}
