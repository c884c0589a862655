package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/** {@code base.member} or {@code base->member}. The location is that of the member name. */
public class MemberExpr extends Node {

    private final NamedDecl member;
    private final Node base;

    public MemberExpr(SourceLocation memberLocation, NamedDecl member, Node base) {
        super(memberLocation);
        this.member = member;
        this.base = base;
    }

    public NamedDecl getFoundDecl() { return member; }
    public Node getBase()           { return base; }

    @Override
    public List<Node> children() {
        return base == null ? List.of() : List.of(base);
    }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseMemberExpr(this);
    }
}
