package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * {@code using ns::name;} introducing one shadow for each declaration it names.
 */
public class UsingDecl extends NamedDecl {

    private final List<NamedDecl> shadowTargets;

    private UsingDecl(Builder builder, List<NamedDecl> shadowTargets) {
        super(builder);
        this.shadowTargets = List.copyOf(shadowTargets);
    }

    public static UsingDecl of(String name, SourceLocation location, List<NamedDecl> shadowTargets) {
        return new UsingDecl(NamedDecl.builder(DeclKind.USING, name).at(location), shadowTargets);
    }

    /** The declarations introduced by this using-declaration. */
    public List<NamedDecl> getShadowTargets() { return shadowTargets; }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseUsingDecl(this);
    }
}
