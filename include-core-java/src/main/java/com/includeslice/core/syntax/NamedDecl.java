package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A declaration with a name. Redeclarations of one entity share a chain whose
 * first element is the canonical declaration.
 *
 * Identity is object identity: two NamedDecl objects are the same entity only if
 * they have the same canonical declaration.
 */
public class NamedDecl extends Node {

    private final DeclKind kind;
    private final String name;
    private final String qualifiedName;
    private final boolean definition;
    private final FriendKind friendKind;
    private final TemplateSpecializationKind specializationKind;
    private final boolean overloadedOperator;
    private final List<NamedDecl> redecls;
    private final List<Node> children = new ArrayList<>();

    protected NamedDecl(Builder builder) {
        super(builder.location);
        this.kind = builder.kind;
        this.name = builder.name;
        this.qualifiedName = builder.qualifiedName != null ? builder.qualifiedName : builder.name;
        this.definition = builder.definition;
        this.friendKind = builder.friendKind;
        this.specializationKind = builder.specializationKind;
        this.overloadedOperator = builder.overloadedOperator;
        if (builder.previous != null) {
            if (builder.previous.kind != builder.kind) {
                throw new IllegalArgumentException("Redeclaration of " + builder.previous.qualifiedName
                    + " changes kind from " + builder.previous.kind + " to " + builder.kind);
            }
            this.redecls = builder.previous.redecls;
        } else {
            this.redecls = new ArrayList<>();
        }
        this.redecls.add(this);
    }

    public static Builder builder(DeclKind kind, String name) {
        return new Builder(kind, name);
    }

    public DeclKind getKind()            { return kind; }
    public String getName()              { return name; }
    public String getQualifiedName()     { return qualifiedName; }
    public FriendKind getFriendKind()    { return friendKind; }
    public boolean isOverloadedOperator() { return overloadedOperator; }
    public TemplateSpecializationKind getTemplateSpecializationKind() { return specializationKind; }

    public boolean isThisDeclarationADefinition() { return definition; }

    /** The first declaration of this entity. */
    public NamedDecl getCanonicalDecl() { return redecls.get(0); }

    /** Every declaration of this entity, in the order the front end saw them. */
    public List<NamedDecl> redecls() { return Collections.unmodifiableList(redecls); }

    /** This declaration if it declares a function or function template, else null. */
    public NamedDecl getAsFunction() {
        return kind.isFunctionLike() ? this : null;
    }

    @Override
    public List<Node> children() { return Collections.unmodifiableList(children); }

    /** Attaches a lexically nested node. Called by the front end while building the tree. */
    public void addChild(Node child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseDecl(this);
    }

    @Override
    public String toString() {
        return kind.displayName() + " " + qualifiedName;
    }

    public static class Builder {
        private final DeclKind kind;
        private final String name;
        private String qualifiedName;
        private SourceLocation location = SourceLocation.INVALID;
        private boolean definition;
        private FriendKind friendKind = FriendKind.NONE;
        private TemplateSpecializationKind specializationKind = TemplateSpecializationKind.NONE;
        private boolean overloadedOperator;
        private NamedDecl previous;

        Builder(DeclKind kind, String name) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder qualifiedName(String qualifiedName) { this.qualifiedName = qualifiedName; return this; }
        public Builder at(SourceLocation location)          { this.location = location; return this; }
        public Builder definition(boolean definition)       { this.definition = definition; return this; }
        public Builder friend(FriendKind friendKind)        { this.friendKind = friendKind; return this; }
        public Builder overloadedOperator(boolean op)       { this.overloadedOperator = op; return this; }
        /** Links the new declaration into the redeclaration chain of {@code previous}. */
        public Builder previous(NamedDecl previous)         { this.previous = previous; return this; }

        public Builder specialization(TemplateSpecializationKind kind) {
            this.specializationKind = kind;
            return this;
        }

        public NamedDecl build() {
            if (kind == DeclKind.USING) {
                throw new IllegalStateException("Use UsingDecl.builder for using-declarations");
            }
            return new NamedDecl(this);
        }
    }
}
