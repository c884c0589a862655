package com.includeslice.core.syntax;

import java.util.List;

/**
 * Semantic types. Unlike nodes they carry no location: a written type is wrapped in a
 * {@link TypeLoc}, an implied one (e.g. a constructed temporary) is reached from its expression.
 */
public sealed interface Type {

    boolean accept(SyntaxVisitor visitor);

    /** A class, struct, union or enum type. */
    record TagType(NamedDecl decl) implements Type {
        @Override
        public boolean accept(SyntaxVisitor visitor) { return visitor.traverseTagType(this); }
    }

    /** A type named through a typedef or alias declaration. */
    record TypedefType(NamedDecl decl) implements Type {
        @Override
        public boolean accept(SyntaxVisitor visitor) { return visitor.traverseTypedefType(this); }
    }

    /** A type named through a using-declaration; {@code foundDecl} is the using-shadow. */
    record UsingType(NamedDecl foundDecl) implements Type {
        @Override
        public boolean accept(SyntaxVisitor visitor) { return visitor.traverseUsingType(this); }
    }

    /**
     * {@code Template<Args...>}. {@code specialization} is the concrete record when the
     * front end could resolve it, null for dependent specializations.
     */
    record TemplateSpecializationType(NamedDecl templateDecl, NamedDecl specialization, List<Type> args)
            implements Type {
        public TemplateSpecializationType {
            args = List.copyOf(args);
        }

        @Override
        public boolean accept(SyntaxVisitor visitor) { return visitor.traverseTemplateSpecializationType(this); }
    }

    /** Pointers and references. */
    record PointerType(Type pointee) implements Type {
        @Override
        public boolean accept(SyntaxVisitor visitor) { return visitor.traversePointerType(this); }
    }

    /** {@code int}, {@code void} and friends. */
    record BuiltinType(String name) implements Type {
        @Override
        public boolean accept(SyntaxVisitor visitor) { return true; }
    }
}
