package com.includeslice.core.model;

import com.includeslice.core.syntax.NamedDecl;

/**
 * An entity that can be referenced: a declaration or a macro.
 */
public sealed interface Symbol permits Symbol.Declaration, Symbol.Macro {

    enum Kind { MACRO, DECLARATION }

    Kind kind();

    /** The unqualified name. */
    String name();

    /** {@code macro} for macros, otherwise the declaration kind, e.g. {@code CXXRecord}. */
    String nodeName();

    static Symbol of(NamedDecl decl) {
        return new Declaration(decl);
    }

    static Symbol of(DefinedMacro macro) {
        return new Macro(macro);
    }

    /**
     * A declaration symbol. Equality is the identity of the wrapped declaration, so callers
     * must pass the canonical declaration for redeclarations to collapse.
     */
    record Declaration(NamedDecl decl) implements Symbol {
        @Override public Kind kind()        { return Kind.DECLARATION; }
        @Override public String name()      { return decl.getName(); }
        @Override public String nodeName()  { return decl.getKind().displayName(); }
    }

    record Macro(DefinedMacro macro) implements Symbol {
        @Override public Kind kind()        { return Kind.MACRO; }
        @Override public String name()      { return macro.name(); }
        @Override public String nodeName()  { return "macro"; }
    }
}
