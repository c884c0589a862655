package com.includeslice.core.syntax;

/** How a declaration relates to a {@code friend} declaration. */
public enum FriendKind {
    /** Not a friend declaration. */
    NONE,
    /** A friend declaration that also declares the entity for the first time. */
    UNDECLARED,
    /** A friend declaration of an entity that is declared elsewhere. */
    DECLARED
}
