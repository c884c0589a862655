package com.includeslice.core.syntax;

import java.util.List;

/**
 * Receives each group of top-level declarations as the front end finishes parsing it.
 */
@FunctionalInterface
public interface TopLevelDeclListener {

    /** @return false to stop receiving further groups */
    boolean handleTopLevelDecl(List<NamedDecl> group);
}
