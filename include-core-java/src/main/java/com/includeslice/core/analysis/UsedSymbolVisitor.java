package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * Callback invoked for each symbol reference seen.
 *
 * References occur at a particular location, refer to a single symbol, and that symbol
 * may be provided by any of several headers. The first element of {@code providedBy} is
 * the preferred header, e.g. to insert. An empty list means no provider is known.
 */
@FunctionalInterface
public interface UsedSymbolVisitor {

    void visit(SourceLocation usedAt, Symbol symbol, List<Header> providedBy);
}
