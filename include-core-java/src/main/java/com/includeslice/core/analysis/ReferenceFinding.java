package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.source.SourceLocation;

import java.util.List;

/**
 * A symbol reference with its ranked providers and whether the main file provides it.
 *
 * @param satisfiedBy for satisfied references: the include spelling, or the header name when
 *                    the provider is the main file, a builtin, or a header already reported missing
 */
public record ReferenceFinding(
    SourceLocation location,
    Symbol symbol,
    List<Header> providers,
    Verdict verdict,
    String satisfiedBy
) {

    public enum Verdict {
        /** A provider is included, or needs no include. */
        SATISFIED,
        /** Providers are known but none is included. */
        UNSATISFIED,
        /** No provider is known. */
        NO_HEADER
    }

    public ReferenceFinding {
        providers = List.copyOf(providers);
    }

    public boolean isSatisfied() { return verdict == Verdict.SATISFIED; }
}
