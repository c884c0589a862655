package com.includeslice.core.model;

import com.includeslice.core.source.SourceLocation;

/** A use of {@code target} observed at {@code location}. */
public record SymbolReference(SourceLocation location, Symbol target) {}
