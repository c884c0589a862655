package com.includeslice.core.model;

import com.includeslice.core.source.SourceLocation;

/**
 * A macro together with one particular definition of it.
 * A redefined macro is a different DefinedMacro.
 */
public record DefinedMacro(String name, SourceLocation definition) {}
