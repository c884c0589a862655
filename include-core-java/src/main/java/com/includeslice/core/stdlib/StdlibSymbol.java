package com.includeslice.core.stdlib;

/**
 * A standard library entity, e.g. {@code std::vector}, and the header that provides it.
 */
public record StdlibSymbol(String qualifiedName, StdlibHeader header) {}
