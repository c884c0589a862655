package com.includeslice.core.source;

/**
 * Expansion info for a location that lies inside a macro expansion.
 *
 * @param spelling       where the characters were written: inside the macro body for body tokens,
 *                       at the invocation's argument text for argument tokens
 * @param expansion      the location of the macro invocation
 * @param macroArgument  true if the location came from substituting a macro argument
 */
public record MacroExpansion(
    SourceLocation spelling,
    SourceLocation expansion,
    boolean macroArgument
) {}
