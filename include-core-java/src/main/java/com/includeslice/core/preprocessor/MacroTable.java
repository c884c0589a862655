package com.includeslice.core.preprocessor;

import java.util.Optional;

/**
 * The preprocessor's view of macro definitions at the current point of the parse.
 */
public interface MacroTable {

    /** The definition in effect for {@code name}, if any. */
    Optional<MacroInfo> getMacroInfo(String name);

    /** Whether {@code name} has been defined at any point so far, even if since undefined. */
    boolean hadMacroDefinition(String name);
}
