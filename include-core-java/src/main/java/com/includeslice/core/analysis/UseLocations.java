package com.includeslice.core.analysis;

import com.includeslice.core.source.MacroExpansion;
import com.includeslice.core.source.SourceLocation;

import java.util.Optional;

/**
 * Attributes a location inside macro expansions to the code that wrote it.
 */
final class UseLocations {

    private UseLocations() {}

    /**
     * Unwinds macro argument expansions to where the argument was spelled.
     * Empty if the location comes from a macro body: names within macro bodies
     * are not references of the code expanding the macro.
     */
    static Optional<SourceLocation> attribute(SourceLocation location) {
        while (location.isMacroId()) {
            MacroExpansion expansion = location.getExpansion();
            if (!expansion.macroArgument()) return Optional.empty();
            location = expansion.spelling();
        }
        return Optional.of(location);
    }
}
