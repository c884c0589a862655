package com.includeslice.core.preprocessor;

import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.SourceLocation;

/**
 * Preprocessor events, delivered in textual order during the parse.
 * All methods default to doing nothing.
 */
public interface PreprocessorListener {

    /** The preprocessor entered or returned to the file containing {@code location}. */
    default void fileChanged(SourceLocation location, FileChangeReason reason) {}

    /**
     * An {@code #include} directive.
     *
     * @param hash     location of the {@code #}
     * @param spelled  the file name as written, including its {@code ""} or {@code <>} delimiters
     * @param resolved the file found by header search, or null if the include did not resolve
     */
    default void inclusionDirective(SourceLocation hash, String spelled, FileEntry resolved) {}

    /** A {@code #define}; {@code info} is already the definition in effect. */
    default void macroDefined(Token name, MacroInfo info) {}

    /** An expansion of the macro defined by {@code definition}. */
    default void macroExpands(Token name, MacroInfo definition) {}

    /** A comment, with its delimiters. */
    default void comment(SourceLocation location, String text) {}
}
