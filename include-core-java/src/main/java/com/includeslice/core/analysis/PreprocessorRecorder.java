package com.includeslice.core.analysis;

import com.includeslice.core.model.SymbolReference;
import com.includeslice.core.preprocessor.FileChangeReason;
import com.includeslice.core.preprocessor.MacroInfo;
import com.includeslice.core.preprocessor.PreprocessorListener;
import com.includeslice.core.preprocessor.Token;
import com.includeslice.core.source.FileEntry;
import com.includeslice.core.source.SourceLocation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Records includes and macro references while the preprocessor is in the main file.
 */
class PreprocessorRecorder implements PreprocessorListener {

    private static final Pattern KEEP_PRAGMA = Pattern.compile("IWYU\\s+pragma:\\s*keep\\b");

    private final AnalysisContext ctx;
    private final RecordedPreprocessor recorded;
    private boolean active;
    private int keepPragmaLine = -1;

    PreprocessorRecorder(AnalysisContext ctx, RecordedPreprocessor recorded) {
        this.ctx = ctx;
        this.recorded = recorded;
    }

    @Override
    public void fileChanged(SourceLocation location, FileChangeReason reason) {
        active = ctx.sourceManager().isWrittenInMainFile(location);
    }

    @Override
    public void inclusionDirective(SourceLocation hash, String spelled, FileEntry resolved) {
        if (!active) return;
        int line = ctx.sourceManager().getSpellingLineNumber(hash);
        // The pragma may sit on the line above, or trail the directive on its own line.
        boolean keep = keepPragmaLine == line - 1 || keepPragmaLine == line;
        recorded.getIncludes().add(new Include(spelled, resolved, hash, line, keep));
    }

    @Override
    public void comment(SourceLocation location, String text) {
        if (!active || !KEEP_PRAGMA.matcher(text).find()) return;
        int line = ctx.sourceManager().getSpellingLineNumber(location);
        Include last = recorded.getIncludes().last();
        if (last != null && last.line() == line) {
            // #include "foo.h" // IWYU pragma: keep
            recorded.getIncludes().markLastKeep();
        } else {
            keepPragmaLine = line;
        }
    }

    @Override
    public void macroExpands(Token name, MacroInfo definition) {
        if (!active) return;
        // Expansions nested in another macro's body were recorded when that body was defined.
        Optional<SourceLocation> usedAt = UseLocations.attribute(name.location());
        usedAt.ifPresent(loc -> recordMacroRef(name.spelling(), loc, definition));
    }

    @Override
    public void macroDefined(Token name, MacroInfo info) {
        if (!active) return;
        // The tokens of a macro definition could refer to a macro.
        // Formally this reference isn't resolved until this macro is expanded,
        // but we treat it as a reference anyway.
        for (Token token : info.tokens()) {
            if (!token.identifier()) continue;
            String identifier = token.spelling();
            // Parameters of this macro shadow any macro of the same name.
            if (!ctx.macroTable().hadMacroDefinition(identifier) || info.params().contains(identifier)) {
                continue;
            }
            ctx.macroTable().getMacroInfo(identifier)
                .ifPresent(mi -> recordMacroRef(identifier, token.location(), mi));
        }
    }

    private void recordMacroRef(String name, SourceLocation usedAt, MacroInfo definition) {
        if (definition.builtin()) return; // __FILE__ is not a reference.
        if (!definition.definitionLocation().isValid()) return;
        recorded.addMacroReference(new SymbolReference(
            usedAt, ctx.macro(name, definition.definitionLocation())));
    }
}
