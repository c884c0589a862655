package com.includeslice.core.analysis;

import com.includeslice.core.model.SymbolReference;
import com.includeslice.core.preprocessor.PreprocessorListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Preprocessor events from the main file that the analysis needs.
 */
public class RecordedPreprocessor {

    private final List<SymbolReference> macroReferences = new ArrayList<>();
    private final RecordedIncludes includes = new RecordedIncludes();

    /** A listener to install into the front end; it fills this object in as the parse runs. */
    public PreprocessorListener record(AnalysisContext ctx) {
        return new PreprocessorRecorder(ctx, this);
    }

    /** Where macros were used from the main file, in textual order. */
    public List<SymbolReference> getMacroReferences() {
        return Collections.unmodifiableList(macroReferences);
    }

    public RecordedIncludes getIncludes() { return includes; }

    void addMacroReference(SymbolReference reference) {
        macroReferences.add(reference);
    }
}
