package com.includeslice.core.analysis;

import com.includeslice.core.model.Symbol;
import com.includeslice.core.preprocessor.MacroTable;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.source.SourceManager;
import com.includeslice.core.stdlib.StandardLibraryTable;
import com.includeslice.core.stdlib.StdlibSymbol;
import com.includeslice.core.syntax.NamedDecl;

import java.util.Objects;
import java.util.Optional;

/**
 * Bundles the policy, the front end's services and the per-run cache for one unit.
 * Not thread-safe; create one per unit and drop it when the unit is done.
 */
public class AnalysisContext {

    private final Policy policy;
    private final SourceManager sourceManager;
    private final MacroTable macroTable;
    private final StandardLibraryTable stdlib;
    private final Cache cache;

    public AnalysisContext(Policy policy, SourceManager sourceManager, MacroTable macroTable,
                           StandardLibraryTable stdlib) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sourceManager = Objects.requireNonNull(sourceManager, "sourceManager");
        this.macroTable = Objects.requireNonNull(macroTable, "macroTable");
        this.stdlib = Objects.requireNonNull(stdlib, "stdlib");
        this.cache = new Cache(stdlib);
    }

    public Policy policy()                    { return policy; }
    public SourceManager sourceManager()      { return sourceManager; }
    public MacroTable macroTable()            { return macroTable; }
    public StandardLibraryTable stdlibTable() { return stdlib; }

    /** The interned symbol for the definition of {@code name} at {@code definition}. */
    public Symbol macro(String name, SourceLocation definition) {
        return cache.macro(name, definition);
    }

    Optional<StdlibSymbol> recognizeStdlib(NamedDecl decl) {
        return cache.recognizeStdlib(decl);
    }

    Cache cache() { return cache; }
}
