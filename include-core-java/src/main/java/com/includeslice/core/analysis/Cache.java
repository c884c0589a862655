package com.includeslice.core.analysis;

import com.includeslice.core.model.DefinedMacro;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.stdlib.StandardLibraryTable;
import com.includeslice.core.stdlib.StdlibSymbol;
import com.includeslice.core.syntax.NamedDecl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-run arena: interned macro symbols and memoized standard library recognition.
 * Belongs to exactly one {@link AnalysisContext} and is discarded with it.
 */
final class Cache {

    private final Map<String, List<DefinedMacro>> definedMacros = new HashMap<>();
    private final Map<NamedDecl, Optional<StdlibSymbol>> recognized = new IdentityHashMap<>();
    private final StandardLibraryTable stdlib;

    Cache(StandardLibraryTable stdlib) {
        this.stdlib = stdlib;
    }

    Symbol macro(String name, SourceLocation definition) {
        List<DefinedMacro> definitions = definedMacros.computeIfAbsent(name, n -> new ArrayList<>(1));
        // Linear search: a name rarely has more than one or two definitions.
        for (DefinedMacro macro : definitions) {
            if (macro.definition().equals(definition)) {
                return Symbol.of(macro);
            }
        }
        DefinedMacro macro = new DefinedMacro(name, definition);
        definitions.add(macro);
        return Symbol.of(macro);
    }

    Optional<StdlibSymbol> recognizeStdlib(NamedDecl decl) {
        return recognized.computeIfAbsent(decl, stdlib::recognize);
    }

    int internedMacroCount() {
        int count = 0;
        for (List<DefinedMacro> definitions : definedMacros.values()) count += definitions.size();
        return count;
    }
}
