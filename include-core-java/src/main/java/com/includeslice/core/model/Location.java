package com.includeslice.core.model;

import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.source.SourceManager;
import com.includeslice.core.stdlib.StdlibSymbol;

/**
 * A place where a symbol is provided: a position in the parsed source,
 * or a logical entry of the standard library whose concrete file does not matter.
 */
public sealed interface Location permits Location.Physical, Location.StandardLibrary {

    enum Kind { PHYSICAL, STANDARD_LIBRARY }

    Kind kind();

    String name(SourceManager sourceManager);

    record Physical(SourceLocation location) implements Location {
        @Override public Kind kind() { return Kind.PHYSICAL; }

        @Override
        public String name(SourceManager sourceManager) {
            return sourceManager.print(location);
        }
    }

    record StandardLibrary(StdlibSymbol symbol) implements Location {
        @Override public Kind kind() { return Kind.STANDARD_LIBRARY; }

        @Override
        public String name(SourceManager sourceManager) {
            return symbol.qualifiedName();
        }
    }
}
