package com.includeslice.core.stdlib;

import com.includeslice.core.syntax.NamedDecl;

import java.util.Map;
import java.util.Optional;

/**
 * Maps well-known declarations to standard library symbols and their canonical headers.
 */
public interface StandardLibraryTable {

    /** The standard library symbol a declaration denotes, if it is one. */
    Optional<StdlibSymbol> recognize(NamedDecl decl);

    /** The header with this spelling ({@code <vector>} or {@code vector}), if it is a known one. */
    Optional<StdlibHeader> header(String spelling);

    /** A table that recognizes nothing. */
    static StandardLibraryTable empty() {
        return new MappedStandardLibraryTable(Map.of());
    }

    /** The table bundled with the library. */
    static StandardLibraryTable load() {
        return MappedStandardLibraryTable.fromResource(MappedStandardLibraryTable.DEFAULT_RESOURCE);
    }
}
