package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Hint;
import com.includeslice.core.model.Hinted;
import com.includeslice.core.model.Location;
import com.includeslice.core.source.FileId;
import com.includeslice.core.stdlib.StdlibHeader;
import com.includeslice.core.stdlib.StdlibSymbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.includeslice.core.analysis.TestUnit.at;
import static com.includeslice.core.analysis.TestUnit.inMacroBody;
import static org.junit.jupiter.api.Assertions.*;

class HeadersTest {

    private final TestUnit unit = new TestUnit();

    private List<Hinted<Header>> headersOf(Location location, Hint hint) {
        return Headers.includableHeaders(unit.context(), Hinted.of(location, hint));
    }

    @Test
    void mainFileLocationMapsToMainFileSentinel() {
        assertEquals(List.of(Hinted.of(Header.mainFile())),
            headersOf(new Location.Physical(at(unit.main, 4)), Hint.NONE));
    }

    @Test
    void predefinesLocationMapsToBuiltinSentinel() {
        assertEquals(List.of(Hinted.of(Header.builtin())),
            headersOf(new Location.Physical(at(unit.predefines, 1)), Hint.NONE));
    }

    @Test
    void headerLocationMapsToItsFileAndKeepsHint() {
        FileId foo = unit.header("include/foo.h");
        assertEquals(List.of(Hinted.of(Header.physical(unit.entry(foo)), Hint.COMPLETE)),
            headersOf(new Location.Physical(at(foo, 12)), Hint.COMPLETE));
    }

    @Test
    void macroLocationUsesTheFileOfItsExpansion() {
        FileId foo = unit.header("include/foo.h");
        FileId bar = unit.header("include/bar.h");
        // Declared by a macro defined in bar.h, expanded in foo.h.
        Location location = new Location.Physical(inMacroBody(at(bar, 2), at(foo, 8)));
        assertEquals(List.of(Hinted.of(Header.physical(unit.entry(foo)))), headersOf(location, Hint.NONE));
    }

    @Test
    void locationInBufferWithoutFileHasNoProvider() {
        FileId scratch = unit.sm.addBuffer();
        assertTrue(headersOf(new Location.Physical(at(scratch, 1)), Hint.NONE).isEmpty());
    }

    @Test
    void standardLibraryLocationMapsToItsLogicalHeader() {
        StdlibSymbol string = new StdlibSymbol("std::string", new StdlibHeader("<string>"));
        assertEquals(List.of(Hinted.of(Header.standardLibrary(new StdlibHeader("<string>")))),
            headersOf(new Location.StandardLibrary(string), Hint.NONE));
    }
}
