package com.includeslice.core.analysis;

import com.includeslice.core.model.DefinedMacro;
import com.includeslice.core.model.Hint;
import com.includeslice.core.model.Hinted;
import com.includeslice.core.model.Location;
import com.includeslice.core.source.FileId;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.syntax.DeclKind;
import com.includeslice.core.syntax.FriendKind;
import com.includeslice.core.syntax.NamedDecl;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.includeslice.core.analysis.TestUnit.at;
import static org.junit.jupiter.api.Assertions.*;

class LocationsTest {

    private final TestUnit unit = new TestUnit();
    private final FileId fwd = unit.header("fwd.h");
    private final FileId def = unit.header("def.h");

    @Test
    void everyRedeclarationIsALocation() {
        NamedDecl first = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(fwd, 3)).build();
        NamedDecl second = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(def, 10))
            .definition(true).previous(first).build();

        List<Hinted<Location>> locations = Locations.locateDecl(unit.context(), second);

        assertEquals(List.of(
            Hinted.of((Location) new Location.Physical(at(fwd, 3)), Hint.NONE),
            Hinted.of((Location) new Location.Physical(at(def, 10)), Hint.COMPLETE)), locations);
    }

    @Test
    void templateDefinitionsAreComplete() {
        NamedDecl classTemplate = TestUnit.decl(DeclKind.CLASS_TEMPLATE, "Box", at(def, 1), true);
        NamedDecl functionTemplate = TestUnit.decl(DeclKind.FUNCTION_TEMPLATE, "make", at(def, 5), true);

        assertEquals(Hint.COMPLETE, Locations.declHint(classTemplate));
        assertEquals(Hint.COMPLETE, Locations.declHint(functionTemplate));
    }

    @Test
    void plainFunctionAndVariableDefinitionsAreNotComplete() {
        assertEquals(Hint.NONE, Locations.declHint(TestUnit.decl(DeclKind.FUNCTION, "f", at(def, 1), true)));
        assertEquals(Hint.NONE, Locations.declHint(TestUnit.decl(DeclKind.VAR, "v", at(def, 2), true)));
        assertEquals(Hint.NONE, Locations.declHint(TestUnit.decl(DeclKind.CXX_RECORD, "R", at(def, 3), false)));
    }

    @Test
    void friendDeclarationsOfDeclaredEntitiesAreSkipped() {
        NamedDecl decl = NamedDecl.builder(DeclKind.FUNCTION, "swap").at(at(def, 4)).build();
        NamedDecl friend = NamedDecl.builder(DeclKind.FUNCTION, "swap").at(at(fwd, 9))
            .friend(FriendKind.DECLARED).previous(decl).build();

        List<Hinted<Location>> locations = Locations.locateDecl(unit.context(), friend);

        assertEquals(1, locations.size());
        assertEquals(new Location.Physical(at(def, 4)), locations.get(0).value());
    }

    @Test
    void friendActingAsForwardDeclarationIsKept() {
        NamedDecl friend = NamedDecl.builder(DeclKind.FUNCTION, "swap").at(at(fwd, 9))
            .friend(FriendKind.UNDECLARED).build();
        assertEquals(1, Locations.locateDecl(unit.context(), friend).size());
    }

    @Test
    void redeclarationsWithoutLocationAreSkipped() {
        NamedDecl implicit = NamedDecl.builder(DeclKind.FUNCTION, "operator new").build();
        assertTrue(Locations.locateDecl(unit.context(), implicit).isEmpty());
    }

    @Test
    void standardLibraryDeclarationResolvesToItsLogicalEntryOnly() {
        FileId vectorFile = unit.header("/usr/include/c++/v1/vector");
        NamedDecl vector = NamedDecl.builder(DeclKind.CLASS_TEMPLATE, "vector").qualifiedName("std::vector")
            .at(at(vectorFile, 300)).definition(true).build();

        List<Hinted<Location>> locations = Locations.locateDecl(unit.context(), vector);

        assertEquals(1, locations.size());
        Location location = locations.get(0).value();
        assertEquals(Location.Kind.STANDARD_LIBRARY, location.kind());
        assertEquals("std::vector", location.name(unit.sm));
    }

    @Test
    void macroLocationIsItsDefinition() {
        SourceLocation definition = at(def, 7);
        Hinted<Location> location = Locations.locateMacro(unit.context(), new DefinedMacro("MAX", definition));
        assertEquals(new Location.Physical(definition), location.value());
        assertEquals(Hint.NONE, location.hint());
    }
}
