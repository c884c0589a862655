package com.includeslice.core.syntax;

import com.includeslice.core.source.FileId;
import com.includeslice.core.source.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NamedDeclTest {

    private static final FileId FILE = new FileId(1);

    @Test
    void redeclarationsShareTheCanonicalDeclaration() {
        NamedDecl first = NamedDecl.builder(DeclKind.FUNCTION, "f").at(SourceLocation.of(FILE, 1, 1)).build();
        NamedDecl second = NamedDecl.builder(DeclKind.FUNCTION, "f").at(SourceLocation.of(FILE, 5, 1))
            .definition(true).previous(first).build();

        assertSame(first, second.getCanonicalDecl());
        assertSame(first, first.getCanonicalDecl());
        assertEquals(List.of(first, second), first.redecls());
        assertTrue(second.isThisDeclarationADefinition());
    }

    @Test
    void redeclarationCannotChangeKind() {
        NamedDecl first = NamedDecl.builder(DeclKind.FUNCTION, "f").build();
        assertThrows(IllegalArgumentException.class,
            () -> NamedDecl.builder(DeclKind.VAR, "f").previous(first).build());
    }

    @Test
    void usingDeclarationsHaveTheirOwnFactory() {
        assertThrows(IllegalStateException.class, () -> NamedDecl.builder(DeclKind.USING, "f").build());
        UsingDecl using = UsingDecl.of("f", SourceLocation.of(FILE, 2, 1), List.of());
        assertEquals(DeclKind.USING, using.getKind());
    }

    @Test
    void onlyFunctionsAndFunctionTemplatesActAsFunctions() {
        assertNotNull(NamedDecl.builder(DeclKind.FUNCTION_TEMPLATE, "g").build().getAsFunction());
        assertNotNull(NamedDecl.builder(DeclKind.CXX_METHOD, "m").build().getAsFunction());
        assertNull(NamedDecl.builder(DeclKind.VAR, "v").build().getAsFunction());
    }

    @Test
    void displayNamesRoundTrip() {
        for (DeclKind kind : DeclKind.values()) {
            assertSame(kind, DeclKind.fromDisplayName(kind.displayName()));
        }
        assertThrows(IllegalArgumentException.class, () -> DeclKind.fromDisplayName("Lambda"));
    }

    @Test
    void visitorSeesChildrenInSourceOrderAndStopsWhenAsked() {
        NamedDecl target = NamedDecl.builder(DeclKind.VAR, "v").build();
        NamedDecl root = NamedDecl.builder(DeclKind.FUNCTION, "main").build();
        SourceLocation loc = SourceLocation.of(FILE, 3, 1);
        root.addChild(new CompoundStmt(loc, List.of(
            new DeclRefExpr(loc, target),
            new CallExpr(loc, new DeclRefExpr(loc, root), List.of(new DeclRefExpr(loc, target))))));
        List<String> seen = new ArrayList<>();

        boolean completed = new SyntaxVisitor() {
            @Override
            public boolean visitDeclRefExpr(DeclRefExpr expr) {
                seen.add(expr.getFoundDecl().getName());
                return seen.size() < 2;
            }
        }.traverse(root);

        assertFalse(completed);
        assertEquals(List.of("v", "main"), seen);
    }
}
