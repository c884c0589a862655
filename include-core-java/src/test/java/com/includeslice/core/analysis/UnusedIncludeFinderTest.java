package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.preprocessor.FileChangeReason;
import com.includeslice.core.preprocessor.PreprocessorListener;
import com.includeslice.core.source.FileId;
import com.includeslice.core.syntax.ConstructExpr;
import com.includeslice.core.syntax.DeclKind;
import com.includeslice.core.syntax.DeclRefExpr;
import com.includeslice.core.syntax.NamedDecl;
import com.includeslice.core.syntax.Type;
import com.includeslice.core.syntax.TypeLoc;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.includeslice.core.analysis.TestUnit.at;
import static com.includeslice.core.analysis.TestUnit.classDef;
import static com.includeslice.core.analysis.TestUnit.decl;
import static org.junit.jupiter.api.Assertions.*;

class UnusedIncludeFinderTest {

    private final TestUnit unit = new TestUnit();
    private final AnalysisContext ctx = unit.context();
    private final RecordedPreprocessor pp = new RecordedPreprocessor();
    private final PreprocessorListener listener = pp.record(ctx);
    private final RecordedAst ast = new RecordedAst();

    private static List<String> spellings(List<Include> includes) {
        return includes.stream().map(Include::bareSpelling).toList();
    }

    /** {@code Foo x;} written at {@code line} of the main file. */
    private NamedDecl variableOfType(NamedDecl type, int line) {
        NamedDecl x = decl(DeclKind.VAR, "x", at(unit.main, line, 5), true);
        x.addChild(new TypeLoc(at(unit.main, line, 1), new Type.TagType(type)));
        x.addChild(new ConstructExpr(at(unit.main, line, 5), new Type.TagType(type), List.of()));
        return x;
    }

    private void topLevel(NamedDecl... decls) {
        ast.record(ctx).handleTopLevelDecl(List.of(decls));
    }

    @Test
    void includeProvidingNothingIsUnused() {
        FileId a = unit.header("a.h");
        FileId b = unit.header("b.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"a.h\"", a);
        unit.include(listener, 2, "\"b.h\"", b);
        NamedDecl foo = classDef("Foo", at(a, 1, 7));
        topLevel(variableOfType(foo, 4));

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        assertEquals(List.of("b.h"), spellings(result.unused()));
        assertEquals(List.of("a.h"), spellings(result.used()));
        IncludeStatus used = result.includes().get(0);
        assertEquals(IncludeStatus.Usage.USED, used.usage());
        assertEquals(Symbol.of(foo), used.firstUse());

        assertEquals(1, result.references().size());
        ReferenceFinding reference = result.references().get(0);
        assertEquals(at(unit.main, 4, 1), reference.location());
        assertEquals(List.of(Header.physical(unit.entry(a))), reference.providers());
        assertEquals("\"a.h\"", reference.satisfiedBy());
    }

    @Test
    void includeProvidingAMacroIsUsed() {
        FileId k = unit.header("k.h");
        FileId m = unit.header("m.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"k.h\"", k);
        listener.fileChanged(at(k, 1), FileChangeReason.ENTER_FILE);
        unit.define(listener, "LIMIT", at(k, 2, 9));
        listener.fileChanged(at(unit.main, 2), FileChangeReason.EXIT_FILE);
        unit.include(listener, 2, "\"m.h\"", m);
        unit.expand(listener, "LIMIT", at(unit.main, 4, 9));

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        assertEquals(List.of("m.h"), spellings(result.unused()));
        assertEquals("macro", result.references().get(0).symbol().nodeName());
        assertEquals("LIMIT", result.includes().get(0).firstUse().name());
    }

    @Test
    void includeMatchingAnyProviderIsUsed() {
        FileId fwd = unit.header("fwd.h");
        FileId def = unit.header("def.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"fwd.h\"", fwd);
        NamedDecl declared = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(fwd, 1)).build();
        NamedDecl defined = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(def, 1))
            .definition(true).previous(declared).build();
        NamedDecl ptr = decl(DeclKind.VAR, "p", at(unit.main, 3, 6), true);
        ptr.addChild(new TypeLoc(at(unit.main, 3, 1), new Type.PointerType(new Type.TagType(defined))));
        topLevel(ptr);

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        assertTrue(result.unused().isEmpty());
        // def.h holds the definition, so it is preferred even though fwd.h satisfies the use.
        assertEquals(List.of(Header.physical(unit.entry(def)), Header.physical(unit.entry(fwd))),
            result.references().get(0).providers());
        assertTrue(result.references().get(0).isSatisfied());
    }

    @Test
    void onlyEligibleIncludesAreReportedUnused() {
        unit.enterMain(listener);
        listener.comment(at(unit.main, 1), "// IWYU pragma: keep");
        unit.include(listener, 2, "\"keep.h\"", unit.header("keep.h"));
        unit.include(listener, 3, "<vector>", unit.header("/usr/include/c++/v1/vector"));
        unit.include(listener, 4, "<thirdparty/widget.h>", unit.header("/opt/include/thirdparty/widget.h"));
        unit.include(listener, 5, "\"missing.h\"", null);
        unit.include(listener, 6, "\"table.inc\"", unit.unguardedHeader("table.inc"));
        unit.include(listener, 7, "\"plain.h\"", unit.header("plain.h"));

        IncludeAnalysis byDefault = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        List<IncludeStatus> statuses = byDefault.includes();
        assertEquals(KeepReason.PRAGMA_KEEP, statuses.get(0).keepReason());
        assertEquals(KeepReason.ANGLED_INCLUDE, statuses.get(1).keepReason());
        assertEquals(KeepReason.ANGLED_INCLUDE, statuses.get(2).keepReason());
        assertEquals(KeepReason.UNRESOLVED, statuses.get(3).keepReason());
        assertEquals(KeepReason.NOT_INCLUDE_GUARDED, statuses.get(4).keepReason());
        assertEquals(IncludeStatus.Usage.UNUSED, statuses.get(5).usage());
        assertEquals(List.of("plain.h"), spellings(byDefault.unused()));

        IncludeAnalysis withStdlib = new UnusedIncludeFinder(AnalysisConfig.DEFAULT.withAnalyzeStdlib(true))
            .analyze(ctx, ast, pp);

        assertEquals(List.of("vector", "plain.h"), spellings(withStdlib.unused()));
        assertEquals(KeepReason.ANGLED_INCLUDE, withStdlib.includes().get(2).keepReason());
    }

    @Test
    void standardLibraryIncludeIsMatchedBySpelling() {
        FileId vectorFile = unit.header("/usr/include/c++/v1/vector");
        unit.enterMain(listener);
        unit.include(listener, 1, "<vector>", vectorFile);
        NamedDecl vector = NamedDecl.builder(DeclKind.CLASS_TEMPLATE, "vector").qualifiedName("std::vector")
            .at(at(vectorFile, 400)).definition(true).build();
        NamedDecl v = decl(DeclKind.VAR, "v", at(unit.main, 3, 18), true);
        v.addChild(new TypeLoc(at(unit.main, 3, 1),
            new Type.TemplateSpecializationType(vector, null, List.of(new Type.BuiltinType("int")))));
        topLevel(v);

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT.withAnalyzeStdlib(true))
            .analyze(ctx, ast, pp);

        assertTrue(result.unused().isEmpty());
        assertEquals(List.of("vector"), spellings(result.used()));
        assertEquals("<vector>", result.references().get(0).satisfiedBy());
    }

    @Test
    void symbolsOfTheMainFileUseNoInclude() {
        FileId a = unit.header("a.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"a.h\"", a);
        NamedDecl helper = decl(DeclKind.FUNCTION, "helper", at(unit.main, 3), false);
        NamedDecl caller = decl(DeclKind.FUNCTION, "caller", at(unit.main, 5), true);
        caller.addChild(new DeclRefExpr(at(unit.main, 6, 3), helper));
        topLevel(helper, caller);

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        assertEquals(List.of("a.h"), spellings(result.unused()));
        assertEquals("<main-file>", result.references().get(0).satisfiedBy());
    }

    @Test
    void definitionInTheMainFileHidesForwardDeclarations() {
        FileId a = unit.header("a.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"a.h\"", a);
        NamedDecl forward = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(a, 1, 7)).build();
        NamedDecl defined = NamedDecl.builder(DeclKind.CXX_RECORD, "Foo").at(at(unit.main, 3, 7))
            .definition(true).previous(forward).build();
        topLevel(defined, variableOfType(defined, 5));

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        // The definition names its forward declaration, and the variable names the type.
        assertEquals(2, result.references().size());
        for (ReferenceFinding reference : result.references()) {
            assertEquals(List.of(Header.mainFile()), reference.providers());
        }
        assertEquals(List.of("a.h"), spellings(result.unused()));
    }

    @Test
    void policyMustMatchTheContext() {
        unit.enterMain(listener);
        UnusedIncludeFinder finder = new UnusedIncludeFinder(
            AnalysisConfig.DEFAULT.withPolicy(Policy.DEFAULT.withMembers(true)));

        assertThrows(IllegalArgumentException.class, () -> finder.analyze(ctx, ast, pp));
    }

    @Test
    void missingIncludeIsReportedForReferencesNoIncludeProvides() {
        FileId notIncluded = unit.header("widget.h");
        unit.enterMain(listener);
        NamedDecl widget = classDef("Widget", at(notIncluded, 2));
        topLevel(variableOfType(widget, 3), variableOfType(widget, 4));

        IncludeAnalysis result = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp);

        assertEquals(2, result.references().size());
        assertEquals(ReferenceFinding.Verdict.UNSATISFIED, result.references().get(0).verdict());
        assertEquals(ReferenceFinding.Verdict.SATISFIED, result.references().get(1).verdict());
        assertEquals("widget.h", result.references().get(1).satisfiedBy());
    }

    @Test
    void analysisIsRepeatable() {
        FileId a = unit.header("a.h");
        FileId b = unit.header("b.h");
        unit.enterMain(listener);
        unit.include(listener, 1, "\"a.h\"", a);
        unit.include(listener, 2, "\"b.h\"", b);
        topLevel(variableOfType(classDef("Foo", at(a, 1)), 4));
        UnusedIncludeFinder finder = new UnusedIncludeFinder(AnalysisConfig.DEFAULT);

        assertEquals(finder.analyze(ctx, ast, pp), finder.analyze(ctx, ast, pp));
    }

    @Test
    void removalEditCoversTheWholeDirectiveLine() {
        FileId b = unit.header("b.h");
        unit.enterMain(listener);
        unit.include(listener, 7, "\"b.h\"", b);

        IncludeStatus status = new UnusedIncludeFinder(AnalysisConfig.DEFAULT).analyze(ctx, ast, pp)
            .includes().get(0);

        assertEquals(new RemovalEdit(7, 8), status.removalEdit());
    }
}
