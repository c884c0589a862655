package com.includeslice.core.analysis;

import com.includeslice.core.model.Header;
import com.includeslice.core.model.Hinted;
import com.includeslice.core.model.Location;
import com.includeslice.core.model.Symbol;
import com.includeslice.core.model.SymbolReference;
import com.includeslice.core.syntax.NamedDecl;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds and reports all references to symbols in a region of code.
 *
 * The traversal is rooted at {@code roots}, typically the top-level declarations of a
 * single source file. {@code macroRefs} are additional recorded references to macros,
 * which do not appear in the syntax tree.
 *
 * Mapping between headers and include directives is not done here; see
 * {@link RecordedIncludes#match}.
 */
public final class UsedSymbolWalker {

    private UsedSymbolWalker() {}

    public static void walkUsed(AnalysisContext ctx, List<NamedDecl> roots,
                                List<SymbolReference> macroRefs, UsedSymbolVisitor visitor) {
        for (NamedDecl root : roots) {
            ReferenceWalker.walk(ctx, root, (location, decl) -> {
                List<Hinted<Header>> headers = new ArrayList<>();
                for (Hinted<Location> loc : Locations.locateDecl(ctx, decl.value())) {
                    headers.addAll(Headers.includableHeaders(ctx, loc));
                }
                if (declaredInMainFile(headers)) {
                    visitor.visit(location, Symbol.of(decl.value()), List.of(Header.mainFile()));
                    return;
                }
                headers = HeaderRanker.addHint(decl.hint(), headers);
                headers = HeaderRanker.addNameMatchHint(decl.value().getName(), headers);
                visitor.visit(location, Symbol.of(decl.value()), HeaderRanker.rank(headers));
            });
        }
        for (SymbolReference macroRef : macroRefs) {
            if (!(macroRef.target() instanceof Symbol.Macro macro)) {
                throw new IllegalArgumentException("Expected a macro reference: " + macroRef.target());
            }
            Hinted<Location> loc = Locations.locateMacro(ctx, macro.macro());
            List<Hinted<Header>> headers = Headers.includableHeaders(ctx, loc);
            headers = HeaderRanker.addNameMatchHint(macro.name(), headers);
            visitor.visit(macroRef.location(), macroRef.target(), HeaderRanker.rank(headers));
        }
    }

    /** A declaration written in the main file needs no include, whatever its other redeclarations. */
    private static boolean declaredInMainFile(List<Hinted<Header>> headers) {
        for (Hinted<Header> header : headers) {
            if (header.value().kind() == Header.Kind.MAIN_FILE) return true;
        }
        return false;
    }
}
