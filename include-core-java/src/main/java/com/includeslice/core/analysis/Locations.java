package com.includeslice.core.analysis;

import com.includeslice.core.model.DefinedMacro;
import com.includeslice.core.model.Hint;
import com.includeslice.core.model.Hinted;
import com.includeslice.core.model.Location;
import com.includeslice.core.stdlib.StdlibSymbol;
import com.includeslice.core.syntax.DeclKind;
import com.includeslice.core.syntax.FriendKind;
import com.includeslice.core.syntax.NamedDecl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the locations where a symbol is provided.
 */
public final class Locations {

    private Locations() {}

    /**
     * Standard library declarations resolve to their single logical location.
     * Everything else resolves to each of its redeclarations.
     */
    public static List<Hinted<Location>> locateDecl(AnalysisContext ctx, NamedDecl decl) {
        Optional<StdlibSymbol> stdlib = ctx.recognizeStdlib(decl.getCanonicalDecl());
        if (stdlib.isPresent()) {
            return List.of(Hinted.of(new Location.StandardLibrary(stdlib.get())));
        }

        List<Hinted<Location>> result = new ArrayList<>();
        for (NamedDecl redecl : decl.redecls()) {
            // `friend X` is not an interesting location for X unless it's acting as a
            // forward-declaration.
            if (redecl.getFriendKind() == FriendKind.DECLARED) continue;
            if (redecl.getLocation().isValid()) {
                result.add(Hinted.of(new Location.Physical(redecl.getLocation()), declHint(redecl)));
            }
        }
        return result;
    }

    public static Hinted<Location> locateMacro(AnalysisContext ctx, DefinedMacro macro) {
        return Hinted.of(new Location.Physical(macro.definition()));
    }

    /** COMPLETE for definitions of tags, class templates and function templates. */
    static Hint declHint(NamedDecl decl) {
        DeclKind kind = decl.getKind();
        boolean completes = kind.isTag()
            || kind == DeclKind.CLASS_TEMPLATE
            || kind == DeclKind.FUNCTION_TEMPLATE;
        return completes && decl.isThisDeclarationADefinition() ? Hint.COMPLETE : Hint.NONE;
    }
}
