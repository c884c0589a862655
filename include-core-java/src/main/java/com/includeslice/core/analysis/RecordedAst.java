package com.includeslice.core.analysis;

import com.includeslice.core.source.SourceManager;
import com.includeslice.core.syntax.DeclKind;
import com.includeslice.core.syntax.NamedDecl;
import com.includeslice.core.syntax.TemplateSpecializationKind;
import com.includeslice.core.syntax.TopLevelDeclListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parser events relevant to the analysis: the top-level declarations written in the main file.
 *
 * These are the roots of the subtrees to traverse for uses. Traversing the whole unit
 * would find uses inside headers.
 */
public class RecordedAst {

    private final List<NamedDecl> topLevelDecls = new ArrayList<>();

    public TopLevelDeclListener record(AnalysisContext ctx) {
        SourceManager sm = ctx.sourceManager();
        return group -> {
            for (NamedDecl decl : group) {
                if (!sm.isWrittenInMainFile(sm.getExpansionLocation(decl.getLocation()))) continue;
                if (isImplicitInstantiation(decl)) continue;
                topLevelDecls.add(decl);
            }
            return true;
        };
    }

    public List<NamedDecl> getTopLevelDecls() {
        return Collections.unmodifiableList(topLevelDecls);
    }

    private static boolean isImplicitInstantiation(NamedDecl decl) {
        DeclKind kind = decl.getKind();
        boolean instantiable = kind.isFunction() || kind == DeclKind.CXX_RECORD || kind == DeclKind.VAR;
        return instantiable
            && decl.getTemplateSpecializationKind() == TemplateSpecializationKind.IMPLICIT_INSTANTIATION;
    }
}
