package com.includeslice.core.analysis;

import com.includeslice.core.model.Hinted;
import com.includeslice.core.source.SourceLocation;
import com.includeslice.core.syntax.ConstructExpr;
import com.includeslice.core.syntax.DeclRefExpr;
import com.includeslice.core.syntax.MemberExpr;
import com.includeslice.core.syntax.NamedDecl;
import com.includeslice.core.syntax.OverloadExpr;
import com.includeslice.core.syntax.SyntaxVisitor;
import com.includeslice.core.syntax.Type;
import com.includeslice.core.syntax.TypeLoc;
import com.includeslice.core.syntax.UsingDecl;

/**
 * Traverses part of the syntax tree, reporting the declarations it references.
 */
public class ReferenceWalker extends SyntaxVisitor {

    /** Receives each reference with the canonical declaration it names. */
    @FunctionalInterface
    public interface DeclCallback {
        void accept(SourceLocation location, Hinted<NamedDecl> decl);
    }

    private final AnalysisContext ctx;
    private final DeclCallback callback;

    // Types carry no location: the enclosing TypeLoc or construct expression stashes it here.
    private SourceLocation locationOfType = SourceLocation.INVALID;

    public ReferenceWalker(AnalysisContext ctx, DeclCallback callback) {
        this.ctx = ctx;
        this.callback = callback;
    }

    public static void walk(AnalysisContext ctx, NamedDecl root, DeclCallback callback) {
        new ReferenceWalker(ctx, callback).traverse(root);
    }

    @Override
    public boolean visitDeclRefExpr(DeclRefExpr expr) {
        if (!ctx.policy().operators()) {
            NamedDecl fn = expr.getFoundDecl() == null ? null : expr.getFoundDecl().getAsFunction();
            if (fn != null && fn.isOverloadedOperator()) return true;
        }
        report(expr.getLocation(), expr.getFoundDecl());
        return true;
    }

    @Override
    public boolean visitMemberExpr(MemberExpr expr) {
        if (ctx.policy().members()) {
            report(expr.getLocation(), expr.getFoundDecl());
        }
        return true;
    }

    @Override
    public boolean visitFunctionDecl(NamedDecl decl) {
        // A function definition references its declaration.
        if (decl.isThisDeclarationADefinition() && decl.getCanonicalDecl() != decl) {
            report(decl.getLocation(), decl.getCanonicalDecl());
        }
        return true;
    }

    @Override
    public boolean visitUsingDecl(UsingDecl decl) {
        for (NamedDecl target : decl.getShadowTargets()) {
            report(decl.getLocation(), target);
        }
        return true;
    }

    @Override
    public boolean visitOverloadExpr(OverloadExpr expr) {
        if (expr.isMemberOverload() && !ctx.policy().members()) return true;
        for (NamedDecl candidate : expr.decls()) {
            report(expr.getLocation(), candidate);
        }
        return true;
    }

    @Override
    public boolean traverseConstructExpr(ConstructExpr expr) {
        if (ctx.policy().construction()) {
            SourceLocation saved = locationOfType;
            locationOfType = expr.getLocation();
            try {
                if (!traverseType(expr.getType())) return false;
            } finally {
                locationOfType = saved;
            }
        }
        return super.traverseConstructExpr(expr);
    }

    // Written types stash their location for the visit*Type hooks below.
    // Construct expressions reach their unwritten type the same way.
    @Override
    public boolean traverseTypeLoc(TypeLoc typeLoc) {
        SourceLocation saved = locationOfType;
        locationOfType = typeLoc.getLocation();
        try {
            return super.traverseTypeLoc(typeLoc);
        } finally {
            locationOfType = saved;
        }
    }

    @Override
    public boolean visitTagType(Type.TagType type) {
        report(locationOfType, type.decl());
        return true;
    }

    @Override
    public boolean visitTemplateSpecializationType(Type.TemplateSpecializationType type) {
        report(locationOfType, type.templateDecl());   // primary template
        report(locationOfType, type.specialization()); // specialization, if resolved
        return true;
    }

    @Override
    public boolean visitUsingType(Type.UsingType type) {
        report(locationOfType, type.foundDecl());
        return true;
    }

    @Override
    public boolean visitTypedefType(Type.TypedefType type) {
        report(locationOfType, type.decl());
        return true;
    }

    private void report(SourceLocation location, NamedDecl decl) {
        if (decl == null) return;
        UseLocations.attribute(location)
            .ifPresent(loc -> callback.accept(loc, Hinted.of(decl.getCanonicalDecl())));
    }
}
