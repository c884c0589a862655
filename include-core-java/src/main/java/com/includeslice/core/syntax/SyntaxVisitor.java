package com.includeslice.core.syntax;

/**
 * Depth-first traversal over nodes and the types they mention.
 *
 * {@code traverse*} methods recurse; {@code visit*} hooks are called before a node's
 * children and return false to abort the whole traversal. Subclasses override the hooks
 * they care about, and override a {@code traverse*} method to change what gets recursed into.
 */
public abstract class SyntaxVisitor {

    public boolean traverse(Node node) {
        return node == null || node.accept(this);
    }

    public boolean traverseType(Type type) {
        return type == null || type.accept(this);
    }

    protected boolean traverseChildren(Node node) {
        for (Node child : node.children()) {
            if (!traverse(child)) return false;
        }
        return true;
    }

    // --- Declarations ---

    public boolean traverseDecl(NamedDecl decl) {
        if (!visitNamedDecl(decl)) return false;
        if (decl.getKind().isFunction() && !visitFunctionDecl(decl)) return false;
        return traverseChildren(decl);
    }

    public boolean traverseUsingDecl(UsingDecl decl) {
        if (!visitNamedDecl(decl)) return false;
        if (!visitUsingDecl(decl)) return false;
        return traverseChildren(decl);
    }

    // --- Expressions and statements ---

    public boolean traverseDeclRefExpr(DeclRefExpr expr) {
        return visitDeclRefExpr(expr) && traverseChildren(expr);
    }

    public boolean traverseMemberExpr(MemberExpr expr) {
        return visitMemberExpr(expr) && traverseChildren(expr);
    }

    public boolean traverseOverloadExpr(OverloadExpr expr) {
        return visitOverloadExpr(expr) && traverseChildren(expr);
    }

    public boolean traverseConstructExpr(ConstructExpr expr) {
        return visitConstructExpr(expr) && traverseChildren(expr);
    }

    public boolean traverseCallExpr(CallExpr expr) {
        return traverseChildren(expr);
    }

    public boolean traverseCompoundStmt(CompoundStmt stmt) {
        return traverseChildren(stmt);
    }

    public boolean traverseTypeLoc(TypeLoc typeLoc) {
        return traverseType(typeLoc.getType());
    }

    // --- Types ---

    public boolean traverseTagType(Type.TagType type) {
        return visitTagType(type);
    }

    public boolean traverseTypedefType(Type.TypedefType type) {
        return visitTypedefType(type);
    }

    public boolean traverseUsingType(Type.UsingType type) {
        return visitUsingType(type);
    }

    public boolean traverseTemplateSpecializationType(Type.TemplateSpecializationType type) {
        if (!visitTemplateSpecializationType(type)) return false;
        for (Type arg : type.args()) {
            if (!traverseType(arg)) return false;
        }
        return true;
    }

    public boolean traversePointerType(Type.PointerType type) {
        return traverseType(type.pointee());
    }

    // --- Hooks ---

    public boolean visitNamedDecl(NamedDecl decl)       { return true; }
    public boolean visitFunctionDecl(NamedDecl decl)    { return true; }
    public boolean visitUsingDecl(UsingDecl decl)       { return true; }
    public boolean visitDeclRefExpr(DeclRefExpr expr)   { return true; }
    public boolean visitMemberExpr(MemberExpr expr)     { return true; }
    public boolean visitOverloadExpr(OverloadExpr expr) { return true; }
    public boolean visitConstructExpr(ConstructExpr expr) { return true; }
    public boolean visitTagType(Type.TagType type)      { return true; }
    public boolean visitTypedefType(Type.TypedefType type) { return true; }
    public boolean visitUsingType(Type.UsingType type)  { return true; }
    public boolean visitTemplateSpecializationType(Type.TemplateSpecializationType type) { return true; }
}
