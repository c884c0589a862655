package com.includeslice.core.syntax;

import com.includeslice.core.source.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A call; the callee is usually a DeclRefExpr, MemberExpr or OverloadExpr. */
public class CallExpr extends Node {

    private final Node callee;
    private final List<Node> args;

    public CallExpr(SourceLocation location, Node callee, List<Node> args) {
        super(location);
        this.callee = callee;
        this.args = List.copyOf(args);
    }

    public Node getCallee() { return callee; }
    public List<Node> getArgs() { return args; }

    @Override
    public List<Node> children() {
        List<Node> result = new ArrayList<>(args.size() + 1);
        if (callee != null) result.add(callee);
        result.addAll(args);
        return Collections.unmodifiableList(result);
    }

    @Override
    protected boolean accept(SyntaxVisitor visitor) {
        return visitor.traverseCallExpr(this);
    }
}
