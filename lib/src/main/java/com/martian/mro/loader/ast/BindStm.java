package com.martian.mro.loader.ast;

import java.util.Objects;

/**
 * Binds an expression to a parameter. When {@code sweep} is set the expression is an array
 * literal holding the alternatives to fork over.
 */
public final class BindStm {
    private final AstNode node;
    private final String id;
    private final Exp exp;
    private final boolean sweep;

    public BindStm(AstNode node, String id, Exp exp, boolean sweep) {
        this.node = Objects.requireNonNull(node, "node");
        this.id = Objects.requireNonNull(id, "id");
        this.exp = Objects.requireNonNull(exp, "exp");
        this.sweep = sweep;
    }

    public AstNode getNode() {
        return node;
    }

    public String getId() {
        return id;
    }

    public Exp getExp() {
        return exp;
    }

    public boolean isSweep() {
        return sweep;
    }
}
