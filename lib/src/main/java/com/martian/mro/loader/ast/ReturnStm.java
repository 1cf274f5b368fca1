package com.martian.mro.loader.ast;

import java.util.Objects;

public final class ReturnStm {
    private final AstNode node;
    private final BindStms bindings;

    public ReturnStm(AstNode node, BindStms bindings) {
        this.node = Objects.requireNonNull(node, "node");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
    }

    public AstNode getNode() {
        return node;
    }

    public BindStms getBindings() {
        return bindings;
    }
}
