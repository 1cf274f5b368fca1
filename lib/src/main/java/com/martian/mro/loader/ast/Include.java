package com.martian.mro.loader.ast;

import java.util.Objects;

/** An {@code @include} directive. The path may be rewritten once after parsing. */
public final class Include {
    private final AstNode node;
    private String value;

    public Include(AstNode node, String value) {
        this.node = Objects.requireNonNull(node, "node");
        this.value = Objects.requireNonNull(value, "value");
    }

    public AstNode getNode() {
        return node;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }
}
