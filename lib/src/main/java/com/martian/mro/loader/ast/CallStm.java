package com.martian.mro.loader.ast;

import java.util.Objects;

/** A {@code call} statement. {@code decId} names the callable; {@code id} is the local name. */
public final class CallStm {
    private final AstNode node;
    private final String id;
    private final String decId;
    private final Modifiers modifiers;
    private final BindStms bindings;

    public CallStm(AstNode node, String id, String decId, Modifiers modifiers, BindStms bindings) {
        this.node = Objects.requireNonNull(node, "node");
        this.id = Objects.requireNonNull(id, "id");
        this.decId = Objects.requireNonNull(decId, "decId");
        this.modifiers = Objects.requireNonNull(modifiers, "modifiers");
        this.bindings = Objects.requireNonNull(bindings, "bindings");
    }

    public AstNode getNode() {
        return node;
    }

    public String getId() {
        return id;
    }

    public String getDecId() {
        return decId;
    }

    public Modifiers getModifiers() {
        return modifiers;
    }

    public BindStms getBindings() {
        return bindings;
    }
}
