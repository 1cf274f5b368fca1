package com.martian.mro.loader.ast;

import java.util.Objects;

/** A {@code filetype} declaration. */
public final class UserType implements Dec {
    private final AstNode node;
    private final String id;

    public UserType(AstNode node, String id) {
        this.node = Objects.requireNonNull(node, "node");
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public AstNode getNode() {
        return node;
    }

    @Override
    public String getId() {
        return id;
    }
}
