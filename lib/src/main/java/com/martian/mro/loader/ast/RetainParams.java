package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

/** Stage-level {@code retain (...)}: outputs kept past normal cleanup. */
public final class RetainParams {

    public record RetainParam(AstNode node, String id) {
        public RetainParam {
            Objects.requireNonNull(node, "node");
            Objects.requireNonNull(id, "id");
        }
    }

    private final AstNode node;
    private final List<RetainParam> params;

    public RetainParams(AstNode node, List<RetainParam> params) {
        this.node = Objects.requireNonNull(node, "node");
        this.params = List.copyOf(params);
    }

    public AstNode getNode() {
        return node;
    }

    public List<RetainParam> getParams() {
        return params;
    }
}
