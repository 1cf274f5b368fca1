package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

/** Pipeline-level {@code retain (...)}: references whose targets are kept past cleanup. */
public final class PipelineRetains {
    private final AstNode node;
    private final List<RefExp> refs;

    public PipelineRetains(AstNode node, List<RefExp> refs) {
        this.node = Objects.requireNonNull(node, "node");
        this.refs = List.copyOf(refs);
    }

    public AstNode getNode() {
        return node;
    }

    public List<RefExp> getRefs() {
        return refs;
    }
}
