package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

public final class Pipeline implements Callable {
    private final AstNode node;
    private final String id;
    private final List<InParam> inParams;
    private final List<OutParam> outParams;
    private final List<CallStm> calls;
    private final Callables callables = new Callables();
    private final ReturnStm ret;
    private final PipelineRetains retain;

    public Pipeline(
            AstNode node,
            String id,
            List<InParam> inParams,
            List<OutParam> outParams,
            List<CallStm> calls,
            ReturnStm ret,
            PipelineRetains retain) {
        this.node = Objects.requireNonNull(node, "node");
        this.id = Objects.requireNonNull(id, "id");
        this.inParams = List.copyOf(inParams);
        this.outParams = List.copyOf(outParams);
        this.calls = List.copyOf(calls);
        this.ret = Objects.requireNonNull(ret, "ret");
        this.retain = retain;
    }

    @Override
    public AstNode getNode() {
        return node;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public List<InParam> getInParams() {
        return inParams;
    }

    @Override
    public List<OutParam> getOutParams() {
        return outParams;
    }

    public List<CallStm> getCalls() {
        return calls;
    }

    /** Callables named by this pipeline's calls; filled in by the semantic check. */
    public Callables getCallables() {
        return callables;
    }

    public ReturnStm getRet() {
        return ret;
    }

    public PipelineRetains getRetain() {
        return retain;
    }
}
