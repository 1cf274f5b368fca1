package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

public final class Stage implements Callable {
    private final AstNode node;
    private final String id;
    private final List<InParam> inParams;
    private final List<OutParam> outParams;
    private final SrcParam src;
    private final boolean split;
    private final List<InParam> chunkIns;
    private final List<OutParam> chunkOuts;
    private final Resources resources;
    private final RetainParams retain;

    public Stage(
            AstNode node,
            String id,
            List<InParam> inParams,
            List<OutParam> outParams,
            SrcParam src,
            boolean split,
            List<InParam> chunkIns,
            List<OutParam> chunkOuts,
            Resources resources,
            RetainParams retain) {
        this.node = Objects.requireNonNull(node, "node");
        this.id = Objects.requireNonNull(id, "id");
        this.inParams = List.copyOf(inParams);
        this.outParams = List.copyOf(outParams);
        this.src = Objects.requireNonNull(src, "src");
        this.split = split;
        this.chunkIns = List.copyOf(chunkIns);
        this.chunkOuts = List.copyOf(chunkOuts);
        this.resources = resources;
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

    public SrcParam getSrc() {
        return src;
    }

    public boolean isSplit() {
        return split;
    }

    public List<InParam> getChunkIns() {
        return chunkIns;
    }

    public List<OutParam> getChunkOuts() {
        return chunkOuts;
    }

    /** Returns the resource hints, or {@code null} when the stage has no {@code using} clause. */
    public Resources getResources() {
        return resources;
    }

    /** Returns the retained outputs, or {@code null} when the stage has no {@code retain} clause. */
    public RetainParams getRetain() {
        return retain;
    }
}
