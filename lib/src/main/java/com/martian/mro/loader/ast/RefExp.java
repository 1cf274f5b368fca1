package com.martian.mro.loader.ast;

import java.util.Objects;

/** {@code CALL.output} (output defaults to {@code "default"}) or {@code self.input}. */
public final class RefExp implements Exp {

    public enum Kind {
        CALL,
        SELF
    }

    private final AstNode node;
    private final Kind kind;
    private final String id;
    private final String outputId;

    private RefExp(AstNode node, Kind kind, String id, String outputId) {
        this.node = Objects.requireNonNull(node, "node");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.id = Objects.requireNonNull(id, "id");
        this.outputId = outputId;
    }

    public static RefExp call(AstNode node, String callId, String outputId) {
        return new RefExp(node, Kind.CALL, callId, outputId == null ? Param.DEFAULT_ID : outputId);
    }

    public static RefExp self(AstNode node, String inputId) {
        return new RefExp(node, Kind.SELF, inputId, null);
    }

    @Override
    public AstNode getNode() {
        return node;
    }

    public Kind getKind() {
        return kind;
    }

    /** The call id for {@link Kind#CALL}, the pipeline input id for {@link Kind#SELF}. */
    public String getId() {
        return id;
    }

    /** The referenced output of the call; {@code null} for self references. */
    public String getOutputId() {
        return outputId;
    }
}
