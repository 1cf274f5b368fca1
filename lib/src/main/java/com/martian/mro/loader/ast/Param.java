package com.martian.mro.loader.ast;

import java.util.Objects;

public sealed abstract class Param permits InParam, OutParam {

    /** Identifier given to an unnamed parameter. */
    public static final String DEFAULT_ID = "default";

    private final AstNode node;
    private final String tname;
    private final int arrayDim;
    private final String id;
    private final String help;

    protected Param(AstNode node, String tname, int arrayDim, String id, String help) {
        this.node = Objects.requireNonNull(node, "node");
        this.tname = Objects.requireNonNull(tname, "tname");
        this.arrayDim = arrayDim;
        this.id = id == null ? DEFAULT_ID : id;
        this.help = help == null ? "" : help;
    }

    public AstNode getNode() {
        return node;
    }

    public String getTname() {
        return tname;
    }

    public int getArrayDim() {
        return arrayDim;
    }

    public String getId() {
        return id;
    }

    public boolean isDefault() {
        return DEFAULT_ID.equals(id);
    }

    public String getHelp() {
        return help;
    }

    public String getOutName() {
        return "";
    }

    public abstract String getMode();
}
