package com.martian.mro.loader.ast;

public final class OutParam extends Param {
    private final String outName;

    public OutParam(AstNode node, String tname, int arrayDim, String id, String help, String outName) {
        super(node, tname, arrayDim, id, help);
        this.outName = outName == null ? "" : outName;
    }

    @Override
    public String getOutName() {
        return outName;
    }

    @Override
    public String getMode() {
        return "out";
    }
}
