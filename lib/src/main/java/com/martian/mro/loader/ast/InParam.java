package com.martian.mro.loader.ast;

public final class InParam extends Param {

    public InParam(AstNode node, String tname, int arrayDim, String id, String help) {
        super(node, tname, arrayDim, id, help);
    }

    @Override
    public String getMode() {
        return "in";
    }
}
