package com.martian.mro.loader.ast;

import java.util.Objects;

/**
 * Resource hints from a stage's {@code using (...)} clause. A field is present exactly when its
 * node is non-null; zero is a legitimate explicit value.
 */
public final class Resources {
    private final AstNode node;
    private AstNode threadNode;
    private int threads;
    private AstNode memNode;
    private int memGb;
    private AstNode specialNode;
    private String special = "";
    private AstNode volatileNode;

    public Resources(AstNode node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public AstNode getNode() {
        return node;
    }

    public AstNode getThreadNode() {
        return threadNode;
    }

    public int getThreads() {
        return threads;
    }

    public void setThreads(AstNode threadNode, int threads) {
        this.threadNode = Objects.requireNonNull(threadNode, "threadNode");
        this.threads = threads;
    }

    public AstNode getMemNode() {
        return memNode;
    }

    public int getMemGb() {
        return memGb;
    }

    public void setMemGb(AstNode memNode, int memGb) {
        this.memNode = Objects.requireNonNull(memNode, "memNode");
        this.memGb = memGb;
    }

    public AstNode getSpecialNode() {
        return specialNode;
    }

    public String getSpecial() {
        return special;
    }

    public void setSpecial(AstNode specialNode, String special) {
        this.specialNode = Objects.requireNonNull(specialNode, "specialNode");
        this.special = Objects.requireNonNull(special, "special");
    }

    public AstNode getVolatileNode() {
        return volatileNode;
    }

    public boolean isStrictVolatile() {
        return volatileNode != null;
    }

    public void setStrictVolatile(AstNode volatileNode) {
        this.volatileNode = Objects.requireNonNull(volatileNode, "volatileNode");
    }
}
