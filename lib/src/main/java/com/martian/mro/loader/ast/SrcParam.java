package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

/** The {@code src} clause of a stage: language tag, executable path and extra arguments. */
public final class SrcParam {
    private final AstNode node;
    private final String lang;
    private final String path;
    private final List<String> args;

    public SrcParam(AstNode node, String lang, String path, List<String> args) {
        this.node = Objects.requireNonNull(node, "node");
        this.lang = Objects.requireNonNull(lang, "lang");
        this.path = Objects.requireNonNull(path, "path");
        this.args = List.copyOf(args);
    }

    public AstNode getNode() {
        return node;
    }

    public String getLang() {
        return lang;
    }

    public String getPath() {
        return path;
    }

    public List<String> getArgs() {
        return args;
    }
}
