package com.martian.mro.loader.ast;

import java.util.Objects;

/** One {@code #} comment line as it appeared in the source, without its indentation. */
public final class CommentBlock {
    private final SourceLoc loc;
    private final String value;

    public CommentBlock(SourceLoc loc, String value) {
        this.loc = Objects.requireNonNull(loc, "loc");
        this.value = Objects.requireNonNull(value, "value");
    }

    public SourceLoc getLoc() {
        return loc;
    }

    public String getValue() {
        return value;
    }
}
