package com.martian.mro.loader.ast;

import java.util.List;
import java.util.Objects;

/**
 * Header shared by every syntactic construct.
 *
 * <p>{@code comments} is the run of comment lines directly above the construct; {@code
 * scopeComments} are earlier comment lines separated from it by at least one blank line. Both
 * are always on lines before {@link #getLoc()}.
 */
public final class AstNode {
    private final SourceLoc loc;
    private final List<String> comments;
    private final List<CommentBlock> scopeComments;

    public AstNode(SourceLoc loc) {
        this(loc, List.of(), List.of());
    }

    public AstNode(SourceLoc loc, List<String> comments, List<CommentBlock> scopeComments) {
        this.loc = Objects.requireNonNull(loc, "loc");
        this.comments = List.copyOf(comments);
        this.scopeComments = List.copyOf(scopeComments);
    }

    public SourceLoc getLoc() {
        return loc;
    }

    public List<String> getComments() {
        return comments;
    }

    public List<CommentBlock> getScopeComments() {
        return scopeComments;
    }
}
