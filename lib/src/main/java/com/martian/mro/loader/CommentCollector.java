package com.martian.mro.loader;

import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.CommentBlock;
import com.martian.mro.loader.ast.SourceFile;
import com.martian.mro.loader.ast.SourceLoc;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Collects the hidden-channel comments of one file and hands them to the nodes that follow them.
 *
 * <p>Every run of comments is keyed by the index of the next default-channel token. A node built
 * from a construct starting at that token claims the run, together with any earlier runs that sit
 * in front of tokens no node starts at (a closing bracket, {@code ) split (}, {@code ) using (}).
 * Nodes must therefore be claimed in source order. Runs after the last node stay in the file's pool
 * and end up in {@link com.martian.mro.loader.ast.Ast#getComments()}.
 */
final class CommentCollector {
    private final SourceFile file;
    private final NavigableMap<Integer, Run> pending = new TreeMap<>();

    /** Comments in front of one token, and the line of that token. */
    private record Run(int anchorLine, List<CommentBlock> comments) {}

    CommentCollector(SourceFile file, CommonTokenStream tokens) {
        this.file = file;
        List<CommentBlock> run = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getChannel() == Token.HIDDEN_CHANNEL) {
                run.add(new CommentBlock(new SourceLoc(token.getLine(), file), token.getText().stripTrailing()));
            } else if (!run.isEmpty()) {
                pending.put(token.getTokenIndex(), new Run(token.getLine(), run));
                run = new ArrayList<>();
            }
        }
    }

    /** Builds a node located at {@code start}, attaching any comments that precede it. */
    AstNode claim(Token start) {
        SourceLoc loc = new SourceLoc(start.getLine(), file);
        NavigableMap<Integer, Run> claimed = pending.headMap(start.getTokenIndex(), true);
        if (claimed.isEmpty()) {
            return new AstNode(loc);
        }
        List<CommentBlock> run = new ArrayList<>();
        for (Run earlier : claimed.values()) {
            run.addAll(earlier.comments());
        }
        // A run carried over from a token nothing starts at is attached relative to that token.
        int expectedLine = claimed.lastEntry().getValue().anchorLine() - 1;
        claimed.clear();
        Deque<String> attached = new ArrayDeque<>();
        int split = run.size();
        while (split > 0 && run.get(split - 1).getLoc().getLine() == expectedLine) {
            split--;
            attached.addFirst(run.get(split).getValue());
            expectedLine--;
        }
        return new AstNode(loc, new ArrayList<>(attached), run.subList(0, split));
    }

    /** Builds a node located at {@code start} without taking its comments. */
    AstNode locate(Token start) {
        return new AstNode(new SourceLoc(start.getLine(), file));
    }

    /** Comments no node claimed, in source order. */
    List<CommentBlock> unclaimed() {
        List<CommentBlock> rest = new ArrayList<>();
        for (Run run : pending.values()) {
            rest.addAll(run.comments());
        }
        return rest;
    }
}
