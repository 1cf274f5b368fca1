package com.martian.mro.format;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.AstNode;
import com.martian.mro.loader.ast.CommentBlock;
import com.martian.mro.loader.ast.SourceFile;
import com.martian.mro.loader.ast.SourceLoc;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output buffer for one formatting run. Tracks the location of the last printed node so that
 * pooled comments of a file are flushed, and an include banner written, when output moves on to
 * nodes from another file.
 */
final class Printer {
    private final StringBuilder out = new StringBuilder();
    private final Map<String, List<CommentBlock>> pooled = new LinkedHashMap<>();
    private SourceLoc lastLoc;

    Printer(Ast ast) {
        for (CommentBlock comment : ast.getComments()) {
            pooled.computeIfAbsent(comment.getLoc().getFile().getFullPath(), k -> new ArrayList<>())
                    .add(comment);
        }
        Iterator<SourceFile> files = ast.getFiles().values().iterator();
        if (files.hasNext()) {
            lastLoc = new SourceLoc(0, rootOf(files.next()));
        }
    }

    private static SourceFile rootOf(SourceFile file) {
        Set<SourceFile> seen = new HashSet<>();
        while (!file.getIncludedFrom().isEmpty() && seen.add(file)) {
            file = file.getIncludedFrom().get(0).file();
        }
        return file;
    }

    StringBuilder out() {
        return out;
    }

    Printer append(String text) {
        out.append(text);
        return this;
    }

    Printer append(char c) {
        out.append(c);
        return this;
    }

    /** Writes the comments that precede {@code node}, each line starting with {@code prefix}. */
    void printComments(AstNode node, String prefix) {
        SourceLoc loc = node.getLoc();
        if (lastLoc != null && !lastLoc.getFile().equals(loc.getFile())) {
            dumpComments(lastLoc.getFile());
            out.append("#\n# @include \"").append(loc.getFile().getFileName()).append("\"\n#\n\n");
        }
        CommentBlock previous = null;
        for (CommentBlock comment : node.getScopeComments()) {
            // Blocks that were separated by blank lines stay separated.
            if (previous != null && comment.getLoc().getLine() - previous.getLoc().getLine() >= 2) {
                out.append(MroFormatter.NEWLINE);
            }
            out.append(prefix).append(comment.getValue()).append(MroFormatter.NEWLINE);
            previous = comment;
        }
        if (!node.getScopeComments().isEmpty()) {
            out.append(MroFormatter.NEWLINE);
        }
        for (String comment : node.getComments()) {
            out.append(prefix).append(comment).append(MroFormatter.NEWLINE);
        }
        lastLoc = loc;
    }

    private void dumpComments(SourceFile file) {
        List<CommentBlock> comments = pooled.remove(file.getFullPath());
        if (comments != null) {
            for (CommentBlock comment : comments) {
                out.append(comment.getValue()).append(MroFormatter.NEWLINE);
            }
        }
    }

    /** Writes every pooled comment not yet flushed. */
    void dumpComments() {
        for (List<CommentBlock> comments : pooled.values()) {
            for (CommentBlock comment : comments) {
                out.append(comment.getValue()).append(MroFormatter.NEWLINE);
            }
        }
        pooled.clear();
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
