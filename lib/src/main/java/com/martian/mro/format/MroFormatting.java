package com.martian.mro.format;

import com.martian.mro.loader.MroAstBuilder;
import com.martian.mro.loader.MroException;
import com.martian.mro.loader.MroLoader;
import com.martian.mro.loader.ast.Ast;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Entry points that go from source text or files to canonical MRO text. */
public final class MroFormatting {

    private MroFormatting() {}

    /** Formats one file as written. Include directives are kept and not followed. */
    public static String formatFile(Path file, IncludeRewriter rewriter, List<Path> searchPaths)
            throws IOException, MroException {
        String source = Files.readString(file, StandardCharsets.UTF_8);
        return formatSource(source, file.toString(), rewriter, searchPaths);
    }

    public static String formatSource(
            String source, String fileName, IncludeRewriter rewriter, List<Path> searchPaths)
            throws MroException {
        Ast ast = new MroAstBuilder().parse(fileName, source);
        if (rewriter != null) {
            rewriter.rewrite(ast, searchPaths);
        }
        return new MroFormatter().format(ast, true);
    }

    /** Formats {@code root} with everything it includes inlined, marking each file boundary. */
    public static String formatFlattened(Path root, List<Path> searchPaths) throws IOException, MroException {
        Ast ast = new MroLoader().load(root, searchPaths);
        return new MroFormatter().format(ast, false);
    }
}
