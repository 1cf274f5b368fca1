package com.martian.mro.format;

import com.martian.mro.loader.IncludeRewriteException;
import com.martian.mro.loader.ast.Ast;
import java.nio.file.Path;
import java.util.List;

/**
 * Rewrites the include directives of a freshly parsed file before it is formatted, for example
 * to make paths relative to one of the search directories.
 */
@FunctionalInterface
public interface IncludeRewriter {

    void rewrite(Ast ast, List<Path> searchPaths) throws IncludeRewriteException;
}
