package com.martian.mro.loader;

import com.martian.mro.loader.ast.Ast;
import com.martian.mro.loader.ast.Callable;
import com.martian.mro.loader.ast.Include;
import com.martian.mro.loader.ast.SourceFile;
import com.martian.mro.loader.ast.UserType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads a top-level MRO file together with everything it includes into a single {@link Ast}.
 *
 * <p>Each include directive is replaced by the declarations of its target, depth first, so
 * included declarations precede those of the including file. Every file is parsed once no matter
 * how many times it is included.
 */
public final class MroLoader {
    private static final Logger LOGGER = Logger.getLogger(MroLoader.class.getName());

    private final MroAstBuilder astBuilder = new MroAstBuilder();

    public Ast load(Path rootFile, List<Path> searchPaths) throws IOException, MroException {
        Objects.requireNonNull(rootFile, "rootFile");
        LoaderState state = new LoaderState(new SourceRegistry(searchPaths));
        SourceFile root = state.registry.register(rootFile, rootFile.toString());
        Ast rootAst = processFile(root, state);
        for (Include include : rootAst.getIncludes()) {
            state.merged.addInclude(include);
        }
        state.merged.setCall(rootAst.getCall());
        return state.merged;
    }

    private Ast processFile(SourceFile file, LoaderState state) throws IOException, MroException {
        state.activeFiles.add(file);
        String contents = Files.readString(Path.of(file.getFullPath()), StandardCharsets.UTF_8);
        Ast fileAst = astBuilder.parse(file, contents, state.interner);
        state.merged.addFile(file);

        for (Include include : fileAst.getIncludes()) {
            Path resolved = state.registry.resolve(include, file);
            SourceFile target = state.registry.register(resolved, include.getValue());
            target.addIncludeSite(new SourceFile.IncludeSite(file, include.getNode()));
            if (state.activeFiles.contains(target)) {
                throw new CyclicIncludeException(
                        include.getValue(), file.getFileName(), include.getNode().getLoc().getLine());
            }
            if (state.loadedFiles.contains(target)) {
                LOGGER.log(
                        Level.FINE,
                        "Skipping {0} included again from {1}",
                        new Object[] {target.getFileName(), file.getFileName()});
                continue;
            }
            LOGGER.log(
                    Level.FINE,
                    "Loading {0} included from {1}",
                    new Object[] {target.getFileName(), file.getFileName()});
            Ast included = processFile(target, state);
            if (included.getCall() != null) {
                throw new MroParseException(
                        "included file may not contain a top-level call",
                        target.getFileName(),
                        included.getCall().getNode().getLoc().getLine(),
                        "declaration",
                        "call");
            }
        }

        merge(fileAst, state.merged);
        state.activeFiles.remove(file);
        state.loadedFiles.add(file);
        return fileAst;
    }

    private static void merge(Ast source, Ast target) throws DuplicateIdentifierException {
        for (UserType userType : source.getUserTypes()) {
            target.addUserType(userType);
        }
        for (Callable callable : source.getCallables().getList()) {
            Callable existing = target.getCallables().add(callable);
            if (existing != null) {
                throw new DuplicateIdentifierException(
                        "callable",
                        callable.getId(),
                        callable.getNode().getLoc().getFile().getFileName(),
                        callable.getNode().getLoc().getLine());
            }
        }
        target.addComments(source.getComments());
    }

    private static final class LoaderState {
        final SourceRegistry registry;
        final StringInterner interner = new StringInterner();
        final Ast merged = new Ast();
        final Set<SourceFile> activeFiles = new HashSet<>();
        final Set<SourceFile> loadedFiles = new HashSet<>();

        LoaderState(SourceRegistry registry) {
            this.registry = registry;
        }
    }
}
