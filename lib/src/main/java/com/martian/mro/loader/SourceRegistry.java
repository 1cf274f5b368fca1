package com.martian.mro.loader;

import com.martian.mro.loader.ast.Include;
import com.martian.mro.loader.ast.SourceFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Maps absolute paths to {@link SourceFile}s and resolves include directives to files. */
public final class SourceRegistry {
    private final Map<String, SourceFile> files = new HashMap<>();
    private final List<Path> searchPaths;

    public SourceRegistry(List<Path> searchPaths) {
        this.searchPaths = List.copyOf(Objects.requireNonNull(searchPaths, "searchPaths"));
    }

    /** Returns the file registered for {@code path}, creating it on first reference. */
    public SourceFile register(Path path, String displayName) {
        String fullPath = path.toAbsolutePath().normalize().toString();
        return files.computeIfAbsent(fullPath, key -> new SourceFile(displayName, key));
    }

    /**
     * Resolves an include relative to the including file first, then along the search path.
     *
     * @throws IncludeNotFoundException if no candidate exists
     */
    public Path resolve(Include include, SourceFile from) throws IncludeNotFoundException {
        Path requested = Path.of(include.getValue());
        if (requested.isAbsolute()) {
            if (Files.isRegularFile(requested)) {
                return requested.normalize();
            }
        } else {
            Path parent = Path.of(from.getFullPath()).getParent();
            Path candidate = parent != null ? parent.resolve(requested) : requested.toAbsolutePath();
            if (Files.isRegularFile(candidate)) {
                return candidate.normalize();
            }
            for (Path dir : searchPaths) {
                candidate = dir.resolve(requested);
                if (Files.isRegularFile(candidate)) {
                    return candidate.toAbsolutePath().normalize();
                }
            }
        }
        throw new IncludeNotFoundException(
                include.getValue(), from.getFileName(), include.getNode().getLoc().getLine());
    }
}
