package com.martian.mro.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A source file taking part in a compilation unit. Identity is the absolute path; the include
 * sites are back references used for diagnostics and include banners only.
 */
public final class SourceFile {

    /** An include directive that pulled this file into the unit. */
    public record IncludeSite(SourceFile file, AstNode node) {
        public IncludeSite {
            Objects.requireNonNull(file, "file");
            Objects.requireNonNull(node, "node");
        }
    }

    private final String fileName;
    private final String fullPath;
    private final List<IncludeSite> includedFrom = new ArrayList<>();

    public SourceFile(String fileName, String fullPath) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.fullPath = Objects.requireNonNull(fullPath, "fullPath");
    }

    public String getFileName() {
        return fileName;
    }

    public String getFullPath() {
        return fullPath;
    }

    public List<IncludeSite> getIncludedFrom() {
        return Collections.unmodifiableList(includedFrom);
    }

    public void addIncludeSite(IncludeSite site) {
        includedFrom.add(Objects.requireNonNull(site, "site"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceFile)) {
            return false;
        }
        return fullPath.equals(((SourceFile) obj).fullPath);
    }

    @Override
    public int hashCode() {
        return fullPath.hashCode();
    }

    @Override
    public String toString() {
        return fileName;
    }
}
