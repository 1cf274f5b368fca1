package com.martian.mro.loader.ast;

import java.util.Objects;

public final class SourceLoc {
    private final int line;
    private final SourceFile file;

    public SourceLoc(int line, SourceFile file) {
        this.line = line;
        this.file = Objects.requireNonNull(file, "file");
    }

    public int getLine() {
        return line;
    }

    public SourceFile getFile() {
        return file;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLoc)) {
            return false;
        }
        SourceLoc other = (SourceLoc) obj;
        return line == other.line && file.equals(other.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, file);
    }

    @Override
    public String toString() {
        return file.getFileName() + ":" + line;
    }
}
