package com.martian.mro.loader;

public final class UnresolvedReferenceException extends MroException {
    public UnresolvedReferenceException(String detail, String sourceFilename, int line) {
        super(detail, sourceFilename, line);
    }
}
