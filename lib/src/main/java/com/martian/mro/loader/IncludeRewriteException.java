package com.martian.mro.loader;

/** Raised by an {@link com.martian.mro.format.IncludeRewriter} that cannot rewrite a file's includes. */
public final class IncludeRewriteException extends MroException {

    public IncludeRewriteException(String detail, String sourceFilename, int line) {
        super(detail, sourceFilename, line);
    }

    public IncludeRewriteException(String detail, String sourceFilename, int line, Throwable cause) {
        super(detail, sourceFilename, line, cause);
    }
}
