package com.martian.mro.loader;

/** Invalid character or unterminated string literal. */
public final class MroLexException extends MroException {
    public MroLexException(String detail, String sourceFilename, int line, Throwable cause) {
        super(detail, sourceFilename, line, cause);
    }
}
