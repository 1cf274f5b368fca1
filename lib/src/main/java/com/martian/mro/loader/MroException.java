package com.martian.mro.loader;

/**
 * Base of the checked exceptions raised while lexing, parsing or loading MRO sources. Carries the
 * source file and line when they are known (line 0 otherwise).
 */
public abstract class MroException extends Exception {
    private final String sourceFilename;
    private final int line;

    protected MroException(String detail, String sourceFilename, int line) {
        this(detail, sourceFilename, line, null);
    }

    protected MroException(String detail, String sourceFilename, int line, Throwable cause) {
        super(describe(detail, sourceFilename, line), cause);
        this.sourceFilename = sourceFilename;
        this.line = line;
    }

    public String getSourceFilename() {
        return sourceFilename;
    }

    public int getLine() {
        return line;
    }

    private static String describe(String detail, String sourceFilename, int line) {
        if (sourceFilename == null) {
            return detail;
        }
        if (line <= 0) {
            return sourceFilename + ": " + detail;
        }
        return sourceFilename + ":" + line + ": " + detail;
    }
}
