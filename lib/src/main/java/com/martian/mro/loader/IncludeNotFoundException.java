package com.martian.mro.loader;

public final class IncludeNotFoundException extends MroException {
    private final String includePath;

    public IncludeNotFoundException(String includePath, String sourceFilename, int line) {
        super("cannot find included file \"" + includePath + "\"", sourceFilename, line);
        this.includePath = includePath;
    }

    public String getIncludePath() {
        return includePath;
    }
}
