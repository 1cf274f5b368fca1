package com.martian.mro.loader;

public final class CyclicIncludeException extends MroException {
    public CyclicIncludeException(String includedPath, String sourceFilename, int line) {
        super("include cycle through " + includedPath, sourceFilename, line);
    }
}
