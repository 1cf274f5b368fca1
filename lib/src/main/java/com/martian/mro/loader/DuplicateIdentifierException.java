package com.martian.mro.loader;

public final class DuplicateIdentifierException extends MroException {
    private final String identifier;

    public DuplicateIdentifierException(String what, String identifier, String sourceFilename, int line) {
        super("duplicate " + what + " '" + identifier + "'", sourceFilename, line);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
