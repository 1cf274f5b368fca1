package com.martian.mro.loader;

/** Grammar violation. Parsing stops at the first one. */
public final class MroParseException extends MroException {
    private final String expected;
    private final String found;

    public MroParseException(String detail, String sourceFilename, int line, String expected, String found) {
        this(detail, sourceFilename, line, expected, found, null);
    }

    public MroParseException(
            String detail, String sourceFilename, int line, String expected, String found, Throwable cause) {
        super(detail, sourceFilename, line, cause);
        this.expected = expected;
        this.found = found;
    }

    /** What the grammar would have accepted, or {@code null} when not known. */
    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
