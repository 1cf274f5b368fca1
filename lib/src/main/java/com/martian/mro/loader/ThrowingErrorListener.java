package com.martian.mro.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;

final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        String text = "line " + line + ":" + (charPositionInLine + 1) + " " + msg;
        if (recognizer instanceof Lexer) {
            throw new SyntaxCancellation(text, line, true, null, null, e);
        }
        String found = offendingSymbol instanceof Token token ? token.getText() : null;
        String expected = null;
        if (recognizer instanceof Parser parser) {
            IntervalSet expectedTokens = e != null ? e.getExpectedTokens() : parser.getExpectedTokens();
            if (expectedTokens != null) {
                expected = expectedTokens.toString(parser.getVocabulary());
            }
        }
        throw new SyntaxCancellation(text, line, false, expected, found, e);
    }

    /** Carries the position of the first syntax error out of the ANTLR call stack. */
    static final class SyntaxCancellation extends ParseCancellationException {
        private final int line;
        private final boolean lexical;
        private final String expected;
        private final String found;

        SyntaxCancellation(
                String message, int line, boolean lexical, String expected, String found, Throwable cause) {
            super(message, cause);
            this.line = line;
            this.lexical = lexical;
            this.expected = expected;
            this.found = found;
        }

        int getLine() {
            return line;
        }

        boolean isLexical() {
            return lexical;
        }

        String getExpected() {
            return expected;
        }

        String getFound() {
            return found;
        }
    }
}
