package com.martian.mro.loader;

import java.util.BitSet;
import java.util.Locale;
import java.util.logging.Logger;
import org.antlr.v4.runtime.DiagnosticErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.ATNConfigSet;
import org.antlr.v4.runtime.dfa.DFA;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Parser trace installed when {@link DebugFlags#isParserTraceEnabled()} is set.
 *
 * <p>Each syntax error is recorded together with the chain of MRO rules being parsed (for example
 * {@code inParam < stageDec < dec < mroFile}), and prediction conflicts between soft keywords and
 * identifiers such as {@code call local(...)} against {@code call local STAGE(...)} are recorded
 * rather than reported through {@link Parser#notifyErrorListeners(String)}, which would reach
 * {@link ThrowingErrorListener}. {@link MroAstBuilder} appends the recorded entries to the parse
 * error message.
 */
final class ParserTraceListener extends DiagnosticErrorListener {
    private static final Logger LOGGER = Logger.getLogger(ParserTraceListener.class.getName());

    ParserTraceListener() {
        super(true);
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        String rules =
                recognizer instanceof Parser parser
                        ? String.join(" < ", parser.getRuleInvocationStack())
                        : "lexer";
        record(line, String.format(Locale.ROOT, "%s in %s", msg, rules));
    }

    @Override
    public void reportAmbiguity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            boolean exact,
            BitSet ambigAlts,
            ATNConfigSet configs) {
        if (exactOnly && !exact) {
            return;
        }
        record(
                lineOf(recognizer, startIndex),
                String.format(
                        Locale.ROOT,
                        "ambiguous %s between alternatives %s at '%s'",
                        getDecisionDescription(recognizer, dfa),
                        getConflictingAlts(ambigAlts, configs),
                        textOf(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportAttemptingFullContext(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            BitSet conflictingAlts,
            ATNConfigSet configs) {
        record(
                lineOf(recognizer, startIndex),
                String.format(
                        Locale.ROOT,
                        "full-context retry of %s at '%s'",
                        getDecisionDescription(recognizer, dfa),
                        textOf(recognizer, startIndex, stopIndex)));
    }

    @Override
    public void reportContextSensitivity(
            Parser recognizer,
            DFA dfa,
            int startIndex,
            int stopIndex,
            int prediction,
            ATNConfigSet configs) {
        record(
                lineOf(recognizer, startIndex),
                String.format(
                        Locale.ROOT,
                        "%s resolved to alternative %d only with full context at '%s'",
                        getDecisionDescription(recognizer, dfa),
                        prediction,
                        textOf(recognizer, startIndex, stopIndex)));
    }

    private static int lineOf(Parser recognizer, int tokenIndex) {
        return recognizer.getTokenStream().get(tokenIndex).getLine();
    }

    private static String textOf(Parser recognizer, int startIndex, int stopIndex) {
        return recognizer.getTokenStream().getText(Interval.of(startIndex, stopIndex));
    }

    private static void record(int line, String detail) {
        String entry = "line " + line + ": " + detail;
        LOGGER.fine(entry);
        DebugFlags.captureDiagnostic(entry);
    }
}
