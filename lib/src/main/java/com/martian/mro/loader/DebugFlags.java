package com.martian.mro.loader;

import com.martian.mro.loader.grammar.MroLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

/**
 * Switches for looking inside the MRO front end. Each is read from a system property first and
 * an environment variable second:
 *
 * <ul>
 *   <li>{@code mro.debugTokens} / {@code MRO_DEBUG_TOKENS}: dump every token of each parsed file,
 *       comments included.
 *   <li>{@code mro.debugParser} / {@code MRO_DEBUG_PARSER}: install {@link ParserTraceListener}
 *       and append its entries to parse errors.
 * </ul>
 *
 * Captured output is kept per thread until drained.
 */
public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private enum Flag {
        TOKENS("mro.debugTokens", "MRO_DEBUG_TOKENS"),
        PARSER("mro.debugParser", "MRO_DEBUG_PARSER");

        private final String property;
        private final String env;

        Flag(String property, String env) {
            this.property = property;
            this.env = env;
        }

        boolean isSet() {
            String value = System.getProperty(property);
            if (value != null) {
                return Boolean.parseBoolean(value);
            }
            return Boolean.parseBoolean(System.getenv(env));
        }
    }

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return Flag.TOKENS.isSet();
    }

    public static boolean isParserTraceEnabled() {
        return Flag.PARSER.isSet();
    }

    /** Logs and captures one line per token; comments are marked as hidden. */
    public static void logTokens(String fileName, CommonTokenStream tokens, MroLexer lexer) {
        LOGGER.log(Level.FINE, "Tokens of {0}:", fileName);
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-12s%s %4d:%-3d -> %s",
                            symbolic,
                            token.getChannel() == Token.HIDDEN_CHANNEL ? " (hidden)" : "",
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            LOGGER.log(Level.FINE, "  {0}", line);
            CAPTURED_TOKENS.get().add(line);
        }
    }

    static ParserTraceListener parserTraceListener() {
        return new ParserTraceListener();
    }

    public static List<String> drainCapturedTokens() {
        return drain(CAPTURED_TOKENS);
    }

    static void captureDiagnostic(String message) {
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        return drain(CAPTURED_DIAGNOSTICS);
    }

    private static List<String> drain(ThreadLocal<List<String>> captured) {
        List<String> lines = new ArrayList<>(captured.get());
        captured.get().clear();
        return lines;
    }
}
