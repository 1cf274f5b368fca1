package com.martian.mro.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.martian.mro.loader.grammar.MroLexer;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.junit.jupiter.api.Test;

class MroLexerTest {

    @Test
    void includeDirectiveProducesIncludeAndStringTokens() {
        assertEquals(List.of("INCLUDE", "STRING", "EOF"), symbolicNames("@include \"path/to/file.mro\"\n"));
    }

    @Test
    void commentsGoToHiddenChannel() {
        String source = "# header\nfiletype json; # trailing\n";
        MroLexer lexer = new MroLexer(CharStreams.fromString(source, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> hidden = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getChannel() == Token.HIDDEN_CHANNEL) {
                hidden.add(token.getLine() + ":" + token.getText());
            }
        }
        assertEquals(List.of("1:# header", "2:# trailing"), hidden);
        assertEquals(List.of("FILETYPE", "ID", "SEMICOLON", "EOF"), symbolicNames(source));
    }

    @Test
    void numbersSplitIntoIntAndFloat() {
        assertEquals(
                List.of("INT", "INT", "FLOAT", "FLOAT", "FLOAT", "EOF"),
                symbolicNames("42 -7 1.5 5e-10 -.25"));
    }

    @Test
    void keywordsLexAsKeywords() {
        assertEquals(
                List.of("CALL", "LOCAL", "ID", "AS", "ID", "LPAREN", "RPAREN", "USING", "LPAREN", "RPAREN", "EOF"),
                symbolicNames("call local STAGE as ALIAS() using ()"));
    }

    private static List<String> symbolicNames(String source) {
        MroLexer lexer = new MroLexer(CharStreams.fromString(source, "test"));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();

        List<String> symbolic = new ArrayList<>();
        for (Token token : tokens.getTokens()) {
            if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                continue;
            }
            if (token.getType() == Token.EOF) {
                symbolic.add("EOF");
            } else {
                symbolic.add(lexer.getVocabulary().getSymbolicName(token.getType()));
            }
        }
        return symbolic;
    }
}
