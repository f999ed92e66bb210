package org.perlcheck.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static String concat(List<LexerToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (LexerToken token : tokens) {
            if (token.type != LexerTokenType.EOF) {
                sb.append(token.text);
            }
        }
        return sb.toString();
    }

    @Test
    public void testSimpleStatement() {
        List<LexerToken> tokens = new Lexer("my $x = 1;").tokenize();

        assertEquals(10, tokens.size());
        assertTrue(tokens.get(0).is(LexerTokenType.IDENTIFIER, "my"));
        assertEquals(LexerTokenType.WHITESPACE, tokens.get(1).type);
        assertTrue(tokens.get(2).is(LexerTokenType.OPERATOR, "$"));
        assertTrue(tokens.get(3).is(LexerTokenType.IDENTIFIER, "x"));
        assertTrue(tokens.get(5).is(LexerTokenType.OPERATOR, "="));
        assertTrue(tokens.get(7).is(LexerTokenType.NUMBER, "1"));
        assertTrue(tokens.get(8).is(LexerTokenType.OPERATOR, ";"));
        assertEquals(LexerTokenType.EOF, tokens.get(9).type);
    }

    @Test
    public void testLongestOperatorWins() {
        List<LexerToken> tokens = new Lexer("$a //= $b <=> $c").tokenize();

        assertTrue(tokens.get(3).is(LexerTokenType.OPERATOR, "//="));
        assertTrue(tokens.get(8).is(LexerTokenType.OPERATOR, "<=>"));
    }

    @Test
    public void testNewlinesAreSeparateTokens() {
        List<LexerToken> tokens = new Lexer("a \n\tb").tokenize();

        assertEquals(LexerTokenType.WHITESPACE, tokens.get(1).type);
        assertEquals(LexerTokenType.NEWLINE, tokens.get(2).type);
        assertEquals(LexerTokenType.WHITESPACE, tokens.get(3).type);
        assertTrue(tokens.get(4).is(LexerTokenType.IDENTIFIER, "b"));
    }

    @Test
    public void testCarriageReturnsAreDropped() {
        assertEquals("a;\nb;\n", concat(new Lexer("a;\r\nb;\r\n").tokenize()));
    }

    @Test
    public void testTokensConcatenateToInput() {
        String source = "if ($name =~ /(\\w+)/) { foo($1, \"x\") } # done\n";
        assertEquals(source, concat(new Lexer(source).tokenize()));
    }

    @Test
    public void testUnicodeIdentifier() {
        List<LexerToken> tokens = new Lexer("$café = 1").tokenize();

        assertTrue(tokens.get(1).is(LexerTokenType.IDENTIFIER, "café"));
    }

    @Test
    public void testEmptyInputHasOnlyEof() {
        List<LexerToken> tokens = new Lexer("").tokenize();

        assertEquals(1, tokens.size());
        assertEquals(LexerTokenType.EOF, tokens.get(0).type);
    }
}
