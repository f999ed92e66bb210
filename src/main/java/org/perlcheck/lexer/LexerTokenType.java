package org.perlcheck.lexer;

/**
 * Raw token categories produced by {@link Lexer}.
 */
public enum LexerTokenType {
    WHITESPACE,
    NEWLINE,
    NUMBER,
    IDENTIFIER,
    OPERATOR,
    STRING,
    EOF
}
