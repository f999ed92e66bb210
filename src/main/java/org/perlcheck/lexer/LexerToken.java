package org.perlcheck.lexer;

/**
 * A raw lexical token: a run of characters of one {@link LexerTokenType}.
 *
 * <p>The text is mutable so that the element tokenizer can put back the unread
 * tail of a token after reading a quoted construct character by character.</p>
 */
public class LexerToken {
    public LexerTokenType type;

    public String text;

    public LexerToken(LexerTokenType type, String text) {
        this.type = type;
        this.text = text;
    }

    public boolean is(LexerTokenType type, String text) {
        return this.type == type && this.text.equals(text);
    }

    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + '}';
    }
}
