package org.perlcheck.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Perl source text into raw tokens.
 * <p>
 * The Lexer knows nothing about context: it does not decide whether a slash
 * starts a regular expression, whether a percent sign is a sigil, or where a
 * quoted string ends. Those decisions need the previous significant token and
 * are made by {@link org.perlcheck.parser.Tokenizer}, which re-reads the raw
 * tokens character by character where a construct spans several of them.
 * <p>
 * Concatenating the text of all tokens (except the trailing EOF) gives back the
 * input, minus carriage returns.
 */
public class Lexer {
    public static final String EOF = Character.toString((char) -1);

    // Multi-character operators, longest first so that the first match wins.
    private static final String[] MULTI_CHAR_OPERATORS = {
            "<<>>",
            "**=", "||=", "&&=", "//=", "<<=", ">>=", "<=>", "...", "&.=", "|.=", "^.=", "^^=",
            "!=", "!~", "%=", "&&", "&=", "&.", "**", "*=", "++", "+=", "--", "-=", "->",
            "..", ".=", "//", "/=", "::", "<<", "<=", "==", "=>", "=~", ">=", ">>", "^=",
            "^^", "^.", "|=", "||", "|.", "~~", "~."
    };

    public static final boolean[] isOperator;

    static {
        isOperator = new boolean[128];
        for (char c : "!\"#$%&'()*+,-./:;<=>?@[\\]^`{|}~".toCharArray()) {
            isOperator[c] = true;
        }
    }

    private final String input;
    private final int length;
    private int position;

    public Lexer(String input) {
        this.input = input;
        this.length = input.length();
        this.position = 0;
    }

    private static boolean isPerlIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    private static boolean isPerlIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isAsciiWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f';
    }

    private int getCurrentCodePoint() {
        if (position >= length) {
            return -1;
        }
        char c1 = input.charAt(position);
        if (Character.isHighSurrogate(c1) && position + 1 < length) {
            char c2 = input.charAt(position + 1);
            if (Character.isLowSurrogate(c2)) {
                return Character.toCodePoint(c1, c2);
            }
        }
        return c1;
    }

    private void advanceCodePoint(int codePoint) {
        position += Character.charCount(codePoint);
    }

    /**
     * Tokenizes the whole input. The list always ends with a single EOF token.
     */
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        LexerToken token;
        while ((token = nextToken()) != null) {
            tokens.add(token);
        }
        tokens.add(new LexerToken(LexerTokenType.EOF, EOF));
        return tokens;
    }

    public LexerToken nextToken() {
        while (position < length && input.charAt(position) == '\r') {
            position++;
        }
        if (position >= length) {
            return null;
        }

        char current = input.charAt(position);
        int currentCp = getCurrentCodePoint();

        if (isAsciiWhitespace(current)) {
            if (current == '\n') {
                position++;
                return new LexerToken(LexerTokenType.NEWLINE, "\n");
            }
            return consumeWhitespace();
        } else if (current >= '0' && current <= '9') {
            return consumeNumber();
        } else if (isPerlIdentifierStart(currentCp)) {
            return consumeIdentifier();
        } else if (current < 128 && isOperator[current]) {
            return consumeOperator();
        }
        int start = position;
        advanceCodePoint(currentCp);
        return new LexerToken(LexerTokenType.STRING, input.substring(start, position));
    }

    private LexerToken consumeWhitespace() {
        int start = position;
        while (position < length) {
            char c = input.charAt(position);
            if (c != ' ' && c != '\t' && c != '\f') {
                break;
            }
            position++;
        }
        return new LexerToken(LexerTokenType.WHITESPACE, input.substring(start, position));
    }

    private LexerToken consumeNumber() {
        int start = position;
        while (position < length
                && ((input.charAt(position) >= '0' && input.charAt(position) <= '9') || input.charAt(position) == '_')) {
            position++;
        }
        return new LexerToken(LexerTokenType.NUMBER, input.substring(start, position));
    }

    private LexerToken consumeIdentifier() {
        int start = position;
        advanceCodePoint(getCurrentCodePoint());
        while (position < length) {
            int cp = getCurrentCodePoint();
            if (!isPerlIdentifierPart(cp)) {
                break;
            }
            advanceCodePoint(cp);
        }
        return new LexerToken(LexerTokenType.IDENTIFIER, input.substring(start, position));
    }

    private LexerToken consumeOperator() {
        for (String operator : MULTI_CHAR_OPERATORS) {
            if (input.startsWith(operator, position)) {
                position += operator.length();
                return new LexerToken(LexerTokenType.OPERATOR, operator);
            }
        }
        int start = position++;
        return new LexerToken(LexerTokenType.OPERATOR, input.substring(start, position));
    }
}
