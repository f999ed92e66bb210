package org.perlcheck.diagnostics;

import org.perlcheck.lexer.LexerToken;
import org.perlcheck.lexer.LexerTokenType;

import java.util.List;

/**
 * Builds syntax error messages in Perl's own format:
 * {@code message at FILE line N, near "..."}.
 */
public class ErrorMessageUtil {
    private final String fileName;
    private final List<LexerToken> tokens;
    private int tokenIndex;
    private int lastLineNumber;

    /**
     * @param fileName the name reported in messages
     * @param tokens   the raw tokens of the source, used to find line numbers and context
     */
    public ErrorMessageUtil(String fileName, List<LexerToken> tokens) {
        this.fileName = fileName;
        this.tokens = tokens;
        this.tokenIndex = -1;
        this.lastLineNumber = 1;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     */
    static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n':
                    escaped.append("\\n");
                    break;
                case '\t':
                    escaped.append("\\t");
                    break;
                case '\\':
                    escaped.append("\\\\");
                    break;
                case '\"':
                    escaped.append("\\\"");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Formats a message for the raw token at {@code index}, with a few tokens of
     * surrounding text.
     */
    public String errorMessage(int index, String message) {
        int line = getLineNumber(index);
        StringBuilder near = new StringBuilder();
        for (int i = Math.max(0, index - 4); i <= index + 2 && i < tokens.size(); i++) {
            if (tokens.get(i).type != LexerTokenType.EOF) {
                near.append(tokens.get(i).text);
            }
        }
        return errorMessage(line, near.toString(), message);
    }

    /**
     * Formats a message for an already known line.
     */
    public String errorMessage(int line, String near, String message) {
        return message + " at " + fileName + " line " + line + ", near " + errorMessageQuote(near) + "\n";
    }

    /**
     * Retrieves the line number by counting newlines up to the specified index.
     * Lookups are expected in increasing index order; earlier indexes are recounted.
     */
    public int getLineNumber(int index) {
        if (index < tokenIndex) {
            tokenIndex = -1;
            lastLineNumber = 1;
        }
        for (int i = tokenIndex + 1; i < index && i < tokens.size(); i++) {
            LexerToken tok = tokens.get(i);
            if (tok.type == LexerTokenType.EOF) {
                break;
            }
            if (tok.type == LexerTokenType.NEWLINE) {
                lastLineNumber++;
            }
        }
        tokenIndex = Math.max(tokenIndex, index - 1);
        return lastLineNumber;
    }
}
