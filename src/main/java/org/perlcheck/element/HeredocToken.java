package org.perlcheck.element;

/**
 * The introducer of a here-document, e.g. {@code <<"EOT"}.
 * The body lines are not part of {@link #content()}.
 */
public class HeredocToken extends Token {
    private final String terminator;
    private final boolean indented;
    private String body = "";

    public HeredocToken(String content, int line, int column, String terminator, boolean indented) {
        super(ElementKind.HEREDOC, content, line, column);
        this.terminator = terminator;
        this.indented = indented;
    }

    public String getTerminator() {
        return terminator;
    }

    public boolean isIndented() {
        return indented;
    }

    public String getBody() {
        return body;
    }

    /**
     * Set once by the tokenizer when the line holding the introducer ends.
     */
    public void setBody(String body) {
        this.body = body;
    }
}
