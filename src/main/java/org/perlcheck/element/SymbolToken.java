package org.perlcheck.element;

/**
 * A variable: an ordinary symbol such as {@code $foo} or a magic variable such as
 * {@code $1}, {@code $_} or {@code %+}.
 */
public class SymbolToken extends Token {

    public SymbolToken(ElementKind kind, String content, int line, int column) {
        super(kind, content, line, column);
        if (kind != ElementKind.SYMBOL && kind != ElementKind.MAGIC) {
            throw new IllegalArgumentException("Not a symbol kind: " + kind);
        }
    }

    /**
     * The variable actually referred to. A scalar sigil followed by a subscript
     * names the aggregate being indexed: {@code $x[0]} is {@code @x} and
     * {@code $+{name}} is {@code %+}. A hash followed by square brackets is a
     * slice of that hash's values and keeps its sigil as {@code @}.
     */
    public String symbol() {
        String symbol = canonical();
        char sigil = symbol.charAt(0);
        if (sigil == '&') {
            return symbol;
        }
        Element after = snextSibling();
        if (!(after instanceof Structure)) {
            return symbol;
        }
        String braces = ((Structure) after).braces();
        if (braces == null) {
            return symbol;
        }
        if (sigil == '$') {
            Element before = sprevSibling();
            if (before instanceof Token
                    && before.getKind() == ElementKind.CAST
                    && (before.content().equals("$") || before.content().equals("@"))) {
                return symbol;
            }
            if (braces.equals("[]")) {
                return '@' + symbol.substring(1);
            }
            if (braces.equals("{}")) {
                return '%' + symbol.substring(1);
            }
        } else if (sigil == '@' && braces.equals("{}")) {
            return '%' + symbol.substring(1);
        } else if (sigil == '%' && braces.equals("[]")) {
            return '@' + symbol.substring(1);
        }
        return symbol;
    }

    /**
     * The content with the old-style {@code '} package separator of a symbol
     * normalized to {@code ::}. Magic variables such as {@code $'} are returned as is.
     */
    public String canonical() {
        if (getKind() == ElementKind.MAGIC) {
            return content();
        }
        return content().replaceAll("(?<=\\w)'(?=\\w)", "::");
    }
}
