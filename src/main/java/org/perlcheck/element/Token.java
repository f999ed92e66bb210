package org.perlcheck.element;

/**
 * A leaf of the document tree.
 */
public class Token extends Element {
    private final ElementKind kind;
    private final String content;
    final int line;
    final int column;

    public Token(ElementKind kind, String content, int line, int column) {
        if (!kind.isToken()) {
            throw new IllegalArgumentException("Not a token kind: " + kind);
        }
        this.kind = kind;
        this.content = content;
        this.line = line;
        this.column = column;
    }

    @Override
    public ElementKind getKind() {
        return kind;
    }

    @Override
    public String content() {
        return content;
    }

    @Override
    public Token firstToken() {
        return this;
    }

    public boolean is(ElementKind kind, String content) {
        return this.kind == kind && this.content.equals(content);
    }

    public boolean isOperator(String operator) {
        return is(ElementKind.OPERATOR, operator);
    }

    public boolean isStructure(String brace) {
        return is(ElementKind.STRUCTURE, brace);
    }
}
