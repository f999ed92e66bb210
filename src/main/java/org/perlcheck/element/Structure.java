package org.perlcheck.element;

/**
 * A bracketed construct: list, subscript, anonymous constructor, block,
 * condition or for-loop header.
 * <p>
 * The opening and closing braces belong to the structure but are not among
 * its children, so they have no siblings.
 */
public class Structure extends Node {
    private final ElementKind kind;
    private final Token start;
    private Token finish;

    public Structure(ElementKind kind, Token start) {
        if (!kind.isStructure()) {
            throw new IllegalArgumentException("Not a structure kind: " + kind);
        }
        this.kind = kind;
        this.start = start;
        start.parent = this;
    }

    @Override
    public ElementKind getKind() {
        return kind;
    }

    public Token getStart() {
        return start;
    }

    /**
     * The closing brace, or null while the structure is still open.
     */
    public Token getFinish() {
        return finish;
    }

    public void setFinish(Token finish) {
        finish.parent = this;
        this.finish = finish;
    }

    /**
     * The brace pair, e.g. {@code "()"}, or null if the structure was never closed.
     */
    public String braces() {
        return finish == null ? null : start.content() + finish.content();
    }

    @Override
    public Token firstToken() {
        return start;
    }

    @Override
    public String content() {
        return start.content() + super.content() + (finish == null ? "" : finish.content());
    }
}
