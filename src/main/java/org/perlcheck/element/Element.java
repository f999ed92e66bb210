package org.perlcheck.element;

/**
 * Base class of everything in a parsed Perl {@link Document}.
 * <p>
 * Elements are compared by identity. A tree is built once by the parser and is
 * not modified afterwards, so navigation methods can be called freely from any
 * number of analyses.
 */
public abstract class Element {
    Node parent;

    public abstract ElementKind getKind();

    /**
     * The source text covered by this element.
     */
    public abstract String content();

    /**
     * The first token of this element, or null for an empty node.
     */
    public abstract Token firstToken();

    public Node getParent() {
        return parent;
    }

    public boolean isSignificant() {
        return getKind().isSignificant();
    }

    public Element nextSibling() {
        return parent == null ? null : parent.childAfter(this);
    }

    public Element previousSibling() {
        return parent == null ? null : parent.childBefore(this);
    }

    /**
     * The next sibling that is not whitespace, a comment or POD.
     */
    public Element snextSibling() {
        Element sibling = nextSibling();
        while (sibling != null && !sibling.isSignificant()) {
            sibling = sibling.nextSibling();
        }
        return sibling;
    }

    /**
     * The previous sibling that is not whitespace, a comment or POD.
     */
    public Element sprevSibling() {
        Element sibling = previousSibling();
        while (sibling != null && !sibling.isSignificant()) {
            sibling = sibling.previousSibling();
        }
        return sibling;
    }

    public Document getDocument() {
        Element top = this;
        while (top.parent != null) {
            top = top.parent;
        }
        return top instanceof Document ? (Document) top : null;
    }

    public int getLine() {
        Token first = firstToken();
        return first == null ? 0 : first.line;
    }

    public int getColumn() {
        Token first = firstToken();
        return first == null ? 0 : first.column;
    }

    @Override
    public String toString() {
        return getKind() + " '" + content() + "'";
    }
}
