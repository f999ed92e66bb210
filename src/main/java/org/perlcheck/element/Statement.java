package org.perlcheck.element;

public class Statement extends Node {
    private final ElementKind kind;

    public Statement(ElementKind kind) {
        if (!kind.isStatement()) {
            throw new IllegalArgumentException("Not a statement kind: " + kind);
        }
        this.kind = kind;
    }

    @Override
    public ElementKind getKind() {
        return kind;
    }
}
