package org.perlcheck.element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An element with children: a statement, a structure or the document itself.
 */
public abstract class Node extends Element {
    private final List<Element> children = new ArrayList<>();

    /**
     * Appends a child. Only the parser calls this, while the tree is being built.
     */
    public void add(Element child) {
        if (child.parent != null) {
            throw new IllegalStateException("Element already has a parent: " + child);
        }
        child.parent = this;
        children.add(child);
    }

    public List<Element> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * The significant children.
     */
    public List<Element> schildren() {
        List<Element> result = new ArrayList<>();
        for (Element child : children) {
            if (child.isSignificant()) {
                result.add(child);
            }
        }
        return result;
    }

    public Element child(int index) {
        return index >= 0 && index < children.size() ? children.get(index) : null;
    }

    public Element schild(int index) {
        List<Element> significant = schildren();
        return index >= 0 && index < significant.size() ? significant.get(index) : null;
    }

    public int childCount() {
        return children.size();
    }

    /**
     * All descendants of the given kind, in document order.
     */
    public List<Element> find(ElementKind kind) {
        Element start = child(0);
        if (start == null) {
            return List.of();
        }
        return TreeScanner.scan(start, element -> element.getKind() == kind ? Interest.INCLUDE : Interest.EXCLUDE, null)
                .found();
    }

    Element childAfter(Element child) {
        int index = indexOf(child);
        return index < 0 ? null : child(index + 1);
    }

    Element childBefore(Element child) {
        int index = indexOf(child);
        return index < 0 ? null : child(index - 1);
    }

    private int indexOf(Element child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public Token firstToken() {
        for (Element child : children) {
            Token first = child.firstToken();
            if (first != null) {
                return first;
            }
        }
        return null;
    }

    @Override
    public String content() {
        StringBuilder sb = new StringBuilder();
        for (Element child : children) {
            sb.append(child.content());
        }
        return sb.toString();
    }
}
