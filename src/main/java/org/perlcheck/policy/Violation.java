package org.perlcheck.policy;

import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.Node;

import java.util.Comparator;
import java.util.Objects;

/**
 * A problem found by a policy at one place in a document.
 */
public final class Violation implements Comparable<Violation> {

    private static final Comparator<Violation> BY_LOCATION = Comparator
            .comparingInt(Violation::getLine)
            .thenComparingInt(Violation::getColumn);

    private final String description;
    private final String explanation;
    private final String policyName;
    private final String policyClassName;
    private final Severity severity;
    private final String fileName;
    private final int line;
    private final int column;
    private final String source;

    public Violation(String description, String explanation, String policyName, String policyClassName,
                     Severity severity, String fileName, int line, int column, String source) {
        this.description = description;
        this.explanation = explanation;
        this.policyName = policyName;
        this.policyClassName = policyClassName;
        this.severity = severity;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.source = source;
    }

    Violation(String description, String explanation, String policyName, String policyClassName,
              Severity severity, Element element) {
        this(description, explanation, policyName, policyClassName, severity,
                fileNameOf(element), element.getLine(), element.getColumn(), sourceOf(element));
    }

    private static String fileNameOf(Element element) {
        Document document = element.getDocument();
        return document == null ? null : document.getFileName();
    }

    /**
     * The first line of the top-level statement holding the element.
     */
    private static String sourceOf(Element element) {
        Element statement = element;
        while (statement.getParent() != null && !(statement.getParent() instanceof Document)) {
            statement = statement.getParent();
        }
        String text = statement instanceof Node ? statement.content().stripLeading() : statement.content();
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    public String getDescription() {
        return description;
    }

    public String getExplanation() {
        return explanation;
    }

    public String getPolicyName() {
        return policyName;
    }

    public String getPolicyClassName() {
        return policyClassName;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getSource() {
        return source;
    }

    @Override
    public int compareTo(Violation other) {
        return BY_LOCATION.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Violation)) {
            return false;
        }
        Violation that = (Violation) o;
        return line == that.line
                && column == that.column
                && description.equals(that.description)
                && policyName.equals(that.policyName)
                && Objects.equals(fileName, that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, policyName, fileName, line, column);
    }

    @Override
    public String toString() {
        return description + " at line " + line + ", column " + column;
    }
}
