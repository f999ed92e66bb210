package org.perlcheck.policy;

import org.perlcheck.element.Element;

import java.util.Set;

/**
 * Keeps the configurable severity and themes of a policy, and builds its violations.
 */
public abstract class AbstractPolicy implements Policy {
    private Severity severity;
    private Set<String> themes;

    @Override
    public Severity getSeverity() {
        return severity == null ? defaultSeverity() : severity;
    }

    @Override
    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    @Override
    public Set<String> getThemes() {
        return themes == null ? defaultThemes() : themes;
    }

    @Override
    public void setThemes(Set<String> themes) {
        this.themes = themes == null ? null : Set.copyOf(themes);
    }

    protected Violation violation(String description, String explanation, Element element) {
        return new Violation(description, explanation, name(), getClass().getName(), getSeverity(), element);
    }

    @Override
    public String toString() {
        return name();
    }
}
