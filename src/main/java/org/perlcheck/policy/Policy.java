package org.perlcheck.policy;

import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;

import java.util.List;
import java.util.Set;

/**
 * A single check run over the elements of a document.
 */
public interface Policy {

    /**
     * Short name, e.g. {@code Subroutines::ProhibitPassingCaptureVariable}.
     */
    String name();

    Severity defaultSeverity();

    Set<String> defaultThemes();

    /**
     * The element kinds {@link #violates} is called for.
     */
    Set<ElementKind> appliesTo();

    /**
     * Severity in effect, which a profile may have changed from the default.
     */
    Severity getSeverity();

    void setSeverity(Severity severity);

    Set<String> getThemes();

    void setThemes(Set<String> themes);

    /**
     * Examines one element. Never throws for elements it does not understand.
     */
    List<Violation> violates(Element element, Document document);
}
