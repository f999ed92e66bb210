package org.perlcheck.policy.subroutines;

import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.PerlVersion;
import org.perlcheck.element.RegexpToken;
import org.perlcheck.element.SymbolToken;
import org.perlcheck.parser.DocumentParser;
import org.perlcheck.parser.ElementUtils;
import org.perlcheck.policy.AbstractPolicy;
import org.perlcheck.policy.Severity;
import org.perlcheck.policy.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Do not pass capture variables such as {@code $1} to a subroutine.
 * <p>
 * Any regular expression the subroutine runs resets the capture variables, and
 * because arguments are passed by alias the caller's value changes too. An
 * expression that computes a new value is fine:
 * <pre>
 *   foo($1, $2);              # not OK
 *   foo("$1", +$2);           # OK
 *   foo($1 || 1);             # not OK
 *   foo(($1 || 1) + 1);       # OK
 * </pre>
 * When the document declares {@code use 5.010} or later, the named capture
 * hashes {@code %+} and {@code %-} are checked as well. Perl builtins are assumed
 * to copy their arguments.
 */
public class ProhibitPassingCaptureVariable extends AbstractPolicy {
    private static final Logger log = LoggerFactory.getLogger(ProhibitPassingCaptureVariable.class);

    public static final String NAME = "Subroutines::ProhibitPassingCaptureVariable";

    static final String DESCRIPTION = "Capture variable \"%s\" passed to subroutine \"%s\"";
    static final String EXPLANATION = "Any regular expression in the subroutine will modify the caller's copy";

    // Words come first so that calls are reported before substitutions at the same place.
    private static final Set<ElementKind> APPLIES_TO =
            Collections.unmodifiableSet(EnumSet.of(ElementKind.WORD, ElementKind.REGEXP_SUBSTITUTE));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Severity defaultSeverity() {
        return Severity.HIGH;
    }

    @Override
    public Set<String> defaultThemes() {
        return Set.of("core", "bugs");
    }

    @Override
    public Set<ElementKind> appliesTo() {
        return APPLIES_TO;
    }

    @Override
    public List<Violation> violates(Element element, Document document) {
        if (element == null) {
            return List.of();
        }
        PerlVersion declaredVersion = document == null ? null : document.highestExplicitPerlVersion();
        List<Violation> violations = new ArrayList<>();
        for (PassedCapture passed : findPassedCaptures(element, declaredVersion)) {
            String description = String.format(DESCRIPTION, passed.variable(), passed.subroutine());
            violations.add(violation(description, EXPLANATION, element));
        }
        return violations;
    }

    /**
     * The capture variables passed unchanged to calls at {@code element}, which is
     * a call word or a substitution whose replacement is code.
     */
    public List<PassedCapture> findPassedCaptures(Element element, PerlVersion declaredVersion) {
        return switch (element.getKind()) {
            case WORD -> handleCall(element, declaredVersion);
            case REGEXP_SUBSTITUTE -> handleSubstitute((RegexpToken) element, declaredVersion);
            default -> List.of();
        };
    }

    private List<PassedCapture> handleCall(Element call, PerlVersion declaredVersion) {
        if (!ElementUtils.isMethodCall(call) && !ElementUtils.isFunctionCall(call)) {
            return List.of();
        }
        if (ElementUtils.isPerlBuiltin(call)) {
            return List.of();
        }

        CallSite site = CallSite.resolve(call, CaptureVariableFinder.forVersion(declaredVersion));
        if (site == null) {
            return List.of();
        }

        List<PassedCapture> passed = new ArrayList<>();
        for (Element capture : site.getCaptures()) {
            if (CleanlinessAnalyzer.isDirty(capture, site.getBoundary())) {
                passed.add(new PassedCapture(((SymbolToken) capture).symbol(), call.content()));
            }
        }
        return passed;
    }

    /**
     * With the {@code e} modifier the replacement part is Perl code. It is parsed on
     * its own and checked like a document, using the version declared by the
     * enclosing one.
     */
    private List<PassedCapture> handleSubstitute(RegexpToken substitute, PerlVersion declaredVersion) {
        if (!substitute.hasModifier('e')) {
            return List.of();
        }
        String replacement = substitute.getSubstituteString();
        if (replacement == null) {
            return List.of();
        }

        Document nested;
        try {
            nested = DocumentParser.parse(replacement, "(replacement)");
        } catch (PerlCheckException e) {
            log.debug("Replacement of {} at line {} is not parseable: {}",
                    substitute.content(), substitute.getLine(), e.getMessage().trim());
            return List.of();
        }

        List<PassedCapture> passed = new ArrayList<>();
        for (ElementKind kind : APPLIES_TO) {
            for (Element element : nested.find(kind)) {
                passed.addAll(findPassedCaptures(element, declaredVersion));
            }
        }
        return passed;
    }
}
