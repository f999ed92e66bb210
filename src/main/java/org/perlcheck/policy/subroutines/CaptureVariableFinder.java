package org.perlcheck.policy.subroutines;

import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.Interest;
import org.perlcheck.element.PerlVersion;
import org.perlcheck.element.SymbolToken;

import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes capture variables while scanning an argument list.
 * Every element is descended into; only capture variables are included.
 */
public enum CaptureVariableFinder implements Function<Element, Interest> {
    /** {@code $1}, {@code $2}, ... */
    NUMBERED_ONLY(Set.of()),
    /** Numbered captures plus the {@code %+} and {@code %-} hashes. */
    WITH_NAMED_CAPTURES(Set.of("%+", "%-"));

    private static final Pattern NUMBERED_CAPTURE = Pattern.compile("\\$(\\d+)");

    private final Set<String> namedCaptureHashes;

    CaptureVariableFinder(Set<String> namedCaptureHashes) {
        this.namedCaptureHashes = namedCaptureHashes;
    }

    /**
     * Named captures exist from Perl 5.10 on; without a declared version only
     * numbered captures are looked for.
     */
    public static CaptureVariableFinder forVersion(PerlVersion declaredVersion) {
        if (declaredVersion != null && declaredVersion.isAtLeast(PerlVersion.NAMED_CAPTURES)) {
            return WITH_NAMED_CAPTURES;
        }
        return NUMBERED_ONLY;
    }

    public boolean isCaptureVariable(Element element) {
        if (element.getKind() != ElementKind.MAGIC || !(element instanceof SymbolToken)) {
            return false;
        }
        String symbol = ((SymbolToken) element).symbol();
        Matcher matcher = NUMBERED_CAPTURE.matcher(symbol);
        if (matcher.matches()) {
            // $0 is the program name
            return !matcher.group(1).equals("0");
        }
        return namedCaptureHashes.contains(symbol);
    }

    @Override
    public Interest apply(Element element) {
        return isCaptureVariable(element) ? Interest.INCLUDE : Interest.EXCLUDE;
    }
}
