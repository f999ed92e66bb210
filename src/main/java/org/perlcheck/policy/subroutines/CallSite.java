package org.perlcheck.policy.subroutines;

import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.ScanResult;
import org.perlcheck.element.Structure;
import org.perlcheck.element.TreeScanner;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The arguments of one subroutine or method call, with the capture variables
 * found among them.
 * <p>
 * With parentheses the argument list is the list structure after the call.
 * Without them the arguments run from the call to the end of the statement or
 * to a low-precedence {@code and}, {@code or} or {@code xor}, as in
 * {@code frobnicate $fh, $1 or die}.
 */
public final class CallSite {

    // Tokens that end the arguments of a call without parentheses.
    private static final Map<ElementKind, Set<String>> ARGUMENT_LIST_END = Map.of(
            ElementKind.STRUCTURE, Set.of(";"),
            ElementKind.OPERATOR, Set.of("and", "or", "xor")
    );

    private static final Predicate<Element> END_OF_ARGUMENTS = element -> {
        Set<String> ends = ARGUMENT_LIST_END.get(element.getKind());
        return ends != null && ends.contains(element.content());
    };

    private final Element call;
    private final List<Element> captures;
    private final ScanBoundary boundary;

    private CallSite(Element call, List<Element> captures, ScanBoundary boundary) {
        this.call = call;
        this.captures = captures;
        this.boundary = boundary;
    }

    /**
     * Finds the argument list of {@code call}.
     *
     * @return the call site, or null if nothing follows the call
     */
    public static CallSite resolve(Element call, CaptureVariableFinder finder) {
        Element first = call.snextSibling();
        if (first == null) {
            return null;
        }

        Element ceiling = null;
        Element stopLeft = null;
        Predicate<Element> stop = null;
        Element start;
        if (first.getKind() == ElementKind.LIST) {
            ceiling = first;
            start = ((Structure) first).child(0);
        } else {
            start = first;
            stopLeft = call;
            stop = END_OF_ARGUMENTS;
        }

        ScanResult result = TreeScanner.scan(start, finder, stop);
        return new CallSite(call, result.found(), new ScanBoundary(ceiling, stopLeft, result.last()));
    }

    public Element getCall() {
        return call;
    }

    public List<Element> getCaptures() {
        return captures;
    }

    public ScanBoundary getBoundary() {
        return boundary;
    }
}
