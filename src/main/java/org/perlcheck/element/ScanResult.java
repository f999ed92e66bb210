package org.perlcheck.element;

import java.util.List;

/**
 * Outcome of a {@link TreeScanner} run.
 *
 * @param found the included elements in visiting order
 * @param last  the element on which the stop predicate fired, or null if the scan ran to the end
 */
public record ScanResult(List<Element> found, Element last) {

    public ScanResult {
        found = List.copyOf(found);
    }
}
