package org.perlcheck.policy.subroutines;

import org.perlcheck.element.Element;

/**
 * Limits of the search around a capture variable. Any of them may be null.
 *
 * @param ceiling   the argument list of a parenthesized call; the search never climbs to it
 * @param stopLeft  the call word of a parenthesis-less call
 * @param stopRight the token that ended a parenthesis-less argument list
 */
public record ScanBoundary(Element ceiling, Element stopLeft, Element stopRight) {
}
