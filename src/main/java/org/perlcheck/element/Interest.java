package org.perlcheck.element;

/**
 * What {@link TreeScanner} should do with a visited element.
 */
public enum Interest {
    /** Return the element and descend into it. */
    INCLUDE,
    /** Skip the element but descend into it. */
    EXCLUDE,
    /** Skip the element and everything below it. */
    PRUNE
}
