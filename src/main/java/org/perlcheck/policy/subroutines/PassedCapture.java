package org.perlcheck.policy.subroutines;

/**
 * A capture variable that reaches a subroutine unchanged.
 *
 * @param variable   the variable as Perl names it, e.g. {@code $1} or {@code %+}
 * @param subroutine the name the subroutine was called by
 */
public record PassedCapture(String variable, String subroutine) {
}
