package org.perlcheck;

import org.perlcheck.policy.Severity;

/**
 * Central configuration of the checker.
 * Contains the defaults that a profile or the command line can override.
 */
public final class Configuration {

    public static final String version = "1.0.0";

    // Policies below this severity are not run unless asked for
    public static final Severity DEFAULT_SEVERITY = Severity.HIGH;

    public static final String DEFAULT_VERBOSITY = "4";

    // Looked up in the current directory, then in the home directory
    public static final String PROFILE_FILE_NAME = ".perlcheckrc.yaml";

    public static final String PROFILE_ENVIRONMENT_VARIABLE = "PERLCHECK_PROFILE";

    // Prevent instantiation
    private Configuration() {
    }
}
