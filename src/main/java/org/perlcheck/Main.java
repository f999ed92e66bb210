package org.perlcheck;

import org.perlcheck.ArgumentParser.CheckOptions;
import org.perlcheck.critic.Critic;
import org.perlcheck.critic.PolicyProfile;
import org.perlcheck.critic.ViolationFormatter;
import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.element.ElementDumper;
import org.perlcheck.element.Token;
import org.perlcheck.parser.DocumentParser;
import org.perlcheck.policy.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point.
 * <p>
 * Exit status is 0 when every input is clean, 2 when a violation was found and
 * 1 when an input could not be read or parsed, or the options are invalid.
 */
public class Main {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_ERROR = 1;
    public static final int EXIT_VIOLATIONS = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        CheckOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (PerlCheckException e) {
            err.print(e.getMessage());
            return EXIT_ERROR;
        }
        if (options.help) {
            ArgumentParser.printHelp(out);
            return EXIT_CLEAN;
        }
        if (options.version) {
            out.println("perlcheck " + Configuration.version);
            return EXIT_CLEAN;
        }
        if (options.debugEnabled) {
            // Only effective before the first logger is created
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        Logger log = LoggerFactory.getLogger(Main.class);
        log.debug("Options: {}", options);

        Map<String, String> sources = new LinkedHashMap<>();
        boolean failed = false;
        if (options.code != null) {
            sources.put("-e", options.code);
        } else if (options.fileNames.isEmpty()) {
            err.println("No input files. Use -e CODE or give file names (--help will show valid options)");
            return EXIT_ERROR;
        } else {
            for (String fileName : options.fileNames) {
                try {
                    sources.put(fileName, Files.readString(Paths.get(fileName), StandardCharsets.UTF_8));
                } catch (IOException e) {
                    log.debug("Reading {} failed", fileName, e);
                    err.println("Can't open perl script \"" + fileName + "\": " + e.getMessage());
                    failed = true;
                }
            }
        }

        Critic critic;
        ViolationFormatter formatter;
        try {
            PolicyProfile profile = loadProfile(options, log);
            if (options.severity != null) {
                profile.setSeverity(options.severity);
            }
            if (options.theme != null) {
                profile.setTheme(options.theme);
            }
            if (options.verbose != null) {
                profile.setVerbose(options.verbose);
            }
            critic = new Critic(profile);
            formatter = ViolationFormatter.forVerbosity(
                    profile.getVerbose() == null ? Configuration.DEFAULT_VERBOSITY : profile.getVerbose());
        } catch (PerlCheckException e) {
            err.print(e.getMessage());
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_ERROR;
        }

        boolean violationsFound = false;
        for (Map.Entry<String, String> source : sources.entrySet()) {
            String fileName = source.getKey();
            try {
                if (options.tokenizeOnly) {
                    ElementDumper dumper = new ElementDumper(true);
                    for (Token token : DocumentParser.tokenize(source.getValue(), fileName)) {
                        out.print(dumper.dump(token));
                    }
                } else if (options.parseOnly) {
                    out.print(new ElementDumper().dump(DocumentParser.parse(source.getValue(), fileName)));
                } else {
                    List<Violation> violations = critic.critique(source.getValue(), fileName);
                    violationsFound |= !violations.isEmpty();
                    report(fileName, violations, sources.size() > 1, options.countOnly, formatter, out);
                }
            } catch (PerlCheckException e) {
                err.print(e.getMessage());
                failed = true;
            }
        }

        if (failed) {
            return EXIT_ERROR;
        }
        return violationsFound ? EXIT_VIOLATIONS : EXIT_CLEAN;
    }

    private static void report(String fileName, List<Violation> violations, boolean manySources, boolean countOnly,
                               ViolationFormatter formatter, PrintStream out) {
        if (countOnly) {
            out.println(manySources ? fileName + ": " + violations.size() : String.valueOf(violations.size()));
            return;
        }
        if (violations.isEmpty()) {
            out.println(fileName + " source OK");
            return;
        }
        for (Violation violation : violations) {
            out.print(formatter.format(violation));
        }
    }

    /**
     * The profile named on the command line, else the one named by the
     * environment, else {@code .perlcheckrc.yaml} in the current or home
     * directory, else an empty profile.
     */
    private static PolicyProfile loadProfile(CheckOptions options, Logger log) {
        if (options.noProfile) {
            return PolicyProfile.empty();
        }
        if (options.profile != null) {
            return PolicyProfile.load(Paths.get(options.profile));
        }
        String fromEnvironment = System.getenv(Configuration.PROFILE_ENVIRONMENT_VARIABLE);
        if (fromEnvironment != null && !fromEnvironment.isEmpty()) {
            return PolicyProfile.load(Paths.get(fromEnvironment));
        }
        for (Path candidate : List.of(Paths.get(Configuration.PROFILE_FILE_NAME),
                Paths.get(System.getProperty("user.home"), Configuration.PROFILE_FILE_NAME))) {
            if (Files.isRegularFile(candidate)) {
                log.debug("Using profile {}", candidate);
                return PolicyProfile.load(candidate);
            }
        }
        return PolicyProfile.empty();
    }
}
