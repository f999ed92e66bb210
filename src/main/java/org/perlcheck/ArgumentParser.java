package org.perlcheck;

import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.policy.Severity;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * The ArgumentParser class parses command-line arguments into a
 * {@link CheckOptions} object. It does not read files or exit; errors are
 * reported as {@link PerlCheckException}.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CheckOptions object with settings derived from the arguments.
     */
    public static CheckOptions parseArguments(String[] args) {
        CheckOptions parsedArgs = new CheckOptions();
        boolean readingFiles = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingFiles || !arg.startsWith("-") || arg.equals("-")) {
                parsedArgs.fileNames.add(arg);
                continue;
            }
            if (arg.equals("--")) {
                // Everything after "--" is a file name
                readingFiles = true;
                continue;
            }
            i = processSwitch(args, parsedArgs, arg, i);
        }
        return parsedArgs;
    }

    private static int processSwitch(String[] args, CheckOptions parsedArgs, String arg, int index) {
        // --name=value is the same as --name value
        String value = null;
        int equals = arg.indexOf('=');
        if (arg.startsWith("--") && equals > 0) {
            value = arg.substring(equals + 1);
            arg = arg.substring(0, equals);
        }

        switch (arg) {
            case "-e":
                index = requireValue(args, index, arg);
                if (parsedArgs.code == null) {
                    parsedArgs.code = args[index];
                } else {
                    parsedArgs.code += "\n" + args[index];
                }
                break;
            case "-s":
            case "--severity":
                if (value == null) {
                    index = requireValue(args, index, arg);
                    value = args[index];
                }
                parsedArgs.severity = parseSeverity(value);
                break;
            case "--gentle":
                parsedArgs.severity = Severity.HIGHEST;
                break;
            case "--stern":
                parsedArgs.severity = Severity.HIGH;
                break;
            case "--harsh":
                parsedArgs.severity = Severity.MEDIUM;
                break;
            case "--cruel":
                parsedArgs.severity = Severity.LOW;
                break;
            case "--brutal":
                parsedArgs.severity = Severity.LOWEST;
                break;
            case "--theme":
                if (value == null) {
                    index = requireValue(args, index, arg);
                    value = args[index];
                }
                parsedArgs.theme = value;
                break;
            case "-p":
            case "--profile":
                if (value == null) {
                    index = requireValue(args, index, arg);
                    value = args[index];
                }
                parsedArgs.profile = value;
                break;
            case "--noprofile":
                parsedArgs.noProfile = true;
                break;
            case "-v":
            case "--verbose":
                if (value == null) {
                    index = requireValue(args, index, arg);
                    value = args[index];
                }
                parsedArgs.verbose = value;
                break;
            case "-c":
            case "--count":
                parsedArgs.countOnly = true;
                break;
            case "--tokenize":
                validateExclusiveOptions(parsedArgs, "tokenize");
                parsedArgs.tokenizeOnly = true;
                break;
            case "--parse":
                validateExclusiveOptions(parsedArgs, "parse");
                parsedArgs.parseOnly = true;
                break;
            case "--debug":
                parsedArgs.debugEnabled = true;
                break;
            case "-h":
            case "--help":
                parsedArgs.help = true;
                break;
            case "--version":
                parsedArgs.version = true;
                break;
            default:
                throw new PerlCheckException("Unrecognized switch: " + arg + "  (--help will show valid options)");
        }
        return index;
    }

    private static int requireValue(String[] args, int index, String arg) {
        if (index + 1 >= args.length) {
            throw new PerlCheckException("No value specified after " + arg);
        }
        return index + 1;
    }

    private static Severity parseSeverity(String value) {
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            throw new PerlCheckException(e.getMessage(), e);
        }
    }

    private static void validateExclusiveOptions(CheckOptions parsedArgs, String option) {
        if (parsedArgs.tokenizeOnly || parsedArgs.parseOnly) {
            throw new PerlCheckException("Can't use --" + option + " with another of --tokenize or --parse");
        }
    }

    public static void printHelp(PrintStream out) {
        out.println("Usage: perlcheck [options] [--] [file ...]");
        out.println();
        out.println("  -e code               check one line of code (several -e's allowed, omit files)");
        out.println("  -s, --severity N      run policies of severity N (1-5, or lowest..highest) and above");
        out.println("  --gentle              same as --severity 5");
        out.println("  --stern               same as --severity 4");
        out.println("  --harsh               same as --severity 3");
        out.println("  --cruel               same as --severity 2");
        out.println("  --brutal              same as --severity 1");
        out.println("  --theme name          run only the policies with this theme");
        out.println("  -p, --profile file    read settings from file");
        out.println("  --noprofile           ignore any profile");
        out.println("  -v, --verbose N|fmt   verbosity 1-11, or a format such as \"%f:%l:%c:%m\\n\"");
        out.println("  -c, --count           print only the number of violations");
        out.println("  --tokenize            tokenize the input code");
        out.println("  --parse               parse the input code");
        out.println("  --debug               enable debugging mode");
        out.println("  --version             print the version");
        out.println("  -h, --help            displays this help message");
    }

    /**
     * Options for a check run, as given on the command line. Fields left null
     * fall back to the profile and then to {@link Configuration}.
     */
    public static class CheckOptions implements Cloneable {
        public String code = null;
        public List<String> fileNames = new ArrayList<>();
        public Severity severity = null;
        public String theme = null;
        public String profile = null;
        public boolean noProfile = false;
        public String verbose = null;
        public boolean countOnly = false;
        public boolean tokenizeOnly = false;
        public boolean parseOnly = false;
        public boolean debugEnabled = false;
        public boolean help = false;
        public boolean version = false;

        @Override
        public CheckOptions clone() {
            try {
                CheckOptions copy = (CheckOptions) super.clone();
                copy.fileNames = new ArrayList<>(fileNames);
                return copy;
            } catch (CloneNotSupportedException e) {
                throw new AssertionError(e);
            }
        }

        @Override
        public String toString() {
            return "CheckOptions{" +
                    "code=" + (code == null ? null : '"' + code + '"') +
                    ", fileNames=" + fileNames +
                    ", severity=" + severity +
                    ", theme=" + theme +
                    ", profile=" + profile +
                    ", noProfile=" + noProfile +
                    ", verbose=" + verbose +
                    ", countOnly=" + countOnly +
                    ", tokenizeOnly=" + tokenizeOnly +
                    ", parseOnly=" + parseOnly +
                    ", debugEnabled=" + debugEnabled +
                    '}';
        }
    }
}
