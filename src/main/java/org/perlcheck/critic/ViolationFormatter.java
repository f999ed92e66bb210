package org.perlcheck.critic;

import org.perlcheck.policy.Violation;

/**
 * Renders violations as text, either at one of the numbered verbosity levels or
 * with a custom format. Format escapes:
 * <pre>
 *   %f  file name           %l  line
 *   %c  column              %m  description
 *   %e  explanation         %s  severity level
 *   %p  policy name         %P  policy class name
 *   %r  source line         %%  a percent sign
 * </pre>
 * {@code \n} and {@code \t} in a custom format stand for newline and tab.
 */
public class ViolationFormatter {

    private static final String[] LEVEL_FORMATS = {
            null,
            "%f:%l:%c:%m\n",
            "%f: (%l:%c) %m\n",
            "%m at %f line %l\n",
            "%m at line %l, column %c.  %e.  (Severity: %s)\n",
            "%f: %m at line %l, column %c.  %e.  (Severity: %s)\n",
            "%m at line %l, near '%r'.  (Severity: %s)\n",
            "%f: %m at line %l near '%r'.  (Severity: %s)\n",
            "[%p] %m at line %l, column %c.  (Severity: %s)\n",
            "[%p] %m at line %l, near '%r'.  (Severity: %s)\n",
            "%m at line %l, column %c.\n  %p (Severity: %s)\n    %e\n",
            "%m at line %l, near '%r'.\n  %p (Severity: %s)\n    %e\n",
    };

    private final String format;

    public ViolationFormatter(String format) {
        this.format = format;
    }

    /**
     * A verbosity level from 1 to 11, or a custom format.
     */
    public static ViolationFormatter forVerbosity(String verbosity) {
        if (verbosity.matches("\\d+")) {
            int level = Integer.parseInt(verbosity);
            if (level < 1 || level >= LEVEL_FORMATS.length) {
                throw new IllegalArgumentException("Verbosity must be between 1 and "
                        + (LEVEL_FORMATS.length - 1) + ": " + verbosity);
            }
            return new ViolationFormatter(LEVEL_FORMATS[level]);
        }
        return new ViolationFormatter(verbosity.replace("\\n", "\n").replace("\\t", "\t"));
    }

    public String getFormat() {
        return format;
    }

    public String format(Violation violation) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char c = format.charAt(i);
            if (c != '%' || i + 1 >= format.length()) {
                sb.append(c);
                continue;
            }
            char escape = format.charAt(++i);
            switch (escape) {
                case 'f' -> sb.append(violation.getFileName());
                case 'l' -> sb.append(violation.getLine());
                case 'c' -> sb.append(violation.getColumn());
                case 'm' -> sb.append(violation.getDescription());
                case 'e' -> sb.append(violation.getExplanation());
                case 's' -> sb.append(violation.getSeverity().getLevel());
                case 'p' -> sb.append(violation.getPolicyName());
                case 'P' -> sb.append(violation.getPolicyClassName());
                case 'r' -> sb.append(violation.getSource());
                case '%' -> sb.append('%');
                default -> sb.append('%').append(escape);
            }
        }
        return sb.toString();
    }
}
