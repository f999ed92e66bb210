package org.perlcheck.policy;

/**
 * How serious a violation is. A higher level is more likely to be a bug.
 */
public enum Severity {
    LOWEST(1),
    LOW(2),
    MEDIUM(3),
    HIGH(4),
    HIGHEST(5);

    private final int level;

    Severity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    /**
     * Accepts a level number or a case-insensitive name such as {@code "high"}.
     */
    public static Severity parse(String text) {
        String trimmed = text.trim();
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(trimmed) || String.valueOf(severity.level).equals(trimmed)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Invalid severity: " + text);
    }

    public static Severity fromLevel(int level) {
        for (Severity severity : values()) {
            if (severity.level == level) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Severity must be between 1 and 5: " + level);
    }
}
