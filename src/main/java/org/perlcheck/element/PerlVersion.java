package org.perlcheck.element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A Perl version number, in either decimal ({@code 5.010001}) or dotted
 * ({@code v5.10.1}, {@code 5.10.1}) notation. Both notations of the same
 * version compare equal.
 */
public final class PerlVersion implements Comparable<PerlVersion> {
    /** The first version with the {@code %+} and {@code %-} named capture hashes. */
    public static final PerlVersion NAMED_CAPTURES = parse("5.010");

    private final int[] parts;

    private PerlVersion(int[] parts) {
        this.parts = parts;
    }

    /**
     * @throws IllegalArgumentException if the text is not a version number
     */
    public static PerlVersion parse(String text) {
        String version = text.trim().replace("_", "");
        boolean dotted = version.startsWith("v");
        if (dotted) {
            version = version.substring(1);
        }
        if (!version.matches("\\d+(\\.\\d+)*")) {
            throw new IllegalArgumentException("Not a version number: " + text);
        }
        String[] fields = version.split("\\.");
        if (dotted || fields.length > 2) {
            int[] parts = new int[fields.length];
            for (int i = 0; i < fields.length; i++) {
                parts[i] = Integer.parseInt(fields[i]);
            }
            return new PerlVersion(parts);
        }

        List<Integer> parts = new ArrayList<>();
        parts.add(Integer.parseInt(fields[0]));
        if (fields.length == 2) {
            StringBuilder fraction = new StringBuilder(fields[1]);
            while (fraction.length() % 3 != 0) {
                fraction.append('0');
            }
            for (int i = 0; i < fraction.length(); i += 3) {
                parts.add(Integer.parseInt(fraction.substring(i, i + 3)));
            }
        }
        return new PerlVersion(parts.stream().mapToInt(Integer::intValue).toArray());
    }

    public int getRevision() {
        return part(0);
    }

    public int getVersion() {
        return part(1);
    }

    public int getSubversion() {
        return part(2);
    }

    private int part(int index) {
        return index < parts.length ? parts[index] : 0;
    }

    @Override
    public int compareTo(PerlVersion other) {
        int length = Math.max(parts.length, other.parts.length);
        for (int i = 0; i < length; i++) {
            int cmp = Integer.compare(part(i), other.part(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }

    public boolean isAtLeast(PerlVersion other) {
        return compareTo(other) >= 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PerlVersion && compareTo((PerlVersion) o) == 0;
    }

    @Override
    public int hashCode() {
        int length = parts.length;
        while (length > 0 && parts[length - 1] == 0) {
            length--;
        }
        return Arrays.hashCode(Arrays.copyOf(parts, length));
    }

    /**
     * Dotted notation with at least three components, e.g. {@code v5.10.0}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("v");
        int length = Math.max(3, parts.length);
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(part(i));
        }
        return sb.toString();
    }
}
