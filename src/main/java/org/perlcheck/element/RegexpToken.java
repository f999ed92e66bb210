package org.perlcheck.element;

import java.util.List;

/**
 * A match, substitution, transliteration or {@code qr} token.
 * <p>
 * Sections are the delimited parts in source order: the pattern, and for
 * substitutions and transliterations the replacement.
 */
public class RegexpToken extends Token {
    private final String operator;
    private final List<String> sections;
    private final String delimiters;
    private final String modifiers;

    public RegexpToken(ElementKind kind, String content, int line, int column,
                       String operator, List<String> sections, String delimiters, String modifiers) {
        super(kind, content, line, column);
        this.operator = operator;
        this.sections = List.copyOf(sections);
        this.delimiters = delimiters;
        this.modifiers = modifiers;
    }

    /**
     * The leading operator word ({@code m}, {@code s}, {@code tr}, {@code y},
     * {@code qr}), or the empty string for a bare {@code /.../} match.
     */
    public String getOperator() {
        return operator;
    }

    public List<String> getSections() {
        return sections;
    }

    /**
     * The delimiter characters as written, e.g. {@code "//"} or {@code "{}{}"}.
     */
    public String getDelimiters() {
        return delimiters;
    }

    public String getModifiers() {
        return modifiers;
    }

    public boolean hasModifier(char modifier) {
        return modifiers.indexOf(modifier) >= 0;
    }

    public String getMatchString() {
        return sections.get(0);
    }

    /**
     * The replacement part of a substitution, or null for other regexps.
     */
    public String getSubstituteString() {
        if (getKind() != ElementKind.REGEXP_SUBSTITUTE && getKind() != ElementKind.REGEXP_TRANSLITERATE) {
            return null;
        }
        return sections.size() > 1 ? sections.get(1) : null;
    }
}
