package org.perlcheck.element;

import java.util.Optional;

/**
 * Root of a parsed Perl source.
 */
public class Document extends Node {
    private final String fileName;
    // Empty once scanned with no version found; null until scanned.
    private volatile Optional<PerlVersion> highestExplicitPerlVersion;

    public Document(String fileName) {
        this.fileName = fileName;
    }

    @Override
    public ElementKind getKind() {
        return ElementKind.DOCUMENT;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * The highest version required by a {@code use VERSION} or {@code require VERSION}
     * statement anywhere in the document, or null if there is none.
     * <p>
     * The result is cached and safely published, so policies running in
     * parallel over the same document see the same value.
     */
    public PerlVersion highestExplicitPerlVersion() {
        Optional<PerlVersion> version = highestExplicitPerlVersion;
        if (version == null) {
            version = Optional.ofNullable(scanExplicitPerlVersion());
            highestExplicitPerlVersion = version;
        }
        return version.orElse(null);
    }

    private PerlVersion scanExplicitPerlVersion() {
        PerlVersion highest = null;
        for (Element element : find(ElementKind.STATEMENT_INCLUDE)) {
            PerlVersion version = includedVersion((Statement) element);
            if (version != null && (highest == null || version.compareTo(highest) > 0)) {
                highest = version;
            }
        }
        return highest;
    }

    private static PerlVersion includedVersion(Statement include) {
        Element type = include.schild(0);
        Element argument = include.schild(1);
        if (type == null || argument == null) {
            return null;
        }
        if (!type.content().equals("use") && !type.content().equals("require")) {
            return null;
        }
        if (argument.getKind() != ElementKind.NUMBER && argument.getKind() != ElementKind.NUMBER_VERSION) {
            return null;
        }
        try {
            return PerlVersion.parse(argument.content());
        } catch (IllegalArgumentException e) {
            // Hex, binary or exponent literals are not version numbers.
            return null;
        }
    }
}
