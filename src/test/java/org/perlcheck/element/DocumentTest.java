package org.perlcheck.element;

import org.junit.jupiter.api.Test;
import org.perlcheck.parser.DocumentParser;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentTest {

    private static PerlVersion versionOf(String code) {
        return DocumentParser.parse(code, "test.pl").highestExplicitPerlVersion();
    }

    @Test
    public void testNoVersion() {
        assertNull(versionOf("use strict;\nuse warnings;\nfoo($1);\n"));
    }

    @Test
    public void testDecimalVersion() {
        assertEquals(PerlVersion.parse("5.010"), versionOf("use 5.010;\n"));
    }

    @Test
    public void testVString() {
        assertEquals(PerlVersion.parse("5.36.0"), versionOf("use v5.36;\n"));
        assertEquals(PerlVersion.parse("5.10.1"), versionOf("use 5.10.1;\n"));
    }

    @Test
    public void testHighestWins() {
        assertEquals(PerlVersion.parse("5.012"), versionOf("require 5.006;\nuse 5.012;\nuse 5.008;\n"));
    }

    @Test
    public void testNestedIncludeCounts() {
        assertEquals(PerlVersion.parse("5.010"), versionOf("sub foo {\n    use 5.010;\n    bar(%+);\n}\n"));
    }

    @Test
    public void testModuleVersionIsIgnored() {
        assertNull(versionOf("use List::Util 1.45;\nno 5.010;\n"));
    }

    @Test
    public void testVersionIsSharedAcrossThreads() throws Exception {
        Document document = DocumentParser.parse("use 5.010;\nfoo(%+);\n", "test.pl");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<PerlVersion>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(executor.submit(document::highestExplicitPerlVersion));
            }
            for (Future<PerlVersion> result : results) {
                assertEquals(PerlVersion.parse("5.010"), result.get());
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void testMissingVersionIsCached() {
        Document document = DocumentParser.parse("foo($1);\n", "test.pl");

        assertNull(document.highestExplicitPerlVersion());
        assertNull(document.highestExplicitPerlVersion());
    }

    @Test
    public void testFileName() {
        assertEquals("lib/Foo.pm", DocumentParser.parse("1;", "lib/Foo.pm").getFileName());
    }
}
