package org.perlcheck.element;

import org.junit.jupiter.api.Test;
import org.perlcheck.parser.DocumentParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeScannerTest {

    private static Interest kindIs(Element element, ElementKind kind) {
        return element.getKind() == kind ? Interest.INCLUDE : Interest.EXCLUDE;
    }

    private static List<String> contents(List<Element> elements) {
        List<String> result = new ArrayList<>();
        for (Element element : elements) {
            result.add(element.content());
        }
        return result;
    }

    @Test
    public void testScansLaterSiblingsAndDescendants() {
        Document document = DocumentParser.parse("foo(1, 2); bar(3);", "test.pl");

        ScanResult result = TreeScanner.scan(document.child(0), e -> kindIs(e, ElementKind.NUMBER), null);

        assertEquals(List.of("1", "2", "3"), contents(result.found()));
        assertNull(result.last());
    }

    @Test
    public void testStartsInTheMiddle() {
        Document document = DocumentParser.parse("foo(1, 2); bar(3);", "test.pl");

        ScanResult result = TreeScanner.scan(document.schild(1), e -> kindIs(e, ElementKind.NUMBER), null);

        assertEquals(List.of("3"), contents(result.found()));
    }

    @Test
    public void testStopElementEndsTheScan() {
        Document document = DocumentParser.parse("foo(1, 2); bar(3);", "test.pl");

        ScanResult result = TreeScanner.scan(document.child(0), e -> kindIs(e, ElementKind.NUMBER),
                e -> e.getKind() == ElementKind.WORD && e.content().equals("bar"));

        assertEquals(List.of("1", "2"), contents(result.found()));
        assertEquals("bar", result.last().content());
    }

    @Test
    public void testPruneSkipsDescendants() {
        Document document = DocumentParser.parse("foo(bar(1)); baz();", "test.pl");

        ScanResult result = TreeScanner.scan(document.child(0), e -> {
            if (e.getKind() == ElementKind.LIST) {
                return Interest.PRUNE;
            }
            return kindIs(e, ElementKind.WORD);
        }, null);

        assertEquals(List.of("foo", "baz"), contents(result.found()));
    }

    @Test
    public void testStructureBracesAreVisitedInOrder() {
        Document document = DocumentParser.parse("foo(1);", "test.pl");

        ScanResult result = TreeScanner.scan(document.child(0), e -> kindIs(e, ElementKind.STRUCTURE), null);

        assertEquals(List.of("(", ")", ";"), contents(result.found()));
    }

    @Test
    public void testNullStart() {
        ScanResult result = TreeScanner.scan(null, e -> Interest.INCLUDE, null);

        assertTrue(result.found().isEmpty());
        assertNull(result.last());
    }
}
