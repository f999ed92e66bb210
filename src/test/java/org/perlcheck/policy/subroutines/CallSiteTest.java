package org.perlcheck.policy.subroutines;

import org.junit.jupiter.api.Test;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.parser.DocumentParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CallSiteTest {

    private static Element call(String code, String name) {
        Document document = DocumentParser.parse(code, "test.pl");
        for (Element element : document.find(ElementKind.WORD)) {
            if (element.content().equals(name)) {
                return element;
            }
        }
        fail("No call " + name + " in " + code);
        return null;
    }

    private static List<String> contents(List<Element> elements) {
        List<String> result = new ArrayList<>();
        for (Element element : elements) {
            result.add(element.content());
        }
        return result;
    }

    @Test
    public void testParenthesizedArguments() {
        CallSite site = CallSite.resolve(call("foo($1, bar($2)); baz($3);", "foo"), CaptureVariableFinder.NUMBERED_ONLY);

        assertEquals("foo", site.getCall().content());
        assertEquals(List.of("$1", "$2"), contents(site.getCaptures()));
        assertEquals(ElementKind.LIST, site.getBoundary().ceiling().getKind());
        assertNull(site.getBoundary().stopLeft());
        assertNull(site.getBoundary().stopRight());
    }

    @Test
    public void testArgumentsWithoutParenthesesEndAtSemicolon() {
        CallSite site = CallSite.resolve(call("foo $1, $2; bar($3);", "foo"), CaptureVariableFinder.NUMBERED_ONLY);

        assertEquals(List.of("$1", "$2"), contents(site.getCaptures()));
        assertNull(site.getBoundary().ceiling());
        assertEquals("foo", site.getBoundary().stopLeft().content());
        assertEquals(";", site.getBoundary().stopRight().content());
    }

    @Test
    public void testArgumentsWithoutParenthesesEndAtLowPrecedenceOperator() {
        CallSite site = CallSite.resolve(call("foo $1 or bar $2;", "foo"), CaptureVariableFinder.NUMBERED_ONLY);

        assertEquals(List.of("$1"), contents(site.getCaptures()));
        assertEquals("or", site.getBoundary().stopRight().content());
    }

    @Test
    public void testArgumentsRunToEndOfBlock() {
        CallSite site = CallSite.resolve(call("if ($x) { foo $1 }", "foo"), CaptureVariableFinder.NUMBERED_ONLY);

        assertEquals(List.of("$1"), contents(site.getCaptures()));
        assertNull(site.getBoundary().stopRight());
    }

    @Test
    public void testNothingFollowsTheCall() {
        assertNull(CallSite.resolve(call("if ($x) { foo }", "foo"), CaptureVariableFinder.NUMBERED_ONLY));
    }

    @Test
    public void testEmptyArgumentList() {
        CallSite site = CallSite.resolve(call("foo();", "foo"), CaptureVariableFinder.NUMBERED_ONLY);

        assertTrue(site.getCaptures().isEmpty());
    }

    @Test
    public void testNamedCapturesFollowTheFinder() {
        Element call = call("foo(%+, $1);", "foo");

        assertEquals(List.of("$1"), contents(CallSite.resolve(call, CaptureVariableFinder.NUMBERED_ONLY).getCaptures()));
        assertEquals(List.of("%+", "$1"),
                contents(CallSite.resolve(call, CaptureVariableFinder.WITH_NAMED_CAPTURES).getCaptures()));
    }
}
