package org.perlcheck.policy.subroutines;

import org.junit.jupiter.api.Test;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.PerlVersion;
import org.perlcheck.parser.DocumentParser;
import org.perlcheck.policy.Severity;
import org.perlcheck.policy.Violation;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProhibitPassingCaptureVariableTest {

    private final ProhibitPassingCaptureVariable policy = new ProhibitPassingCaptureVariable();

    private List<Violation> critique(String code) {
        Document document = DocumentParser.parse(code, "test.pl");
        List<Violation> violations = new ArrayList<>();
        for (ElementKind kind : policy.appliesTo()) {
            for (Element element : document.find(kind)) {
                violations.addAll(policy.violates(element, document));
            }
        }
        return violations;
    }

    private List<String> descriptions(String code) {
        List<String> result = new ArrayList<>();
        for (Violation violation : critique(code)) {
            result.add(violation.getDescription());
        }
        return result;
    }

    private static String description(String variable, String subroutine) {
        return "Capture variable \"" + variable + "\" passed to subroutine \"" + subroutine + "\"";
    }

    @Test
    public void testEachPassedCaptureIsReported() {
        assertEquals(List.of(description("$1", "foo"), description("$2", "foo")), descriptions("foo($1, $2);"));
    }

    @Test
    public void testCallAfterPostfixIncrementIsChecked() {
        assertEquals(List.of(description("$1", "foo")), descriptions("$x = $i++ / 2; foo($1); $y = $z / 3;"));
        assertEquals(List.of(description("$1", "foo")), descriptions("foo($1); $x = $i-- / 2;"));
    }

    @Test
    public void testCallAfterFormatIsChecked() {
        assertEquals(List.of(description("$1", "foo")), descriptions("format STDOUT =\n@<<<\n$x\n.\nfoo($1);"));
    }

    @Test
    public void testComputedValuesAreClean() {
        assertEquals(0, critique("foo(\"$1\", +$2);").size(), "interpolation and unary plus copy the value");
        assertEquals(0, critique("foo($1 . 'x');").size());
        assertEquals(0, critique("foo(\\$1);").size());
        assertEquals(0, critique("foo($1 ? 1 : 2);").size());
    }

    @Test
    public void testLogicalOperatorsDoNotCopy() {
        assertEquals(1, critique("foo($1 || 1);").size());
        assertEquals(1, critique("foo($1 // 'default');").size());
        assertEquals(1, critique("foo(1 && $1);").size());
    }

    @Test
    public void testParenthesizedExpressionIsCheckedAsAWhole() {
        assertEquals(0, critique("foo(($1 || 1) + 1);").size());
        assertEquals(1, critique("foo(1, ($1));").size());
    }

    @Test
    public void testSubscriptIsClean() {
        assertEquals(0, critique("foo($h{$1});").size());
        assertEquals(0, critique("foo($list[$1]);").size());
    }

    @Test
    public void testBuiltinsAreExempt() {
        assertEquals(0, critique("print $1;").size());
        assertEquals(0, critique("CORE::print($1);").size());
        assertEquals(0, critique("open $fh, '<', $1 or die;").size());
    }

    @Test
    public void testCallWithoutParentheses() {
        assertEquals(List.of(description("$1", "frobnicate")), descriptions("frobnicate $fh, '<', $1 or die;"));
        assertEquals(1, critique("foo $1;").size());
    }

    @Test
    public void testCaptureAfterLowPrecedenceOrIsNotAnArgument() {
        assertEquals(0, critique("foo $x or bar() or warn $1;").size());
    }

    @Test
    public void testOnlyTheInnermostCallIsReported() {
        assertEquals(List.of(description("$1", "bar")), descriptions("foo(bar($1));"));
    }

    @Test
    public void testMethodCalls() {
        assertEquals(List.of(description("$1", "bar")), descriptions("$obj->bar($1);"));
        assertEquals(List.of(description("$1", "new")), descriptions("Foo->new($1);"));
        assertEquals(0, critique("$obj->bar;").size());
    }

    @Test
    public void testNothingToCheck() {
        assertEquals(0, critique("foo();").size());
        assertEquals(0, critique("foo;").size());
        assertEquals(0, critique("foo($0);").size(), "$0 is not a capture variable");
        assertEquals(0, critique("foo($x, $y);").size());
    }

    @Test
    public void testMultiDigitCapture() {
        assertEquals(List.of(description("$10", "foo")), descriptions("foo($10);"));
    }

    @Test
    public void testNamedCapturesNeedPerl510() {
        assertEquals(0, critique("foo(%+);").size());
        assertEquals(0, critique("use 5.008;\nfoo(%+);").size());
        assertEquals(List.of(description("%+", "foo")), descriptions("use 5.010;\nfoo(%+);"));
        assertEquals(List.of(description("%-", "foo")), descriptions("use v5.10;\nfoo(%-);"));
    }

    @Test
    public void testNamedCaptureElement() {
        assertEquals(List.of(description("%+", "foo")), descriptions("use 5.010;\nfoo($+{name});"));
        assertEquals(0, critique("foo($+{name});").size());
    }

    @Test
    public void testSubstitutionReplacementIsChecked() {
        List<Violation> violations = critique("my $x = 1;\ns/(\\w+)/foo($1)/e;\n");

        assertEquals(1, violations.size());
        Violation violation = violations.get(0);
        assertEquals(description("$1", "foo"), violation.getDescription());
        assertEquals(2, violation.getLine());
        assertEquals(1, violation.getColumn());
        assertEquals("s/(\\w+)/foo($1)/e;", violation.getSource());
    }

    @Test
    public void testSubstitutionWithoutEvalIsNotCode() {
        assertEquals(0, critique("s/(\\w+)/foo($1)/;").size());
        assertEquals(0, critique("s/(\\w+)/print($1)/e;").size());
    }

    @Test
    public void testSubstitutionUsesDocumentVersion() {
        assertEquals(List.of(description("%+", "foo")), descriptions("use 5.010;\ns/(?<n>\\w+)/foo(%+)/e;"));
        assertEquals(0, critique("s/(?<n>\\w+)/foo(%+)/e;").size());
    }

    @Test
    public void testUnparseableReplacementIsSkipped() {
        assertEquals(0, critique("s/(\\w+)/foo($1/e;").size());
    }

    @Test
    public void testHeredocBodyIsNotCode() {
        assertEquals(0, critique("foo(<<EOT);\nbar($1)\nEOT\n").size());
    }

    @Test
    public void testViolationDetails() {
        Violation violation = critique("sub f {\n    foo($1);\n}\n").get(0);

        assertEquals(ProhibitPassingCaptureVariable.NAME, violation.getPolicyName());
        assertEquals(ProhibitPassingCaptureVariable.class.getName(), violation.getPolicyClassName());
        assertEquals(ProhibitPassingCaptureVariable.EXPLANATION, violation.getExplanation());
        assertEquals(Severity.HIGH, violation.getSeverity());
        assertEquals("test.pl", violation.getFileName());
        assertEquals(2, violation.getLine());
        assertEquals(5, violation.getColumn());
        assertEquals("sub f {", violation.getSource());
    }

    @Test
    public void testRepeatedCheckGivesSameResult() {
        Document document = DocumentParser.parse("foo($1, $2 || 1);\ns/(x)/bar($1)/e;", "test.pl");
        List<Violation> first = new ArrayList<>();
        List<Violation> second = new ArrayList<>();
        for (ElementKind kind : policy.appliesTo()) {
            for (Element element : document.find(kind)) {
                first.addAll(policy.violates(element, document));
                second.addAll(policy.violates(element, document));
            }
        }
        assertEquals(3, first.size());
        assertEquals(first, second);
    }

    @Test
    public void testFindPassedCaptures() {
        Document document = DocumentParser.parse("foo($1, $x);", "test.pl");
        Element call = document.find(ElementKind.WORD).get(0);

        assertEquals(List.of(new PassedCapture("$1", "foo")), policy.findPassedCaptures(call, null));
        assertEquals(List.of(), policy.findPassedCaptures(document.find(ElementKind.SYMBOL).get(0),
                PerlVersion.NAMED_CAPTURES));
    }

    @Test
    public void testIgnoresNullAndOtherElements() {
        assertEquals(List.of(), policy.violates(null, null));
        Document document = DocumentParser.parse("$x = 1;", "test.pl");
        assertEquals(List.of(), policy.violates(document.find(ElementKind.NUMBER).get(0), document));
    }

    @Test
    public void testDefaults() {
        assertEquals("Subroutines::ProhibitPassingCaptureVariable", policy.name());
        assertEquals(Severity.HIGH, policy.getSeverity());
        assertTrue(policy.getThemes().contains("bugs"));
        assertTrue(policy.getThemes().contains("core"));
        assertTrue(policy.appliesTo().contains(ElementKind.WORD));
        assertTrue(policy.appliesTo().contains(ElementKind.REGEXP_SUBSTITUTE));
    }
}
