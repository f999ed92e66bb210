package org.perlcheck.policy.subroutines;

import org.junit.jupiter.api.Test;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.parser.DocumentParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CleanlinessAnalyzerTest {

    /**
     * Dirtiness of each capture passed to the first word of {@code code}.
     */
    private static List<Boolean> dirtiness(String code) {
        Element call = DocumentParser.parse(code, "test.pl").find(ElementKind.WORD).get(0);
        CallSite site = CallSite.resolve(call, CaptureVariableFinder.WITH_NAMED_CAPTURES);
        List<Boolean> result = new ArrayList<>();
        for (Element capture : site.getCaptures()) {
            result.add(CleanlinessAnalyzer.isDirty(capture, site.getBoundary()));
        }
        return result;
    }

    @Test
    public void testBareArguments() {
        assertEquals(List.of(true, true), dirtiness("foo($1, $2);"));
        assertEquals(List.of(true), dirtiness("foo(key => $1);"));
    }

    @Test
    public void testOperatorOnEitherSideCleans() {
        assertEquals(List.of(false), dirtiness("foo(-$1);"));
        assertEquals(List.of(false), dirtiness("foo($1 + 0);"));
        assertEquals(List.of(false), dirtiness("foo(1, 'a' . $1, 2);"));
        assertEquals(List.of(false), dirtiness("foo($1 =~ /x/);"));
    }

    @Test
    public void testUncleanOperatorsPassTheValueThrough() {
        assertEquals(List.of(true), dirtiness("foo($x || $1);"));
        assertEquals(List.of(true), dirtiness("foo($1 && $x);"));
        assertEquals(List.of(true), dirtiness("foo($x // $1);"));
    }

    @Test
    public void testTighterOperatorBeyondUncleanOneIsIgnored() {
        // The + applies to $x, not to the result of ||.
        assertEquals(List.of(true), dirtiness("foo($1 || $x + 1);"));
        // The + applies to $x, not to the value of $1.
        assertEquals(List.of(true), dirtiness("foo($1, $x + 1);"));
    }

    @Test
    public void testLooserOperatorBeyondUncleanOneCleans() {
        assertEquals(List.of(false), dirtiness("foo($1 || $x ? 1 : 2);"));
    }

    @Test
    public void testEnclosingExpressionIsExamined() {
        assertEquals(List.of(false), dirtiness("foo(($1 || 1) + 1);"));
        assertEquals(List.of(false), dirtiness("foo(1 + ($1));"));
        assertEquals(List.of(true), dirtiness("foo((($1)));"));
    }

    @Test
    public void testSubscriptCleans() {
        assertEquals(List.of(false), dirtiness("foo($h{$1});"));
        assertEquals(List.of(false), dirtiness("foo($list[$1 || 0]);"));
    }

    @Test
    public void testCallToTheLeftCleans() {
        assertEquals(List.of(false), dirtiness("foo(bar($1));"));
        assertEquals(List.of(false), dirtiness("foo(lc $1);"));
    }

    @Test
    public void testStopTokensBoundTheSearch() {
        assertEquals(List.of(true), dirtiness("foo $1 or $x + 1;"));
        assertEquals(List.of(true, true), dirtiness("foo $x, $1, %+;"));
    }
}
