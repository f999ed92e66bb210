package org.perlcheck.policy.subroutines;

import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.parser.ElementUtils;

import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Decides whether a capture variable reaches a call unchanged.
 * <p>
 * The operators around the variable are examined outward, first among its
 * siblings and then among the siblings of each enclosing node. An operator that
 * computes a new value cleans the variable. Operators that may return an operand
 * unchanged, such as {@code ||} or the comma, do not; once one of them is passed,
 * operators that bind tighter than it are ignored, because they only apply to
 * its other operand. A variable is dirty only when nothing cleans it on either side.
 */
public final class CleanlinessAnalyzer {

    // Operators that do not cause a new value to be computed from their operands.
    private static final Set<String> UNCLEAN_OPERATORS = Set.of("||", "//", "&&", "and", "or", "xor", ",", "=>");

    // Containers that cause a new value to be computed from their contents.
    private static final Set<ElementKind> CLEAN_CONTAINERS = Set.of(ElementKind.SUBSCRIPT);

    private enum Direction {
        LEFT(Element::sprevSibling),
        RIGHT(Element::snextSibling);

        private final UnaryOperator<Element> advance;

        Direction(UnaryOperator<Element> advance) {
            this.advance = advance;
        }
    }

    private CleanlinessAnalyzer() {
    }

    public static boolean isDirty(Element capture, ScanBoundary boundary) {
        return isDirty(capture, boundary.ceiling(), boundary.stopLeft(), Direction.LEFT)
                && isDirty(capture, boundary.ceiling(), boundary.stopRight(), Direction.RIGHT);
    }

    private static boolean isDirty(Element capture, Element ceiling, Element stop, Direction direction) {
        for (Element check = capture; check != null && check != ceiling; check = check.getParent()) {
            if (CLEAN_CONTAINERS.contains(check.getKind())) {
                return false;
            }

            Integer bound = null;
            Element operator = check;
            while ((operator = findOperator(operator, direction, stop)) != null) {
                if (operator == stop) {
                    return true;
                }
                if (operator.getKind() == ElementKind.WORD) {
                    // A call to the left is checked on its own; any other word is skipped.
                    if (direction == Direction.LEFT
                            && (ElementUtils.isMethodCall(operator) || ElementUtils.isFunctionCall(operator))) {
                        return false;
                    }
                    continue;
                }

                Integer precedence = ElementUtils.precedenceOf(operator);
                if (precedence == null) {
                    continue;
                }
                if (bound != null && precedence > bound) {
                    continue;
                }
                if (!UNCLEAN_OPERATORS.contains(operator.content())) {
                    return false;
                }
                bound = precedence;
            }
        }
        return true;
    }

    /**
     * The next operator, word or stop element from {@code from} in the given
     * direction, or null when the siblings run out.
     */
    private static Element findOperator(Element from, Direction direction, Element stop) {
        Element element = from;
        while ((element = direction.advance.apply(element)) != null) {
            if (element == stop) {
                return element;
            }
            if (element.getKind() == ElementKind.OPERATOR || element.getKind() == ElementKind.WORD) {
                return element;
            }
        }
        return null;
    }
}
