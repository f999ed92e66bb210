package org.perlcheck.parser;

import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.Node;
import org.perlcheck.element.Token;

/**
 * Questions about a single element that need its surroundings to answer, such
 * as whether a bareword is a call.
 */
public final class ElementUtils {

    private ElementUtils() {
    }

    private static boolean isOperatorToken(Element element, String operator) {
        return element instanceof Token && ((Token) element).isOperator(operator);
    }

    private static boolean isWord(Element element, String content) {
        return element != null && element.getKind() == ElementKind.WORD && element.content().equals(content);
    }

    /**
     * A word directly after {@code ->}.
     */
    public static boolean isMethodCall(Element element) {
        if (element == null || element.getKind() != ElementKind.WORD) {
            return false;
        }
        return isOperatorToken(element.sprevSibling(), "->");
    }

    /**
     * A bareword that names a subroutine being called: not a hash key, method,
     * class name, declaration, module name, special bareword, filehandle or label.
     */
    public static boolean isFunctionCall(Element element) {
        if (element == null || element.getKind() != ElementKind.WORD) {
            return false;
        }
        return !(isHashKey(element)
                || isMethodCall(element)
                || isClassName(element)
                || isSubroutineName(element)
                || isIncludedModuleName(element)
                || isPackageName(element)
                || ParserTables.SPECIAL_BAREWORDS.contains(element.content())
                || ParserTables.FILEHANDLES.contains(element.content())
                || isLabelPointer(element));
    }

    public static boolean isPerlBuiltin(Element element) {
        if (element == null) {
            return false;
        }
        String name = element.content();
        if (name.startsWith("CORE::GLOBAL::")) {
            name = name.substring("CORE::GLOBAL::".length());
        } else if (name.startsWith("CORE::")) {
            name = name.substring("CORE::".length());
        }
        return ParserTables.BUILTINS.contains(name);
    }

    /**
     * A bareword used as a hash key, either inside a subscript or before a fat comma.
     * A word followed by an argument list is a call even inside a subscript.
     */
    public static boolean isHashKey(Element element) {
        Element next = element.snextSibling();
        if (next != null && next.getKind() == ElementKind.LIST) {
            return false;
        }
        Node parent = element.getParent();
        if (parent != null && parent.getParent() != null && parent.getParent().getKind() == ElementKind.SUBSCRIPT) {
            return true;
        }
        return isOperatorToken(next, "=>");
    }

    public static boolean isClassName(Element element) {
        return isOperatorToken(element.snextSibling(), "->") || element.content().endsWith("::");
    }

    private static boolean isSubroutineName(Element element) {
        return element.getParent() != null
                && element.getParent().getKind() == ElementKind.STATEMENT_SUB
                && isWord(element.sprevSibling(), "sub");
    }

    private static boolean isIncludedModuleName(Element element) {
        Element prev = element.sprevSibling();
        return element.getParent() != null
                && element.getParent().getKind() == ElementKind.STATEMENT_INCLUDE
                && prev != null && prev.getKind() == ElementKind.WORD
                && ParserTables.INCLUDE_WORDS.contains(prev.content());
    }

    private static boolean isPackageName(Element element) {
        return element.getParent() != null
                && element.getParent().getKind() == ElementKind.STATEMENT_PACKAGE
                && isWord(element.sprevSibling(), "package");
    }

    private static boolean isLabelPointer(Element element) {
        Element prev = element.sprevSibling();
        return prev != null && prev.getKind() == ElementKind.WORD
                && ParserTables.LABEL_POINTERS.contains(prev.content());
    }

    /**
     * Precedence of an operator token, or null for anything else, including
     * operators without a known precedence.
     */
    public static Integer precedenceOf(Element element) {
        if (element == null || element.getKind() != ElementKind.OPERATOR) {
            return null;
        }
        return ParserTables.getPrecedence(element.content());
    }
}
