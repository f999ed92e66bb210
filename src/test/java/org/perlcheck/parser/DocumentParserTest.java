package org.perlcheck.parser;

import org.junit.jupiter.api.Test;
import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.Node;
import org.perlcheck.element.Structure;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentParserTest {

    private static Document parse(String code) {
        return DocumentParser.parse(code, "test.pl");
    }

    private static List<ElementKind> kinds(List<Element> elements) {
        List<ElementKind> result = new ArrayList<>();
        for (Element element : elements) {
            result.add(element.getKind());
        }
        return result;
    }

    @Test
    public void testContentIsPreserved() {
        String source = "use strict;\n\nsub foo {\n    my ($x) = @_;  # args\n    return $x * 2;\n}\n\nprint foo(21), \"\\n\";\n";
        assertEquals(source, parse(source).content());
    }

    @Test
    public void testCallWithArgumentList() {
        Document document = parse("foo($1, $2);");
        Node statement = (Node) document.schild(0);

        assertEquals(ElementKind.STATEMENT, statement.getKind());
        assertEquals(List.of(ElementKind.WORD, ElementKind.LIST, ElementKind.STRUCTURE), kinds(statement.schildren()));

        Structure list = (Structure) statement.schild(1);
        assertEquals("()", list.braces());
        assertEquals("($1, $2)", list.content());
        Node expression = (Node) list.schild(0);
        assertEquals(ElementKind.STATEMENT_EXPRESSION, expression.getKind());
        assertEquals(List.of(ElementKind.MAGIC, ElementKind.OPERATOR, ElementKind.MAGIC), kinds(expression.schildren()));
    }

    @Test
    public void testStructureBracesAreNotChildren() {
        Structure list = (Structure) ((Node) parse("foo(1);").schild(0)).schild(1);

        assertEquals(1, list.childCount());
        assertEquals("(", list.getStart().content());
        assertEquals(")", list.getFinish().content());
        assertSame(list, list.getStart().getParent());
        assertNull(list.getStart().nextSibling());
    }

    @Test
    public void testStatementKinds() {
        Document document = parse("use 5.010;\npackage Foo;\nmy $x = 1;\nsub bar { return; }\nBEGIN { }\nbar();\n;\n");

        assertEquals(List.of(ElementKind.STATEMENT_INCLUDE, ElementKind.STATEMENT_PACKAGE, ElementKind.STATEMENT_VARIABLE,
                        ElementKind.STATEMENT_SUB, ElementKind.STATEMENT_SCHEDULED, ElementKind.STATEMENT,
                        ElementKind.STATEMENT_NULL),
                kinds(document.schildren()));
    }

    @Test
    public void testFormatIsAStatementOfItsOwn() {
        Document document = parse("format STDOUT =\n@<<<\n$x\n.\nfoo($1);\n");

        assertEquals(List.of(ElementKind.STATEMENT, ElementKind.STATEMENT), kinds(document.schildren()));
        Node format = (Node) document.schild(0);
        assertEquals(List.of(ElementKind.FORMAT), kinds(format.schildren()));
        assertEquals("foo", ((Node) document.schild(1)).schild(0).content());
    }

    @Test
    public void testCompoundStatementTakesElseBranch() {
        Document document = parse("if ($x) { foo(); } else { bar(); }\nbaz();\n");

        assertEquals(2, document.schildren().size());
        Node compound = (Node) document.schild(0);
        assertEquals(ElementKind.STATEMENT_COMPOUND, compound.getKind());
        assertEquals(List.of(ElementKind.WORD, ElementKind.CONDITION, ElementKind.BLOCK, ElementKind.WORD, ElementKind.BLOCK),
                kinds(compound.schildren()));
        assertEquals("baz();", document.schild(1).content());
    }

    @Test
    public void testCStyleForLoop() {
        Node compound = (Node) parse("for (my $i = 0; $i < 3; $i++) { print $i; }").schild(0);
        Structure header = (Structure) compound.schild(1);

        assertEquals(ElementKind.FOR, header.getKind());
        assertEquals(3, header.schildren().size());
        assertEquals(ElementKind.BLOCK, compound.schild(2).getKind());
    }

    @Test
    public void testSubscriptsAndConstructors() {
        Document document = parse("my $r = { b => 2 }; $h{a}{b} = [1]; $x = $list[0]; $y = $r->[1];");

        assertEquals(ElementKind.CONSTRUCTOR, ((Node) document.schild(0)).schild(3).getKind());

        Node assignment = (Node) document.schild(1);
        assertEquals(List.of(ElementKind.SYMBOL, ElementKind.SUBSCRIPT, ElementKind.SUBSCRIPT, ElementKind.OPERATOR,
                ElementKind.CONSTRUCTOR, ElementKind.STRUCTURE), kinds(assignment.schildren()));

        assertEquals(ElementKind.SUBSCRIPT, ((Node) document.schild(2)).schild(3).getKind());
        assertEquals(ElementKind.SUBSCRIPT, ((Node) document.schild(3)).schild(4).getKind());
    }

    @Test
    public void testMapTakesABlock() {
        Node statement = (Node) parse("my @d = map { $_ * 2 } @list;").schild(0);
        assertEquals(ElementKind.BLOCK, statement.schild(4).getKind());
    }

    @Test
    public void testLabeledBlock() {
        Node statement = (Node) parse("LOOP: { last LOOP; }").schild(0);

        assertEquals(ElementKind.STATEMENT_COMPOUND, statement.getKind());
        assertEquals(ElementKind.LABEL, statement.schild(0).getKind());
        assertEquals(ElementKind.BLOCK, statement.schild(1).getKind());
    }

    @Test
    public void testPackageBlockEndsStatement() {
        Document document = parse("package Foo { sub bar { 1 } }\nbar();\n");

        assertEquals(List.of(ElementKind.STATEMENT_PACKAGE, ElementKind.STATEMENT), kinds(document.schildren()));
    }

    @Test
    public void testTrailingCommentBelongsToBlock() {
        Structure block = (Structure) ((Node) parse("{ foo(); # done\n}").schild(0)).schild(0);

        assertEquals("foo();", block.schild(0).content());
        assertEquals(ElementKind.COMMENT, block.children().get(block.childCount() - 2).getKind());
    }

    @Test
    public void testFindIsInDocumentOrder() {
        List<Element> words = parse("foo(bar($1)); baz();").find(ElementKind.WORD);

        assertEquals(3, words.size());
        assertEquals("foo", words.get(0).content());
        assertEquals("bar", words.get(1).content());
        assertEquals("baz", words.get(2).content());
    }

    @Test
    public void testMissingClosingParenthesis() {
        PerlCheckException e = assertThrows(PerlCheckException.class, () -> parse("foo(1;\n"));
        assertTrue(e.getMessage().startsWith("Missing right parenthesis at test.pl line 1"), e.getMessage());
    }

    @Test
    public void testUnmatchedClosingParenthesis() {
        PerlCheckException e = assertThrows(PerlCheckException.class, () -> parse("foo);\n"));
        assertTrue(e.getMessage().startsWith("Unmatched right parenthesis"), e.getMessage());
    }

    @Test
    public void testMismatchedBrackets() {
        PerlCheckException e = assertThrows(PerlCheckException.class, () -> parse("{ foo(]; }"));
        assertTrue(e.getMessage().startsWith("Unmatched right square bracket"), e.getMessage());
    }

    @Test
    public void testMissingClosingBraceReportsOpeningLine() {
        PerlCheckException e = assertThrows(PerlCheckException.class, () -> parse("sub foo {\n    bar();\n"));
        assertTrue(e.getMessage().startsWith("Missing right curly bracket at test.pl line 1"), e.getMessage());
    }
}
