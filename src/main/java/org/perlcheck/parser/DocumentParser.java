package org.perlcheck.parser;

import org.perlcheck.diagnostics.ErrorMessageUtil;
import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.element.Document;
import org.perlcheck.element.Element;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.Node;
import org.perlcheck.element.Statement;
import org.perlcheck.element.Structure;
import org.perlcheck.element.Token;
import org.perlcheck.lexer.Lexer;
import org.perlcheck.lexer.LexerToken;

import java.util.List;

/**
 * Builds the document tree from tokens.
 * <p>
 * The tree is lexical: statements hold tokens and bracketed structures, blocks
 * hold statements, and every other structure holds expression statements split
 * at semicolons. Operator precedence is not resolved here; analyses that need it
 * look it up per operator.
 */
public class DocumentParser {

    private final List<Token> tokens;
    private final ErrorMessageUtil errorUtil;
    private int index;

    public DocumentParser(List<Token> tokens, ErrorMessageUtil errorUtil) {
        this.tokens = tokens;
        this.errorUtil = errorUtil;
    }

    /**
     * Tokenizes and parses Perl source.
     *
     * @throws PerlCheckException if the source cannot be tokenized or its brackets do not balance
     */
    public static Document parse(String source, String fileName) {
        List<LexerToken> rawTokens = new Lexer(source).tokenize();
        ErrorMessageUtil errorUtil = new ErrorMessageUtil(fileName, rawTokens);
        List<Token> tokens = new Tokenizer(rawTokens, errorUtil).tokenize();
        return new DocumentParser(tokens, errorUtil).parseDocument(fileName);
    }

    /**
     * Tokenizes Perl source without building a tree.
     */
    public static List<Token> tokenize(String source, String fileName) {
        List<LexerToken> rawTokens = new Lexer(source).tokenize();
        return new Tokenizer(rawTokens, new ErrorMessageUtil(fileName, rawTokens)).tokenize();
    }

    public Document parseDocument(String fileName) {
        Document document = new Document(fileName);
        parseStatements(document, null);
        if (index < tokens.size()) {
            throw error("Unmatched right " + braceName(tokens.get(index).content()), tokens.get(index));
        }
        // Scanned before the tree is handed out.
        document.highestExplicitPerlVersion();
        return document;
    }

    private PerlCheckException error(String message, Token token) {
        return new PerlCheckException(token.getLine(), token.content(), message, errorUtil);
    }

    private static boolean isOpening(Token token) {
        return token.getKind() == ElementKind.STRUCTURE && "([{".contains(token.content());
    }

    private static boolean isClosing(Token token) {
        return token.getKind() == ElementKind.STRUCTURE && ")]}".contains(token.content());
    }

    private static String closerFor(String opener) {
        return switch (opener) {
            case "(" -> ")";
            case "[" -> "]";
            default -> "}";
        };
    }

    private static String braceName(String brace) {
        return switch (brace) {
            case "(", ")" -> "parenthesis";
            case "[", "]" -> "square bracket";
            default -> "curly bracket";
        };
    }

    private int nextSignificant(int from) {
        for (int i = from; i < tokens.size(); i++) {
            if (tokens.get(i).isSignificant()) {
                return i;
            }
        }
        return -1;
    }

    private Token significantAfter(int from) {
        int i = nextSignificant(from);
        return i < 0 ? null : tokens.get(i);
    }

    /**
     * Parses statements until a closing brace or the end of input. The closing
     * brace is left for the caller.
     */
    private void parseStatements(Node container, String closer) {
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (!token.isSignificant()) {
                container.add(token);
                index++;
                continue;
            }
            if (isClosing(token)) {
                if (token.content().equals(closer)) {
                    return;
                }
                throw error("Unmatched right " + braceName(token.content()), token);
            }
            container.add(parseStatement());
        }
    }

    private Statement parseStatement() {
        Token first = tokens.get(index);
        ElementKind kind = statementKind(first);
        Statement statement = new Statement(kind);
        if (kind == ElementKind.STATEMENT_NULL || first.getKind() == ElementKind.FORMAT) {
            statement.add(first);
            index++;
            return statement;
        }
        if (first.isStructure("{")) {
            statement.add(parseStructure(ElementKind.BLOCK));
            return statement;
        }
        parseStatementBody(statement);
        return statement;
    }

    private ElementKind statementKind(Token first) {
        if (first.isStructure(";")) {
            return ElementKind.STATEMENT_NULL;
        }
        if (first.isStructure("{")) {
            return ElementKind.STATEMENT_COMPOUND;
        }
        Token next = significantAfter(index + 1);
        if (first.getKind() == ElementKind.LABEL) {
            if (next != null && (next.isStructure("{")
                    || next.getKind() == ElementKind.WORD && ParserTables.COMPOUND_WORDS.contains(next.content()))) {
                return ElementKind.STATEMENT_COMPOUND;
            }
            return ElementKind.STATEMENT;
        }
        if (first.getKind() != ElementKind.WORD) {
            return ElementKind.STATEMENT;
        }
        String word = first.content();
        if (ParserTables.INCLUDE_WORDS.contains(word)) {
            return ElementKind.STATEMENT_INCLUDE;
        }
        if (word.equals("package")) {
            return ElementKind.STATEMENT_PACKAGE;
        }
        if (word.equals("sub") && next != null && next.getKind() == ElementKind.WORD) {
            return ElementKind.STATEMENT_SUB;
        }
        if (ParserTables.SCHEDULED_BLOCKS.contains(word) && next != null && next.isStructure("{")) {
            return ElementKind.STATEMENT_SCHEDULED;
        }
        if (ParserTables.COMPOUND_WORDS.contains(word)) {
            return ElementKind.STATEMENT_COMPOUND;
        }
        if (ParserTables.BREAK_WORDS.contains(word)) {
            return ElementKind.STATEMENT_BREAK;
        }
        if (ParserTables.VARIABLE_DECLARATORS.contains(word)) {
            return ElementKind.STATEMENT_VARIABLE;
        }
        return ElementKind.STATEMENT;
    }

    /**
     * Fills a statement up to and including its semicolon, or up to the closing
     * brace of the enclosing structure. Insignificant tokens after the last
     * significant one are left to the enclosing node.
     */
    private void parseStatementBody(Statement statement) {
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (!token.isSignificant()) {
                int next = nextSignificant(index);
                if (next < 0 || isClosing(tokens.get(next))) {
                    return;
                }
                if (endsAtBlock(statement) && !continuesCompound(statement, tokens.get(next))) {
                    return;
                }
                statement.add(token);
                index++;
                continue;
            }
            if (isClosing(token)) {
                return;
            }
            if (endsAtBlock(statement) && !continuesCompound(statement, token)) {
                return;
            }
            if (token.isStructure(";")) {
                statement.add(token);
                index++;
                return;
            }
            if (isOpening(token)) {
                statement.add(parseStructure(structureKind(statement, token)));
                continue;
            }
            statement.add(token);
            index++;
        }
    }

    /**
     * Whether the statement is complete because its last child is a block that
     * ends it: the body of a named sub, a scheduled block, a package block or a
     * compound statement.
     */
    private static boolean endsAtBlock(Statement statement) {
        Element last = lastSignificant(statement);
        if (last == null || last.getKind() != ElementKind.BLOCK) {
            return false;
        }
        return switch (statement.getKind()) {
            case STATEMENT_SUB, STATEMENT_SCHEDULED, STATEMENT_PACKAGE, STATEMENT_COMPOUND -> true;
            default -> false;
        };
    }

    private static boolean continuesCompound(Statement statement, Token next) {
        if (statement.getKind() != ElementKind.STATEMENT_COMPOUND || next.getKind() != ElementKind.WORD) {
            return false;
        }
        return switch (next.content()) {
            case "elsif", "else", "continue", "catch", "finally" -> true;
            default -> false;
        };
    }

    private static Element lastSignificant(Node node) {
        List<Element> significant = node.schildren();
        return significant.isEmpty() ? null : significant.get(significant.size() - 1);
    }

    private ElementKind structureKind(Statement statement, Token open) {
        Element prev = lastSignificant(statement);
        boolean compound = statement.getKind() == ElementKind.STATEMENT_COMPOUND;
        switch (open.content()) {
            case "(":
                if (compound && prev != null && prev.getKind() == ElementKind.WORD) {
                    if (ParserTables.CONDITION_WORDS.contains(prev.content())) {
                        return ElementKind.CONDITION;
                    }
                    if (prev.content().equals("for") || prev.content().equals("foreach")) {
                        return ElementKind.FOR;
                    }
                }
                return ElementKind.LIST;
            case "[":
                if (isSubscriptPosition(prev) || prev != null && prev.getKind() == ElementKind.LIST) {
                    return ElementKind.SUBSCRIPT;
                }
                return ElementKind.CONSTRUCTOR;
            default:
                if (isSubscriptPosition(prev)) {
                    return ElementKind.SUBSCRIPT;
                }
                if (prev == null) {
                    return statement.getKind() == ElementKind.STATEMENT_EXPRESSION
                            ? ElementKind.CONSTRUCTOR : ElementKind.BLOCK;
                }
                switch (prev.getKind()) {
                    case CAST:
                    case LABEL:
                        return ElementKind.BLOCK;
                    case WORD:
                        if (ParserTables.BLOCK_WORDS.contains(prev.content()) || compound
                                || statement.getKind() == ElementKind.STATEMENT_SUB
                                || statement.getKind() == ElementKind.STATEMENT_SCHEDULED
                                || statement.getKind() == ElementKind.STATEMENT_PACKAGE) {
                            return ElementKind.BLOCK;
                        }
                        return ElementKind.CONSTRUCTOR;
                    case LIST:
                    case CONDITION:
                    case FOR:
                        return ElementKind.BLOCK;
                    case NUMBER:
                    case NUMBER_VERSION:
                        return statement.getKind() == ElementKind.STATEMENT_PACKAGE
                                ? ElementKind.BLOCK : ElementKind.CONSTRUCTOR;
                    default:
                        return ElementKind.CONSTRUCTOR;
                }
        }
    }

    private static boolean isSubscriptPosition(Element prev) {
        if (prev == null) {
            return false;
        }
        if (prev instanceof Token && ((Token) prev).isOperator("->")) {
            return true;
        }
        if (prev.getKind() == ElementKind.BLOCK) {
            Element beforeBlock = prev.sprevSibling();
            return beforeBlock != null && beforeBlock.getKind() == ElementKind.CAST;
        }
        return prev.getKind() == ElementKind.SYMBOL
                || prev.getKind() == ElementKind.MAGIC
                || prev.getKind() == ElementKind.SUBSCRIPT;
    }

    private Structure parseStructure(ElementKind kind) {
        Token open = tokens.get(index++);
        Structure structure = new Structure(kind, open);
        String closer = closerFor(open.content());
        if (kind == ElementKind.BLOCK) {
            parseStatements(structure, closer);
        } else {
            parseExpressions(structure);
        }
        if (index >= tokens.size()) {
            throw error("Missing right " + braceName(open.content()), open);
        }
        Token close = tokens.get(index);
        if (!close.isStructure(closer)) {
            throw error("Unmatched right " + braceName(close.content()), close);
        }
        index++;
        structure.setFinish(close);
        return structure;
    }

    private void parseExpressions(Structure structure) {
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            if (!token.isSignificant()) {
                structure.add(token);
                index++;
                continue;
            }
            if (isClosing(token)) {
                return;
            }
            Statement expression = new Statement(ElementKind.STATEMENT_EXPRESSION);
            parseStatementBody(expression);
            structure.add(expression);
        }
    }
}
