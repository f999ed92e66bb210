package org.perlcheck.parser;

import org.perlcheck.diagnostics.ErrorMessageUtil;
import org.perlcheck.diagnostics.PerlCheckException;
import org.perlcheck.element.ElementKind;
import org.perlcheck.element.HeredocToken;
import org.perlcheck.element.RegexpToken;
import org.perlcheck.element.SymbolToken;
import org.perlcheck.element.Token;
import org.perlcheck.lexer.LexerToken;
import org.perlcheck.lexer.LexerTokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Turns raw lexer tokens into document tokens.
 * <p>
 * Perl cannot be tokenized without context: a slash is a division or the start of
 * a pattern, a percent sign is a modulus or a hash sigil, depending on whether an
 * operand or an operator is expected next. The Tokenizer tracks the last
 * significant token to make that call, and re-reads raw tokens character by
 * character for quoted constructs, putting back the unread tail of the last raw
 * token it touched.
 */
public class Tokenizer {

    // Map to hold pairs of matching delimiters
    private static final Map<Character, Character> QUOTE_PAIR = Map.of(
            '<', '>',
            '{', '}',
            '(', ')',
            '[', ']'
    );

    // Characters that form a magic variable when they follow a '$'.
    private static final String MAGIC_PUNCTUATION = "&`'+!@/\\,;.<>[]-|?:()\"=~%";

    private static final String MATCH_MODIFIERS = "msixpodualngc";
    private static final String SUBSTITUTE_MODIFIERS = "msixpodualngcer";
    private static final String TRANSLITERATE_MODIFIERS = "cdsr";

    private final List<LexerToken> tokens;
    private final ErrorMessageUtil errorUtil;
    private final List<Token> result = new ArrayList<>();
    private final List<HeredocToken> pendingHeredocs = new ArrayList<>();
    private final Deque<Boolean> braceClosesToTerm = new ArrayDeque<>();

    private int index;
    private int offset;
    private int line = 1;
    private int column = 1;
    private Token lastSignificant;
    private Token beforeLastSignificant;
    private boolean closedBraceExpectsTerm = true;

    public Tokenizer(List<LexerToken> tokens, ErrorMessageUtil errorUtil) {
        this.tokens = tokens;
        this.errorUtil = errorUtil;
    }

    public List<Token> tokenize() {
        while (!atEnd()) {
            nextToken();
        }
        if (!pendingHeredocs.isEmpty()) {
            throw error("Can't find string terminator \"" + pendingHeredocs.get(0).getTerminator()
                    + "\" anywhere before EOF");
        }
        return result;
    }

    private void nextToken() {
        LexerToken token = peek(0);
        switch (token.type) {
            case WHITESPACE, NEWLINE -> consumeWhitespace();
            case NUMBER -> consumeNumber();
            case IDENTIFIER -> consumeWord();
            case OPERATOR -> consumeOperator();
            default -> throw error("Unrecognized character " + token.text);
        }
    }

    // ------------------------------------------------------------------
    // Raw token and character access

    private boolean atEnd() {
        return tokens.get(index).type == LexerTokenType.EOF;
    }

    private LexerToken peek(int ahead) {
        return tokens.get(Math.min(index + ahead, tokens.size() - 1));
    }

    private String take() {
        String text = tokens.get(index++).text;
        for (int i = 0; i < text.length(); i++) {
            advancePosition(text.charAt(i));
        }
        return text;
    }

    private char peekChar() {
        return tokens.get(index).text.charAt(offset);
    }

    private char nextChar() {
        LexerToken token = tokens.get(index);
        char c = token.text.charAt(offset++);
        if (offset >= token.text.length()) {
            index++;
            offset = 0;
        }
        advancePosition(c);
        return c;
    }

    private void advancePosition(char c) {
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    /**
     * After character-level reading stopped inside a raw token, the unread tail
     * becomes the current token.
     */
    private void putBackRemainder() {
        if (offset > 0) {
            LexerToken token = tokens.get(index);
            token.text = token.text.substring(offset);
            offset = 0;
        }
    }

    private int skipSpace(int ahead) {
        while (peek(ahead).type == LexerTokenType.WHITESPACE || peek(ahead).type == LexerTokenType.NEWLINE) {
            ahead++;
        }
        return ahead;
    }

    private PerlCheckException error(String message) {
        return new PerlCheckException(index, message, errorUtil);
    }

    private Token emit(Token token) {
        result.add(token);
        if (token.isSignificant()) {
            beforeLastSignificant = lastSignificant;
            lastSignificant = token;
        }
        return token;
    }

    private Token emit(ElementKind kind, String content, int startLine, int startColumn) {
        if (kind == ElementKind.SYMBOL || kind == ElementKind.MAGIC) {
            return emit(new SymbolToken(kind, content, startLine, startColumn));
        }
        return emit(new Token(kind, content, startLine, startColumn));
    }

    /**
     * Whether the next token is in operand position.
     */
    private boolean expectsTerm() {
        Token prev = lastSignificant;
        if (prev == null) {
            return true;
        }
        switch (prev.getKind()) {
            case OPERATOR:
                // Postfix increment and decrement end an operand.
                if (prev.isOperator("++") || prev.isOperator("--")) {
                    return !endsTerm(beforeLastSignificant);
                }
                return true;
            case FORMAT:
            case LABEL:
            case CAST:
                return true;
            case STRUCTURE:
                String brace = prev.content();
                if (brace.equals(")") || brace.equals("]")) {
                    return false;
                }
                if (brace.equals("}")) {
                    return closedBraceExpectsTerm;
                }
                return true;
            case WORD:
                return beforeLastSignificant == null || !beforeLastSignificant.isOperator("->");
            default:
                return false;
        }
    }

    /**
     * Whether {@code token} can be the last token of an operand, so that a
     * following {@code ++} or {@code --} is postfix.
     */
    private boolean endsTerm(Token token) {
        if (token == null) {
            return false;
        }
        return switch (token.getKind()) {
            case SYMBOL, MAGIC -> true;
            case STRUCTURE -> token.content().equals(")") || token.content().equals("]")
                    || token.content().equals("}") && !closedBraceExpectsTerm;
            default -> false;
        };
    }

    // ------------------------------------------------------------------
    // Whitespace, comments, POD, heredoc bodies

    private void consumeWhitespace() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (peek(0).type == LexerTokenType.WHITESPACE || peek(0).type == LexerTokenType.NEWLINE) {
            boolean newline = peek(0).type == LexerTokenType.NEWLINE;
            sb.append(take());
            if (newline && !pendingHeredocs.isEmpty()) {
                emit(ElementKind.WHITESPACE, sb.toString(), startLine, startColumn);
                readHeredocBodies();
                sb.setLength(0);
                startLine = line;
                startColumn = column;
            }
            if (newline && isPodStart()) {
                break;
            }
        }
        if (sb.length() > 0) {
            emit(ElementKind.WHITESPACE, sb.toString(), startLine, startColumn);
        }
    }

    private boolean isPodStart() {
        return column == 1 && peek(0).is(LexerTokenType.OPERATOR, "=") && peek(1).type == LexerTokenType.IDENTIFIER;
    }

    private void consumePod() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            String podLine = readLine();
            sb.append(podLine);
            if (podLine.startsWith("=cut")) {
                break;
            }
        }
        putBackRemainder();
        emit(ElementKind.POD, sb.toString(), startLine, startColumn);
    }

    private void consumeComment() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && peekChar() != '\n') {
            sb.append(nextChar());
        }
        putBackRemainder();
        emit(ElementKind.COMMENT, sb.toString(), startLine, startColumn);
    }

    private String readLine() {
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            char c = nextChar();
            sb.append(c);
            if (c == '\n') {
                break;
            }
        }
        return sb.toString();
    }

    private void readHeredocBodies() {
        for (HeredocToken heredoc : pendingHeredocs) {
            StringBuilder body = new StringBuilder();
            while (true) {
                if (atEnd()) {
                    throw error("Can't find string terminator \"" + heredoc.getTerminator() + "\" anywhere before EOF");
                }
                String bodyLine = readLine();
                String bare = bodyLine.endsWith("\n") ? bodyLine.substring(0, bodyLine.length() - 1) : bodyLine;
                if ((heredoc.isIndented() ? bare.strip() : bare).equals(heredoc.getTerminator())) {
                    break;
                }
                body.append(bodyLine);
            }
            heredoc.setBody(body.toString());
        }
        pendingHeredocs.clear();
        putBackRemainder();
    }

    private void consumeEndSection() {
        int startLine = line;
        int startColumn = column;
        StringBuilder sb = new StringBuilder();
        while (!atEnd()) {
            sb.append(take());
        }
        if (sb.length() > 0) {
            emit(ElementKind.END_SECTION, sb.toString(), startLine, startColumn);
        }
    }

    // ------------------------------------------------------------------
    // Numbers

    private void consumeNumber() {
        int startLine = line;
        int startColumn = column;
        StringBuilder text = new StringBuilder(take());

        if (text.toString().equals("0") && peek(0).type == LexerTokenType.IDENTIFIER
                && peek(0).text.matches("[xX][0-9a-fA-F_]*|[bB][01_]*")) {
            text.append(take());
            emit(ElementKind.NUMBER, text.toString(), startLine, startColumn);
            return;
        }

        if (peek(0).is(LexerTokenType.OPERATOR, ".") && peek(1).type == LexerTokenType.NUMBER) {
            text.append(take()).append(take());
            if (peek(0).is(LexerTokenType.OPERATOR, ".") && peek(1).type == LexerTokenType.NUMBER) {
                while (peek(0).is(LexerTokenType.OPERATOR, ".") && peek(1).type == LexerTokenType.NUMBER) {
                    text.append(take()).append(take());
                }
                emit(ElementKind.NUMBER_VERSION, text.toString(), startLine, startColumn);
                return;
            }
        }

        if (peek(0).type == LexerTokenType.IDENTIFIER && peek(0).text.matches("[eE][0-9_]+")) {
            text.append(take());
        } else if (peek(0).type == LexerTokenType.IDENTIFIER && peek(0).text.matches("[eE]")
                && (peek(1).is(LexerTokenType.OPERATOR, "-") || peek(1).is(LexerTokenType.OPERATOR, "+"))
                && peek(2).type == LexerTokenType.NUMBER) {
            text.append(take()).append(take()).append(take());
        }
        emit(ElementKind.NUMBER, text.toString(), startLine, startColumn);
    }

    // ------------------------------------------------------------------
    // Words

    private String readQualifiedName() {
        StringBuilder name = new StringBuilder();
        if (peek(0).type == LexerTokenType.IDENTIFIER) {
            name.append(take());
        }
        while (peek(0).is(LexerTokenType.OPERATOR, "::")) {
            name.append(take());
            if (peek(0).type != LexerTokenType.IDENTIFIER) {
                break;
            }
            name.append(take());
        }
        return name.toString();
    }

    private boolean followedByFatComma() {
        return peek(skipSpace(0)).is(LexerTokenType.OPERATOR, "=>");
    }

    private boolean atStatementStart() {
        return lastSignificant == null
                || lastSignificant.getKind() == ElementKind.FORMAT
                || lastSignificant.isStructure(";")
                || lastSignificant.isStructure("{")
                || lastSignificant.isStructure("}");
    }

    private void consumeWord() {
        int startLine = line;
        int startColumn = column;
        String text = readQualifiedName();
        boolean afterArrow = lastSignificant != null && lastSignificant.isOperator("->");

        if (!afterArrow && startColumn == 1 && (text.equals("__END__") || text.equals("__DATA__"))) {
            emit(ElementKind.WORD, text, startLine, startColumn);
            consumeEndSection();
            return;
        }
        if (afterArrow || followedByFatComma()) {
            emit(ElementKind.WORD, text, startLine, startColumn);
            return;
        }
        if (text.equals("format") && atStatementStart() && formatHeaderFollows()) {
            consumeFormat(startLine, startColumn);
            return;
        }
        if (lastSignificant != null && lastSignificant.isStructure("{")
                && peek(skipSpace(0)).is(LexerTokenType.OPERATOR, "}")) {
            // Hash key such as $h{s} or $h{y}
            emit(ElementKind.WORD, text, startLine, startColumn);
            return;
        }
        if (ParserTables.QUOTE_LIKE_WORDS.contains(text) && quoteDelimiterFollows()) {
            consumeQuoteLike(text, startLine, startColumn);
            return;
        }
        if (text.matches("v\\d+") && (peek(0).is(LexerTokenType.OPERATOR, ".") && peek(1).type == LexerTokenType.NUMBER
                || lastSignificant != null && ParserTables.INCLUDE_WORDS.contains(lastSignificant.content()))) {
            StringBuilder version = new StringBuilder(text);
            while (peek(0).is(LexerTokenType.OPERATOR, ".") && peek(1).type == LexerTokenType.NUMBER) {
                version.append(take()).append(take());
            }
            emit(ElementKind.NUMBER_VERSION, version.toString(), startLine, startColumn);
            return;
        }
        if (ParserTables.WORD_OPERATORS.contains(text) && (!text.equals("x") || !expectsTerm())) {
            emit(ElementKind.OPERATOR, text, startLine, startColumn);
            return;
        }
        if (text.matches("x\\d+") && !expectsTerm()) {
            emit(ElementKind.OPERATOR, "x", startLine, startColumn);
            emit(ElementKind.NUMBER, text.substring(1), startLine, startColumn + 1);
            return;
        }
        if (atStatementStart() && peek(0).is(LexerTokenType.OPERATOR, ":")
                && !text.contains("::") && !ParserTables.BUILTINS.contains(text)) {
            emit(ElementKind.LABEL, text + take(), startLine, startColumn);
            return;
        }
        emit(ElementKind.WORD, text, startLine, startColumn);
    }

    /**
     * Whether {@code format} is followed by an optional name and {@code =}.
     */
    private boolean formatHeaderFollows() {
        int ahead = skipSpace(0);
        while (peek(ahead).type == LexerTokenType.IDENTIFIER || peek(ahead).is(LexerTokenType.OPERATOR, "::")) {
            ahead++;
        }
        return peek(skipSpace(ahead)).is(LexerTokenType.OPERATOR, "=");
    }

    /**
     * Reads a format declaration through the line holding only a period. The
     * picture and argument lines are not Perl statements and stay opaque.
     */
    private void consumeFormat(int startLine, int startColumn) {
        StringBuilder content = new StringBuilder("format");
        while (!peek(0).is(LexerTokenType.OPERATOR, "=")) {
            content.append(take());
        }
        content.append(readLine());
        while (true) {
            if (atEnd()) {
                throw error("Format not terminated");
            }
            String formatLine = readLine();
            content.append(formatLine);
            if (formatLine.stripTrailing().equals(".")) {
                break;
            }
        }
        putBackRemainder();
        emit(ElementKind.FORMAT, content.toString(), startLine, startColumn);
    }

    private boolean quoteDelimiterFollows() {
        int ahead = skipSpace(0);
        LexerToken next = peek(ahead);
        if (next.type != LexerTokenType.OPERATOR) {
            return false;
        }
        char delimiter = next.text.charAt(0);
        if (",;)]}=>".indexOf(delimiter) >= 0) {
            return false;
        }
        if (next.text.equals("->") || next.text.equals("::")) {
            return false;
        }
        return ahead == 0 || delimiter != '#';
    }

    private void consumeQuoteLike(String word, int startLine, int startColumn) {
        StringBuilder content = new StringBuilder(word);
        while (peek(0).type == LexerTokenType.WHITESPACE || peek(0).type == LexerTokenType.NEWLINE) {
            content.append(take());
        }
        switch (word) {
            case "q" -> emitQuote(ElementKind.QUOTE_LITERAL, content, startLine, startColumn);
            case "qq" -> emitQuote(ElementKind.QUOTE_INTERPOLATE, content, startLine, startColumn);
            case "qw" -> emitQuote(ElementKind.QUOTE_LIKE_WORDS, content, startLine, startColumn);
            case "qx" -> emitQuote(ElementKind.QUOTE_LIKE_COMMAND, content, startLine, startColumn);
            case "qr" -> emitRegexp(ElementKind.QUOTE_LIKE_REGEXP, word, 1, MATCH_MODIFIERS, content, startLine, startColumn);
            case "m" -> emitRegexp(ElementKind.REGEXP_MATCH, word, 1, MATCH_MODIFIERS, content, startLine, startColumn);
            case "s" -> emitRegexp(ElementKind.REGEXP_SUBSTITUTE, word, 2, SUBSTITUTE_MODIFIERS, content, startLine, startColumn);
            default -> emitRegexp(ElementKind.REGEXP_TRANSLITERATE, word, 2, TRANSLITERATE_MODIFIERS, content, startLine, startColumn);
        }
    }

    // ------------------------------------------------------------------
    // Quoted constructs

    private void emitQuote(ElementKind kind, StringBuilder content, int startLine, int startColumn) {
        readDelimited(content, new StringBuilder());
        putBackRemainder();
        emit(kind, content.toString(), startLine, startColumn);
    }

    private void emitRegexp(ElementKind kind, String operator, int sectionCount, String allowedModifiers,
                            StringBuilder content, int startLine, int startColumn) {
        List<String> sections = new ArrayList<>();
        StringBuilder delimiters = new StringBuilder();
        char close = readDelimited(content, delimiters, sections);
        if (sectionCount == 2) {
            char open = delimiters.charAt(0);
            if (open == close) {
                StringBuilder section = new StringBuilder();
                readSection(open, close, content, section);
                sections.add(section.toString());
                delimiters.append(close);
            } else {
                putBackRemainder();
                while (peek(0).type == LexerTokenType.WHITESPACE || peek(0).type == LexerTokenType.NEWLINE) {
                    content.append(take());
                }
                if (atEnd()) {
                    throw error("Substitution replacement not terminated");
                }
                readDelimited(content, delimiters, sections);
            }
        }
        putBackRemainder();

        String modifiers = "";
        if (peek(0).type == LexerTokenType.IDENTIFIER && containsOnly(peek(0).text, allowedModifiers)) {
            modifiers = take();
            content.append(modifiers);
        }
        emit(new RegexpToken(kind, content.toString(), startLine, startColumn,
                operator, sections, delimiters.toString(), modifiers));
    }

    private static boolean containsOnly(String text, String allowed) {
        for (int i = 0; i < text.length(); i++) {
            if (allowed.indexOf(text.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reads an opening delimiter and the section it encloses.
     *
     * @return the closing delimiter
     */
    private char readDelimited(StringBuilder content, StringBuilder delimiters, List<String> sections) {
        StringBuilder section = new StringBuilder();
        char close = readDelimited(content, section, delimiters);
        sections.add(section.toString());
        return close;
    }

    private char readDelimited(StringBuilder content, StringBuilder section) {
        return readDelimited(content, section, new StringBuilder());
    }

    private char readDelimited(StringBuilder content, StringBuilder section, StringBuilder delimiters) {
        if (atEnd()) {
            throw error("Can't find string terminator anywhere before EOF");
        }
        char open = nextChar();
        content.append(open);
        char close = QUOTE_PAIR.getOrDefault(open, open);
        delimiters.append(open);
        readSection(open, close, content, section);
        if (open != close) {
            delimiters.append(close);
        }
        return close;
    }

    /**
     * Reads up to and including the closing delimiter. Nested pairs are balanced
     * when the delimiters are brackets; a backslash escapes the next character.
     */
    private void readSection(char open, char close, StringBuilder content, StringBuilder section) {
        int depth = 0;
        while (true) {
            if (atEnd()) {
                throw error("Can't find string terminator \"" + close + "\" anywhere before EOF");
            }
            char ch = nextChar();
            content.append(ch);
            if (ch == '\\' && !atEnd()) {
                char escaped = nextChar();
                content.append(escaped);
                section.append(ch).append(escaped);
                continue;
            }
            if (open != close && ch == open) {
                depth++;
            } else if (ch == close) {
                if (depth == 0) {
                    return;
                }
                depth--;
            }
            section.append(ch);
        }
    }

    private void consumeHeredoc(int startLine, int startColumn) {
        StringBuilder content = new StringBuilder(take());
        boolean indented = false;
        if (peek(0).text.startsWith("~")) {
            content.append(nextChar());
            putBackRemainder();
            indented = true;
        }
        String terminator;
        if (peek(0).text.startsWith("\"") || peek(0).text.startsWith("'")) {
            StringBuilder section = new StringBuilder();
            readDelimited(content, section);
            putBackRemainder();
            terminator = section.toString();
        } else {
            terminator = take();
            content.append(terminator);
        }
        HeredocToken heredoc = new HeredocToken(content.toString(), startLine, startColumn, terminator, indented);
        emit(heredoc);
        pendingHeredocs.add(heredoc);
    }

    private boolean heredocFollows() {
        LexerToken next = peek(1);
        if (next.type == LexerTokenType.IDENTIFIER) {
            return true;
        }
        if (next.type != LexerTokenType.OPERATOR) {
            return false;
        }
        if (next.text.equals("\"") || next.text.equals("'")) {
            return true;
        }
        if (next.text.equals("~")) {
            LexerToken after = peek(2);
            return after.type == LexerTokenType.IDENTIFIER || after.text.equals("\"") || after.text.equals("'");
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Operators, sigils and structure

    private void consumeOperator() {
        int startLine = line;
        int startColumn = column;
        String text = peek(0).text;

        if (isPodStart()) {
            consumePod();
            return;
        }

        switch (text.charAt(0)) {
            case '#' -> consumeComment();
            case '"' -> emitQuote(ElementKind.QUOTE_DOUBLE, new StringBuilder(), startLine, startColumn);
            case '\'' -> emitQuote(ElementKind.QUOTE_SINGLE, new StringBuilder(), startLine, startColumn);
            case '`' -> emitQuote(ElementKind.QUOTE_LIKE_COMMAND, new StringBuilder(), startLine, startColumn);
            case '$' -> consumeScalarSigil(startLine, startColumn);
            case '@' -> consumeArraySigil(startLine, startColumn);
            case '%', '&', '*' -> {
                if (text.length() == 1 && expectsTerm() && sigilFollows(text.charAt(0))) {
                    consumeOtherSigil(startLine, startColumn);
                } else {
                    emit(ElementKind.OPERATOR, take(), startLine, startColumn);
                }
            }
            case '/' -> {
                if (expectsTerm()) {
                    emitRegexp(ElementKind.REGEXP_MATCH, "", 1, MATCH_MODIFIERS, new StringBuilder(), startLine, startColumn);
                } else {
                    emit(ElementKind.OPERATOR, take(), startLine, startColumn);
                }
            }
            case '<' -> {
                if (expectsTerm() && text.equals("<<") && heredocFollows()) {
                    consumeHeredoc(startLine, startColumn);
                } else if (expectsTerm() && text.equals("<<>>")) {
                    emit(ElementKind.QUOTE_LIKE_READLINE, take(), startLine, startColumn);
                } else if (expectsTerm() && text.equals("<")) {
                    emitQuote(ElementKind.QUOTE_LIKE_READLINE, new StringBuilder(), startLine, startColumn);
                } else {
                    emit(ElementKind.OPERATOR, take(), startLine, startColumn);
                }
            }
            case '-' -> {
                if (text.equals("-") && expectsTerm() && fileTestFollows()) {
                    emit(ElementKind.OPERATOR, take() + take(), startLine, startColumn);
                } else {
                    emit(ElementKind.OPERATOR, take(), startLine, startColumn);
                }
            }
            case '(', '[', ';' -> emit(ElementKind.STRUCTURE, take(), startLine, startColumn);
            case ')', ']' -> emit(ElementKind.STRUCTURE, take(), startLine, startColumn);
            case '{' -> {
                braceClosesToTerm.push(!closesToTerm(lastSignificant));
                emit(ElementKind.STRUCTURE, take(), startLine, startColumn);
            }
            case '}' -> {
                closedBraceExpectsTerm = braceClosesToTerm.isEmpty() || braceClosesToTerm.pop();
                emit(ElementKind.STRUCTURE, take(), startLine, startColumn);
            }
            default -> emit(ElementKind.OPERATOR, take(), startLine, startColumn);
        }
    }

    /**
     * Whether a curly brace opened after {@code prev} is a subscript or dereference,
     * after which an operator is expected.
     */
    private boolean closesToTerm(Token prev) {
        if (prev == null) {
            return false;
        }
        return prev.getKind() == ElementKind.SYMBOL
                || prev.getKind() == ElementKind.MAGIC
                || prev.getKind() == ElementKind.CAST
                || prev.isOperator("->")
                || prev.isStructure("]")
                || prev.isStructure("}") && !closedBraceExpectsTerm;
    }

    private boolean fileTestFollows() {
        LexerToken next = peek(1);
        return next.type == LexerTokenType.IDENTIFIER
                && next.text.length() == 1
                && ParserTables.FILE_TEST_LETTERS.contains(next.text)
                && !peek(skipSpace(2)).is(LexerTokenType.OPERATOR, "=>");
    }

    private boolean sigilFollows(char sigil) {
        LexerToken next = peek(1);
        if (next.type == LexerTokenType.IDENTIFIER || next.text.equals("::")) {
            return true;
        }
        if (next.type != LexerTokenType.OPERATOR) {
            return false;
        }
        char c = next.text.charAt(0);
        if (c == '{') {
            return true;
        }
        if (c == '$') {
            return sigil != '*';
        }
        return sigil == '%' && (c == '+' || c == '-' || c == '!' || c == '^');
    }

    private void consumeScalarSigil(int startLine, int startColumn) {
        take();
        LexerToken next = peek(0);
        if (next.type == LexerTokenType.NUMBER) {
            emit(ElementKind.MAGIC, "$" + take(), startLine, startColumn);
            return;
        }
        if (next.type == LexerTokenType.IDENTIFIER || next.text.equals("::")) {
            String name = readQualifiedName();
            emit(name.equals("_") ? ElementKind.MAGIC : ElementKind.SYMBOL, "$" + name, startLine, startColumn);
            return;
        }
        if (next.type != LexerTokenType.OPERATOR) {
            emit(ElementKind.CAST, "$", startLine, startColumn);
            return;
        }
        switch (next.text.charAt(0)) {
            case '{' -> {
                if (next.text.equals("{") && peek(1).text.equals("^")
                        && peek(2).type == LexerTokenType.IDENTIFIER && peek(3).text.equals("}")) {
                    emit(ElementKind.MAGIC, "$" + take() + take() + take() + take(), startLine, startColumn);
                } else {
                    emit(ElementKind.CAST, "$", startLine, startColumn);
                }
            }
            case '$' -> {
                LexerToken after = peek(1);
                if (after.type == LexerTokenType.IDENTIFIER || after.text.startsWith("{")
                        || after.text.startsWith("$") || after.text.equals("::")) {
                    emit(ElementKind.CAST, "$", startLine, startColumn);
                } else {
                    emit(ElementKind.MAGIC, "$" + take(), startLine, startColumn);
                }
            }
            case '#' -> {
                LexerToken after = peek(1);
                if (after.type == LexerTokenType.IDENTIFIER) {
                    take();
                    emit(ElementKind.SYMBOL, "$#" + readQualifiedName(), startLine, startColumn);
                } else if (after.text.startsWith("{") || after.text.startsWith("$")) {
                    take();
                    emit(ElementKind.CAST, "$#", startLine, startColumn);
                } else {
                    take();
                    emit(ElementKind.MAGIC, "$#", startLine, startColumn);
                }
            }
            case '^' -> {
                StringBuilder name = new StringBuilder("$").append(nextChar());
                if (offset == 0 && peek(0).type == LexerTokenType.IDENTIFIER) {
                    name.append(nextChar());
                }
                putBackRemainder();
                emit(ElementKind.MAGIC, name.toString(), startLine, startColumn);
            }
            default -> {
                if (MAGIC_PUNCTUATION.indexOf(next.text.charAt(0)) >= 0) {
                    String name = "$" + nextChar();
                    putBackRemainder();
                    emit(ElementKind.MAGIC, name, startLine, startColumn);
                } else {
                    emit(ElementKind.CAST, "$", startLine, startColumn);
                }
            }
        }
    }

    private void consumeArraySigil(int startLine, int startColumn) {
        take();
        LexerToken next = peek(0);
        if (next.type == LexerTokenType.IDENTIFIER || next.text.equals("::")) {
            String name = readQualifiedName();
            emit(name.equals("_") ? ElementKind.MAGIC : ElementKind.SYMBOL, "@" + name, startLine, startColumn);
        } else if (next.type == LexerTokenType.OPERATOR && (next.text.startsWith("+") || next.text.startsWith("-"))) {
            String name = "@" + nextChar();
            putBackRemainder();
            emit(ElementKind.MAGIC, name, startLine, startColumn);
        } else {
            emit(ElementKind.CAST, "@", startLine, startColumn);
        }
    }

    private void consumeOtherSigil(int startLine, int startColumn) {
        String sigil = take();
        LexerToken next = peek(0);
        if (next.type == LexerTokenType.IDENTIFIER || next.text.equals("::")) {
            emit(ElementKind.SYMBOL, sigil + readQualifiedName(), startLine, startColumn);
            return;
        }
        char c = next.text.charAt(0);
        if (c == '{' || c == '$') {
            emit(ElementKind.CAST, sigil, startLine, startColumn);
            return;
        }
        StringBuilder name = new StringBuilder(sigil).append(nextChar());
        if (c == '^' && offset == 0 && peek(0).type == LexerTokenType.IDENTIFIER) {
            name.append(nextChar());
        }
        putBackRemainder();
        emit(ElementKind.MAGIC, name.toString(), startLine, startColumn);
    }
}
