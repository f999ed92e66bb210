package org.perlcheck.element;

/**
 * Every kind of element a {@link Document} can contain.
 * <p>
 * The set is closed: code that dispatches on element kind switches over this
 * enum instead of testing runtime classes.
 */
public enum ElementKind {
    // Tokens
    WHITESPACE(Category.TOKEN, false),
    COMMENT(Category.TOKEN, false),
    POD(Category.TOKEN, false),
    END_SECTION(Category.TOKEN, false),
    WORD(Category.TOKEN, true),
    LABEL(Category.TOKEN, true),
    SYMBOL(Category.TOKEN, true),
    MAGIC(Category.TOKEN, true),
    CAST(Category.TOKEN, true),
    OPERATOR(Category.TOKEN, true),
    NUMBER(Category.TOKEN, true),
    NUMBER_VERSION(Category.TOKEN, true),
    QUOTE_SINGLE(Category.TOKEN, true),
    QUOTE_DOUBLE(Category.TOKEN, true),
    QUOTE_LITERAL(Category.TOKEN, true),
    QUOTE_INTERPOLATE(Category.TOKEN, true),
    QUOTE_LIKE_WORDS(Category.TOKEN, true),
    QUOTE_LIKE_COMMAND(Category.TOKEN, true),
    QUOTE_LIKE_READLINE(Category.TOKEN, true),
    QUOTE_LIKE_REGEXP(Category.TOKEN, true),
    HEREDOC(Category.TOKEN, true),
    FORMAT(Category.TOKEN, true),
    REGEXP_MATCH(Category.TOKEN, true),
    REGEXP_SUBSTITUTE(Category.TOKEN, true),
    REGEXP_TRANSLITERATE(Category.TOKEN, true),
    STRUCTURE(Category.TOKEN, true),

    // Statements
    STATEMENT(Category.STATEMENT, true),
    STATEMENT_EXPRESSION(Category.STATEMENT, true),
    STATEMENT_VARIABLE(Category.STATEMENT, true),
    STATEMENT_INCLUDE(Category.STATEMENT, true),
    STATEMENT_PACKAGE(Category.STATEMENT, true),
    STATEMENT_SUB(Category.STATEMENT, true),
    STATEMENT_SCHEDULED(Category.STATEMENT, true),
    STATEMENT_COMPOUND(Category.STATEMENT, true),
    STATEMENT_BREAK(Category.STATEMENT, true),
    STATEMENT_NULL(Category.STATEMENT, true),

    // Structures
    LIST(Category.STRUCTURE, true),
    SUBSCRIPT(Category.STRUCTURE, true),
    CONSTRUCTOR(Category.STRUCTURE, true),
    BLOCK(Category.STRUCTURE, true),
    CONDITION(Category.STRUCTURE, true),
    FOR(Category.STRUCTURE, true),

    DOCUMENT(Category.DOCUMENT, true);

    public enum Category {
        TOKEN,
        STATEMENT,
        STRUCTURE,
        DOCUMENT
    }

    private final Category category;
    private final boolean significant;

    ElementKind(Category category, boolean significant) {
        this.category = category;
        this.significant = significant;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isSignificant() {
        return significant;
    }

    public boolean isToken() {
        return category == Category.TOKEN;
    }

    public boolean isStatement() {
        return category == Category.STATEMENT;
    }

    public boolean isStructure() {
        return category == Category.STRUCTURE;
    }
}
