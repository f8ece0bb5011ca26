package org.pragmatica.meson.tree;

/**
 * Kinds of AST nodes, one per {@link Node} variant.
 */
public enum NodeKind {
    BOOLEAN,
    ID,
    NUMBER,
    STRING,
    FORMAT_STRING,
    MULTILINE_FORMAT_STRING,
    CONTINUE,
    BREAK,
    ARRAY,
    DICT,
    EMPTY,
    OR,
    AND,
    COMPARISON,
    ARITHMETIC,
    NOT,
    UMINUS,
    CODE_BLOCK,
    INDEX,
    METHOD,
    FUNCTION,
    ASSIGNMENT,
    PLUS_ASSIGNMENT,
    FOREACH_CLAUSE,
    IF_CLAUSE,
    IF,
    PARENTHESIZED,
    TERNARY,
    ARGUMENT
}
