package com.github.rewrite.query.syntax;

/**
 * Closed set of statement shapes the converter distinguishes.
 */
public enum StatementKind {
    BLOCK,
    FOR_EACH,
    IF,
    LOCAL_DECLARATION,
    EMPTY,
    EXPRESSION,
    YIELD_RETURN,
    YIELD_BREAK,
    LOCAL_FUNCTION,
    OTHER
}
