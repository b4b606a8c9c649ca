package com.github.rewrite.query.syntax;

/**
 * Kinds of non-semantic tokens that surround syntax tokens.
 */
public enum TriviaKind {
    WHITESPACE,
    END_OF_LINE,
    SINGLE_LINE_COMMENT,
    MULTI_LINE_COMMENT,
    DIRECTIVE;

    public boolean isComment() {
        return this == SINGLE_LINE_COMMENT || this == MULTI_LINE_COMMENT;
    }

    public boolean isWhitespace() {
        return this == WHITESPACE || this == END_OF_LINE;
    }
}
