package com.github.rewrite.query.syntax;

public enum ExpressionKind {
    IDENTIFIER_NAME,
    POST_INCREMENT,
    POST_DECREMENT,
    MEMBER_ACCESS,
    INVOCATION,
    OTHER
}
