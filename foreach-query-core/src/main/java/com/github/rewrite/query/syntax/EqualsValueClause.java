package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code = value}
 */
public final class EqualsValueClause extends SyntaxNode {

    private final SyntaxToken equalsToken;
    private final Expression value;

    public EqualsValueClause(SyntaxToken equalsToken, Expression value) {
        this.equalsToken = equalsToken;
        this.value = value;
    }

    public SyntaxToken getEqualsToken() {
        return equalsToken;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(equalsToken, value);
    }
}
