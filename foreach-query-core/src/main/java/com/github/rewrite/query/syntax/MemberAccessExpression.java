package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code expression.name}
 */
public final class MemberAccessExpression extends Expression {

    private final Expression expression;
    private final SyntaxToken dotToken;
    private final IdentifierName name;

    public MemberAccessExpression(Expression expression, SyntaxToken dotToken, IdentifierName name) {
        this.expression = expression;
        this.dotToken = dotToken;
        this.name = name;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.MEMBER_ACCESS;
    }

    public Expression getExpression() {
        return expression;
    }

    public SyntaxToken getDotToken() {
        return dotToken;
    }

    public IdentifierName getName() {
        return name;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(expression, dotToken, name);
    }
}
