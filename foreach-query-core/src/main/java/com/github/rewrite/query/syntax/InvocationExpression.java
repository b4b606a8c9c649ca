package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code expression(arguments)}
 */
public final class InvocationExpression extends Expression {

    private final Expression expression;
    private final ArgumentList argumentList;

    public InvocationExpression(Expression expression, ArgumentList argumentList) {
        this.expression = expression;
        this.argumentList = argumentList;
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.INVOCATION;
    }

    /**
     * What is invoked, typically an {@link IdentifierName} or a {@link MemberAccessExpression}.
     */
    public Expression getExpression() {
        return expression;
    }

    public ArgumentList getArgumentList() {
        return argumentList;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(expression, argumentList);
    }
}
