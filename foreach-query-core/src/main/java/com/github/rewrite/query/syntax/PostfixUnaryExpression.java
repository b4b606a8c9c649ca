package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code operand++} or {@code operand--}
 */
public final class PostfixUnaryExpression extends Expression {

    private final Expression operand;
    private final SyntaxToken operatorToken;
    private final ExpressionKind kind;

    public PostfixUnaryExpression(Expression operand, SyntaxToken operatorToken) {
        this.operand = operand;
        this.operatorToken = operatorToken;
        this.kind = kindOf(operatorToken);
    }

    private static ExpressionKind kindOf(SyntaxToken operatorToken) {
        return switch (operatorToken.getText()) {
            case "++" -> ExpressionKind.POST_INCREMENT;
            case "--" -> ExpressionKind.POST_DECREMENT;
            default -> throw new IllegalArgumentException("Not a postfix operator: " + operatorToken.getText());
        };
    }

    @Override
    public ExpressionKind getKind() {
        return kind;
    }

    public Expression getOperand() {
        return operand;
    }

    public SyntaxToken getOperatorToken() {
        return operatorToken;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(operand, operatorToken);
    }
}
