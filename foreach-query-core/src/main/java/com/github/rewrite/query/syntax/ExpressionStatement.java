package com.github.rewrite.query.syntax;

import java.util.List;

public final class ExpressionStatement extends Statement {

    private final Expression expression;
    private final SyntaxToken semicolon;

    public ExpressionStatement(Expression expression, SyntaxToken semicolon) {
        this.expression = expression;
        this.semicolon = semicolon;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.EXPRESSION;
    }

    public Expression getExpression() {
        return expression;
    }

    public SyntaxToken getSemicolon() {
        return semicolon;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(expression, semicolon);
    }
}
