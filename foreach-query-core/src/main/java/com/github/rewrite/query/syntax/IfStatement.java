package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code if (condition) statement [else statement]}
 */
public final class IfStatement extends Statement {

    private final SyntaxToken ifKeyword;
    private final SyntaxToken openParen;
    private final Expression condition;
    private final SyntaxToken closeParen;
    private final Statement statement;
    private final @Nullable ElseClause elseClause;

    public IfStatement(SyntaxToken ifKeyword, SyntaxToken openParen, Expression condition,
                       SyntaxToken closeParen, Statement statement, @Nullable ElseClause elseClause) {
        this.ifKeyword = ifKeyword;
        this.openParen = openParen;
        this.condition = condition;
        this.closeParen = closeParen;
        this.statement = statement;
        this.elseClause = elseClause;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.IF;
    }

    public SyntaxToken getIfKeyword() {
        return ifKeyword;
    }

    public SyntaxToken getOpenParen() {
        return openParen;
    }

    public Expression getCondition() {
        return condition;
    }

    public SyntaxToken getCloseParen() {
        return closeParen;
    }

    public Statement getStatement() {
        return statement;
    }

    public @Nullable ElseClause getElseClause() {
        return elseClause;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(ifKeyword, openParen, condition, closeParen, statement, elseClause);
    }
}
