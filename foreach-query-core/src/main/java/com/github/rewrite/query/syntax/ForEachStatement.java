package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code foreach (Type identifier in expression) statement}
 */
public final class ForEachStatement extends Statement {

    private final SyntaxToken forEachKeyword;
    private final SyntaxToken openParen;
    private final TypeSyntax type;
    private final SyntaxToken identifier;
    private final SyntaxToken inKeyword;
    private final Expression expression;
    private final SyntaxToken closeParen;
    private final Statement statement;

    public ForEachStatement(SyntaxToken forEachKeyword, SyntaxToken openParen, TypeSyntax type,
                            SyntaxToken identifier, SyntaxToken inKeyword, Expression expression,
                            SyntaxToken closeParen, Statement statement) {
        this.forEachKeyword = forEachKeyword;
        this.openParen = openParen;
        this.type = type;
        this.identifier = identifier;
        this.inKeyword = inKeyword;
        this.expression = expression;
        this.closeParen = closeParen;
        this.statement = statement;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.FOR_EACH;
    }

    public SyntaxToken getForEachKeyword() {
        return forEachKeyword;
    }

    public SyntaxToken getOpenParen() {
        return openParen;
    }

    public TypeSyntax getType() {
        return type;
    }

    public SyntaxToken getIdentifier() {
        return identifier;
    }

    public SyntaxToken getInKeyword() {
        return inKeyword;
    }

    public Expression getExpression() {
        return expression;
    }

    public SyntaxToken getCloseParen() {
        return closeParen;
    }

    /**
     * The loop body.
     */
    public Statement getStatement() {
        return statement;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(forEachKeyword, openParen, type, identifier, inKeyword, expression, closeParen, statement);
    }
}
