package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code { statements }}
 */
public final class BlockStatement extends Statement {

    private final SyntaxToken openBrace;
    private final List<Statement> statements;
    private final SyntaxToken closeBrace;

    public BlockStatement(SyntaxToken openBrace, List<Statement> statements, SyntaxToken closeBrace) {
        this.openBrace = openBrace;
        this.statements = List.copyOf(statements);
        this.closeBrace = closeBrace;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.BLOCK;
    }

    public SyntaxToken getOpenBrace() {
        return openBrace;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public SyntaxToken getCloseBrace() {
        return closeBrace;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(openBrace, statements, closeBrace);
    }
}
