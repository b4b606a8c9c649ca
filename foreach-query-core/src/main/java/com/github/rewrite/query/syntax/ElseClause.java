package com.github.rewrite.query.syntax;

import java.util.List;

public final class ElseClause extends SyntaxNode {

    private final SyntaxToken elseKeyword;
    private final Statement statement;

    public ElseClause(SyntaxToken elseKeyword, Statement statement) {
        this.elseKeyword = elseKeyword;
        this.statement = statement;
    }

    public SyntaxToken getElseKeyword() {
        return elseKeyword;
    }

    public Statement getStatement() {
        return statement;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(elseKeyword, statement);
    }
}
