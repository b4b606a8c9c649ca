package com.github.rewrite.query.syntax;

import java.util.List;

public final class EmptyStatement extends Statement {

    private final SyntaxToken semicolon;

    public EmptyStatement(SyntaxToken semicolon) {
        this.semicolon = semicolon;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.EMPTY;
    }

    public SyntaxToken getSemicolon() {
        return semicolon;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(semicolon);
    }
}
