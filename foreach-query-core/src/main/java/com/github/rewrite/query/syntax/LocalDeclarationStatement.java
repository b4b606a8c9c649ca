package com.github.rewrite.query.syntax;

import java.util.List;

public final class LocalDeclarationStatement extends Statement {

    private final VariableDeclaration declaration;
    private final SyntaxToken semicolon;

    public LocalDeclarationStatement(VariableDeclaration declaration, SyntaxToken semicolon) {
        this.declaration = declaration;
        this.semicolon = semicolon;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.LOCAL_DECLARATION;
    }

    public VariableDeclaration getDeclaration() {
        return declaration;
    }

    public SyntaxToken getSemicolon() {
        return semicolon;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(declaration, semicolon);
    }
}
