package com.github.rewrite.query.syntax;

import java.util.List;

public final class IdentifierName extends Expression {

    private final SyntaxToken identifier;

    public IdentifierName(SyntaxToken identifier) {
        this.identifier = identifier;
    }

    public static IdentifierName of(String name) {
        return new IdentifierName(SyntaxToken.of(name));
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.IDENTIFIER_NAME;
    }

    public SyntaxToken getIdentifier() {
        return identifier;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(identifier);
    }
}
