package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * A type reference, kept as its tokens. {@code var} marks an implicitly typed declaration.
 */
public final class TypeSyntax extends SyntaxNode {

    private final List<SyntaxToken> tokens;

    public TypeSyntax(List<SyntaxToken> tokens) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("A type needs at least one token");
        }
        this.tokens = List.copyOf(tokens);
    }

    public static TypeSyntax of(SyntaxToken token) {
        return new TypeSyntax(List.of(token));
    }

    public boolean isVar() {
        return tokens.size() == 1 && "var".equals(tokens.get(0).getText());
    }

    public List<SyntaxToken> getTokens() {
        return tokens;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(tokens);
    }
}
