package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One declared variable: {@code name} or {@code name = value}.
 */
public final class VariableDeclarator extends SyntaxNode {

    private final SyntaxToken identifier;
    private final @Nullable EqualsValueClause initializer;

    public VariableDeclarator(SyntaxToken identifier, @Nullable EqualsValueClause initializer) {
        this.identifier = identifier;
        this.initializer = initializer;
    }

    public SyntaxToken getIdentifier() {
        return identifier;
    }

    public @Nullable EqualsValueClause getInitializer() {
        return initializer;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(identifier, initializer);
    }
}
