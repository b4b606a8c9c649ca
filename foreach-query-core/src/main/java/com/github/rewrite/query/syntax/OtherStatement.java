package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * Any statement the converter has no dedicated handling for ({@code while}, {@code try},
 * {@code return}, ...). Embedded statements stay visible as child nodes so that
 * yields nested inside them are still found.
 */
public final class OtherStatement extends Statement {

    private final List<SyntaxElement> elements;

    public OtherStatement(List<SyntaxElement> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("A statement needs at least one element");
        }
        this.elements = List.copyOf(elements);
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.OTHER;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements;
    }
}
