package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * An expression the converter only needs to copy, such as {@code x > 0} or {@code x * 2}.
 */
public final class OtherExpression extends Expression {

    private final List<SyntaxElement> elements;

    public OtherExpression(List<SyntaxElement> elements) {
        if (elements.isEmpty()) {
            throw new IllegalArgumentException("An expression needs at least one element");
        }
        this.elements = List.copyOf(elements);
    }

    @Override
    public ExpressionKind getKind() {
        return ExpressionKind.OTHER;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements;
    }
}
