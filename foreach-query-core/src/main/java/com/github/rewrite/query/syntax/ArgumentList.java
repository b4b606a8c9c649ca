package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code (a, b)}
 */
public final class ArgumentList extends SyntaxNode {

    private final SyntaxToken openParen;
    private final SeparatedSyntaxList<Expression> arguments;
    private final SyntaxToken closeParen;

    public ArgumentList(SyntaxToken openParen, SeparatedSyntaxList<Expression> arguments, SyntaxToken closeParen) {
        this.openParen = openParen;
        this.arguments = arguments;
        this.closeParen = closeParen;
    }

    public SyntaxToken getOpenParen() {
        return openParen;
    }

    public SeparatedSyntaxList<Expression> getArguments() {
        return arguments;
    }

    public SyntaxToken getCloseParen() {
        return closeParen;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(openParen, arguments, closeParen);
    }
}
