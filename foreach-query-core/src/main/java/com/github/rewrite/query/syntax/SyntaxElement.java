package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * Either a {@link SyntaxToken} or a {@link SyntaxNode}.
 */
public interface SyntaxElement {

    List<SyntaxToken> descendantTokens();

    /**
     * Source text including all leading and trailing trivia.
     */
    default String toFullString() {
        StringBuilder sb = new StringBuilder();
        for (SyntaxToken token : descendantTokens()) {
            sb.append(token.getLeadingTrivia().toFullString())
              .append(token.getText())
              .append(token.getTrailingTrivia().toFullString());
        }
        return sb.toString();
    }
}
