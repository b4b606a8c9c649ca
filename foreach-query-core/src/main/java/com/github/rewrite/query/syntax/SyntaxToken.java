package com.github.rewrite.query.syntax;

import lombok.Value;
import lombok.With;

import java.util.Collections;
import java.util.List;

/**
 * A lexical token with the trivia attached before and after it.
 * <p>
 * A token with empty text is a missing token, as produced by parsers recovering
 * from syntax errors.
 */
@Value
@With
public class SyntaxToken implements SyntaxElement {
    String text;
    TriviaRun leadingTrivia;
    TriviaRun trailingTrivia;

    public static SyntaxToken of(String text) {
        return new SyntaxToken(text, TriviaRun.EMPTY, TriviaRun.EMPTY);
    }

    public static SyntaxToken missing() {
        return of("");
    }

    public boolean isMissing() {
        return text.isEmpty();
    }

    public SyntaxToken withoutTrivia() {
        if (leadingTrivia.isEmpty() && trailingTrivia.isEmpty()) {
            return this;
        }
        return new SyntaxToken(text, TriviaRun.EMPTY, TriviaRun.EMPTY);
    }

    /**
     * Leading trivia followed by trailing trivia.
     */
    public TriviaRun getAllTrivia() {
        return leadingTrivia.append(trailingTrivia);
    }

    @Override
    public List<SyntaxToken> descendantTokens() {
        return Collections.singletonList(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
