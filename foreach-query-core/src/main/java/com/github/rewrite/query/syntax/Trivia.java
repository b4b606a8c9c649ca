package com.github.rewrite.query.syntax;

import lombok.Value;

/**
 * A single formatting or comment token, kept verbatim.
 */
@Value
public class Trivia {
    TriviaKind kind;
    String text;

    public static Trivia whitespace(String text) {
        return new Trivia(TriviaKind.WHITESPACE, text);
    }

    public static Trivia endOfLine() {
        return new Trivia(TriviaKind.END_OF_LINE, "\n");
    }

    public static Trivia endOfLine(String text) {
        return new Trivia(TriviaKind.END_OF_LINE, text);
    }

    public static Trivia singleLineComment(String text) {
        return new Trivia(TriviaKind.SINGLE_LINE_COMMENT, text);
    }

    public static Trivia multiLineComment(String text) {
        return new Trivia(TriviaKind.MULTI_LINE_COMMENT, text);
    }

    public static Trivia directive(String text) {
        return new Trivia(TriviaKind.DIRECTIVE, text);
    }

    public boolean isComment() {
        return kind.isComment();
    }

    @Override
    public String toString() {
        return text;
    }
}
