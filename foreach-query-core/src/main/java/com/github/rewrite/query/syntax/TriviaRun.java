package com.github.rewrite.query.syntax;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An ordered, immutable sequence of {@link Trivia}.
 * <p>
 * Runs are values: concatenation and filtering always produce a new run and never
 * reorder the trivia they are built from.
 */
@EqualsAndHashCode
public final class TriviaRun implements Iterable<Trivia> {

    public static final TriviaRun EMPTY = new TriviaRun(Collections.emptyList());

    private final List<Trivia> trivia;

    private TriviaRun(List<Trivia> trivia) {
        this.trivia = trivia;
    }

    public static TriviaRun of(Trivia... trivia) {
        return of(Arrays.asList(trivia));
    }

    public static TriviaRun of(List<Trivia> trivia) {
        if (trivia.isEmpty()) {
            return EMPTY;
        }
        return new TriviaRun(List.copyOf(trivia));
    }

    /**
     * A run holding a single whitespace trivia, or {@link #EMPTY} for an empty string.
     */
    public static TriviaRun whitespace(String text) {
        return text.isEmpty() ? EMPTY : of(Trivia.whitespace(text));
    }

    public static TriviaRun concat(TriviaRun... runs) {
        return concat(Arrays.asList(runs));
    }

    public static TriviaRun concat(List<TriviaRun> runs) {
        List<Trivia> all = new ArrayList<>();
        for (TriviaRun run : runs) {
            all.addAll(run.trivia);
        }
        return of(all);
    }

    /**
     * Leading trivia of every token followed by its trailing trivia, in token order.
     */
    public static TriviaRun ofTokens(List<SyntaxToken> tokens) {
        List<Trivia> all = new ArrayList<>();
        for (SyntaxToken token : tokens) {
            all.addAll(token.getLeadingTrivia().trivia);
            all.addAll(token.getTrailingTrivia().trivia);
        }
        return of(all);
    }

    public TriviaRun append(TriviaRun other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return concat(this, other);
    }

    public List<Trivia> getTrivia() {
        return trivia;
    }

    public List<Trivia> getComments() {
        List<Trivia> comments = new ArrayList<>();
        for (Trivia t : trivia) {
            if (t.isComment()) {
                comments.add(t);
            }
        }
        return comments;
    }

    public boolean containsDirectives() {
        for (Trivia t : trivia) {
            if (t.getKind() == TriviaKind.DIRECTIVE) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return trivia.isEmpty();
    }

    public int size() {
        return trivia.size();
    }

    @Override
    public Iterator<Trivia> iterator() {
        return trivia.iterator();
    }

    public String toFullString() {
        StringBuilder sb = new StringBuilder();
        for (Trivia t : trivia) {
            sb.append(t.getText());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toFullString();
    }
}
