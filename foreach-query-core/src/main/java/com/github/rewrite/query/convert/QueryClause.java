package com.github.rewrite.query.convert;

import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.SyntaxToken;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.TypeSyntax;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * One clause of a generated query.
 * <p>
 * {@code leadingTrivia} and {@code trailingTrivia} are emitted verbatim around the clause.
 * {@code absorbedTrivia} holds the comments of the tokens the clause replaces (keywords,
 * parentheses, semicolons); they are emitted after the clause body.
 */
@Value
public class QueryClause {

    QueryClauseKind kind;

    TriviaRun leadingTrivia;

    /**
     * Explicit range variable type of a {@code from} clause; {@code null} when implicit.
     */
    @Nullable
    TypeSyntax type;

    /**
     * Range variable of a {@code from} or {@code let} clause.
     */
    @Nullable
    SyntaxToken identifier;

    /**
     * Source of a {@code from}, condition of a {@code where}, value of a {@code let},
     * projection of a {@code select}.
     */
    Expression expression;

    TriviaRun absorbedTrivia;

    TriviaRun trailingTrivia;
}
