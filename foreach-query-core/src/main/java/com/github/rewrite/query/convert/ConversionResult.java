package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.TriviaRun;
import lombok.Value;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything a host needs to replace a loop: the construct, what follows it and
 * what else has to change in the document.
 * <p>
 * Rendered in source order the replacement reads:
 * <pre>
 * leadingTrivia  construct(query)  chainLeadingTrivia  strategyTrivia | leftoverStatements  chainTrailingTrivia
 * </pre>
 * where the construct is the bare query ({@code DEFAULT}), {@code (query).Count()},
 * {@code (query).ToList()} or {@code return query;}.
 *
 * @see QueryPrinter
 */
@Value
public class ConversionResult {

    StrategyKind strategyKind;

    /**
     * The loop being replaced.
     */
    ForEachStatement forEachStatement;

    /**
     * Trivia in front of the loop, kept in front of the replacement.
     */
    TriviaRun leadingTrivia;

    QueryExpression query;

    /**
     * Brace trivia left over after the last clause.
     */
    TriviaRun chainLeadingTrivia;

    /**
     * Trivia of the statement consumed by a specialized strategy; empty for {@code DEFAULT}.
     */
    TriviaRun strategyTrivia;

    /**
     * Closing brace trivia of the blocks passed during classification, innermost first.
     */
    TriviaRun chainTrailingTrivia;

    /**
     * Statements re-emitted unchanged after the query ({@code DEFAULT} only).
     */
    List<Statement> leftoverStatements;

    /**
     * What the loop used to update: the counter for {@code COUNT}, the list for {@code TO_LIST}.
     * Hosts decide whether the result is assigned or added to it.
     */
    @Nullable
    Expression modifyingExpression;

    /**
     * Statements outside the loop made redundant by the rewrite, such as a trailing {@code yield break;}.
     */
    List<Statement> statementsToRemove;

    /**
     * Present when the query namespace is not yet imported at the loop.
     */
    @Nullable
    NamespaceImportRequest importRequest;
}
