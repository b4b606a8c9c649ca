package com.github.rewrite.query.analysis;

import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.TriviaRun;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Replaces {@code counter++} with a count of the query results.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class CountStrategy extends ConversionStrategy {

    /**
     * The root iteration variable.
     */
    Expression selectExpression;

    /**
     * The incremented operand.
     */
    Expression modifyingExpression;

    /**
     * Trivia of the operand, the operator and the semicolon of the dropped statement.
     */
    TriviaRun trivia;

    @Override
    public StrategyKind getKind() {
        return StrategyKind.COUNT;
    }
}
