package com.github.rewrite.query.analysis;

import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.TriviaRun;
import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Replaces {@code list.Add(item)} with the query materialized to a list.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class ToListStrategy extends ConversionStrategy {

    /**
     * The added item.
     */
    Expression selectExpression;

    /**
     * The list receiving the items.
     */
    Expression modifyingExpression;

    /**
     * Trivia of the member access, both parentheses and the semicolon of the dropped statement.
     */
    TriviaRun trivia;

    @Override
    public StrategyKind getKind() {
        return StrategyKind.TO_LIST;
    }
}
