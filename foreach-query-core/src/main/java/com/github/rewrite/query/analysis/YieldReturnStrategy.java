package com.github.rewrite.query.analysis;

import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.YieldStatement;
import lombok.EqualsAndHashCode;
import lombok.Value;
import org.jspecify.annotations.Nullable;

/**
 * Replaces a loop that only yields with {@code return query;}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class YieldReturnStrategy extends ConversionStrategy {

    YieldStatement yieldReturn;

    /**
     * A trailing {@code yield break;} made redundant by the rewrite, or {@code null}.
     */
    @Nullable
    YieldStatement yieldBreak;

    /**
     * The yielded expression.
     */
    public Expression getSelectExpression() {
        Expression expression = yieldReturn.getExpression();
        if (expression == null) {
            throw new IllegalStateException("yield return without a value");
        }
        return expression;
    }

    /**
     * Trivia of the {@code yield} and {@code return} keywords and the semicolon.
     */
    public TriviaRun getTrivia() {
        return TriviaRun.concat(
                yieldReturn.getYieldKeyword().getAllTrivia(),
                yieldReturn.getReturnOrBreakKeyword().getAllTrivia(),
                yieldReturn.getSemicolon().getAllTrivia());
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.YIELD_RETURN;
    }
}
