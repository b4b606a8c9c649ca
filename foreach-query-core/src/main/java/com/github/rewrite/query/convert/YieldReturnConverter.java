package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.analysis.YieldReturnStrategy;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.TriviaRun;

import java.util.Collections;
import java.util.List;

/**
 * {@code return query;} in place of the loop. A trailing {@code yield break;} is reported for removal.
 */
public class YieldReturnConverter extends AbstractQueryConverter {

    private final YieldReturnStrategy strategy;

    public YieldReturnConverter(ForEachChain chain, YieldReturnStrategy strategy, QueryBuilder builder) {
        super(chain, builder);
        this.strategy = strategy;
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.YIELD_RETURN;
    }

    @Override
    protected Expression getSelectExpression() {
        return strategy.getSelectExpression();
    }

    @Override
    protected TriviaRun getStrategyTrivia() {
        return strategy.getTrivia();
    }

    @Override
    protected List<Statement> getStatementsToRemove() {
        if (strategy.getYieldBreak() == null) {
            return Collections.emptyList();
        }
        return Collections.singletonList(strategy.getYieldBreak());
    }
}
