package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.CountStrategy;
import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.TriviaRun;

public class ToCountConverter extends AbstractQueryConverter {

    private final CountStrategy strategy;

    public ToCountConverter(ForEachChain chain, CountStrategy strategy, QueryBuilder builder) {
        super(chain, builder);
        this.strategy = strategy;
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.COUNT;
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
    protected Expression getModifyingExpression() {
        return strategy.getModifyingExpression();
    }
}
