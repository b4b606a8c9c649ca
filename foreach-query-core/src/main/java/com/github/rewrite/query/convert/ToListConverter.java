package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.analysis.ToListStrategy;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.TriviaRun;

public class ToListConverter extends AbstractQueryConverter {

    private final ToListStrategy strategy;

    public ToListConverter(ForEachChain chain, ToListStrategy strategy, QueryBuilder builder) {
        super(chain, builder);
        this.strategy = strategy;
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.TO_LIST;
    }

    /**
     * The argument that was added to the list.
     */
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
