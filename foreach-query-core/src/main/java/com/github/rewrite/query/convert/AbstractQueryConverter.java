package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.ConversionStrategy;
import com.github.rewrite.query.analysis.CountStrategy;
import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.analysis.ToListStrategy;
import com.github.rewrite.query.analysis.YieldReturnStrategy;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.TriviaRun;
import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * Base for the per-strategy converters. The query is built the same way for every strategy;
 * subclasses decide the projection and what happens to the terminal statement.
 */
public abstract class AbstractQueryConverter {

    protected final ForEachChain chain;
    protected final QueryBuilder builder;

    protected AbstractQueryConverter(ForEachChain chain, QueryBuilder builder) {
        this.chain = chain;
        this.builder = builder;
    }

    public static AbstractQueryConverter create(ForEachChain chain, ConversionStrategy strategy, QueryBuilder builder) {
        return switch (strategy.getKind()) {
            case DEFAULT -> new DefaultConverter(chain, builder);
            case COUNT -> new ToCountConverter(chain, (CountStrategy) strategy, builder);
            case TO_LIST -> new ToListConverter(chain, (ToListStrategy) strategy, builder);
            case YIELD_RETURN -> new YieldReturnConverter(chain, (YieldReturnStrategy) strategy, builder);
        };
    }

    public abstract StrategyKind getStrategyKind();

    protected abstract Expression getSelectExpression();

    protected TriviaRun getStrategyTrivia() {
        return TriviaRun.EMPTY;
    }

    protected List<Statement> getLeftoverStatements() {
        return Collections.emptyList();
    }

    protected @Nullable Expression getModifyingExpression() {
        return null;
    }

    protected List<Statement> getStatementsToRemove() {
        return Collections.emptyList();
    }

    public ConversionResult convert() {
        return new ConversionResult(
                getStrategyKind(),
                chain.getForEachStatement(),
                chain.getForEachStatement().getLeadingTrivia(),
                builder.buildQuery(chain, getSelectExpression()),
                chain.getLeadingTrivia(),
                getStrategyTrivia(),
                chain.getTrailingTrivia(),
                getLeftoverStatements(),
                getModifyingExpression(),
                getStatementsToRemove(),
                builder.importRequest(chain));
    }
}
