package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.analysis.StrategyKind;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.IdentifierName;
import com.github.rewrite.query.syntax.Statement;

import java.util.List;

/**
 * Selects the innermost range variable and keeps the terminal statements after the query.
 */
public class DefaultConverter extends AbstractQueryConverter {

    public DefaultConverter(ForEachChain chain, QueryBuilder builder) {
        super(chain, builder);
    }

    @Override
    public StrategyKind getStrategyKind() {
        return StrategyKind.DEFAULT;
    }

    @Override
    protected Expression getSelectExpression() {
        return new IdentifierName(chain.getLastIdentifier().withoutTrivia());
    }

    @Override
    protected List<Statement> getLeftoverStatements() {
        return chain.getTerminalStatements();
    }
}
