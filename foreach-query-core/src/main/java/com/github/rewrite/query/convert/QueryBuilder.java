package com.github.rewrite.query.convert;

import com.github.rewrite.query.analysis.ExtendedNode;
import com.github.rewrite.query.analysis.ForEachChain;
import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.syntax.EqualsValueClause;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.IfStatement;
import com.github.rewrite.query.syntax.SyntaxToken;
import com.github.rewrite.query.syntax.Trivia;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.TypeSyntax;
import com.github.rewrite.query.syntax.VariableDeclarator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a classified chain into query clauses.
 * <p>
 * Clause trivia follows two rules:
 * <ul>
 *   <li>the leading and trailing trivia recorded on an {@link ExtendedNode} is kept verbatim</li>
 *   <li>tokens that disappear ({@code foreach}, {@code if}, parentheses, {@code =}) and the outer
 *       trivia of the parts that move (type, identifier, expression) only contribute their comments</li>
 * </ul>
 */
public class QueryBuilder {

    private static final Logger logger = LogManager.getLogger(QueryBuilder.class);

    private final ConversionOptions options;

    public QueryBuilder() {
        this(ConversionOptions.defaults());
    }

    public QueryBuilder(ConversionOptions options) {
        this.options = options;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /**
     * {@code from} clause for the root loop, followed by one clause per converting node.
     * The root clause carries no leading trivia; the trivia in front of the loop stays in front of the replacement.
     */
    public List<QueryClause> buildClauses(ForEachChain chain) {
        List<QueryClause> clauses = new ArrayList<>();
        clauses.add(fromClause(chain.getForEachStatement(), TriviaRun.EMPTY, TriviaRun.EMPTY));
        for (ExtendedNode node : chain.getConvertingNodes()) {
            clauses.add(clauseFor(node));
        }
        return clauses;
    }

    public QueryExpression buildQuery(ForEachChain chain, Expression selectExpression) {
        List<QueryClause> clauses = buildClauses(chain);
        clauses.add(selectClause(selectExpression));
        return new QueryExpression(clauses);
    }

    private QueryClause clauseFor(ExtendedNode node) {
        return switch (node.getKind()) {
            case NESTED_LOOP -> {
                ForEachStatement forEach = (ForEachStatement) node.getNode();
                yield fromClause(forEach,
                        node.getLeadingTrivia().append(forEach.getForEachKeyword().getLeadingTrivia()),
                        node.getTrailingTrivia());
            }
            case CONDITION -> {
                IfStatement ifStatement = (IfStatement) node.getNode();
                yield whereClause(ifStatement,
                        node.getLeadingTrivia().append(ifStatement.getIfKeyword().getLeadingTrivia()),
                        node.getTrailingTrivia());
            }
            case DECLARATOR -> {
                VariableDeclarator declarator = (VariableDeclarator) node.getNode();
                yield letClause(declarator,
                        node.getLeadingTrivia().append(declarator.getIdentifier().getLeadingTrivia()),
                        node.getTrailingTrivia());
            }
        };
    }

    /**
     * {@code leading} already includes the keyword's leading trivia where it is kept.
     */
    QueryClause fromClause(ForEachStatement forEach, TriviaRun leading, TriviaRun trailing) {
        TypeSyntax type = forEach.getType();
        TypeSyntax explicitType = type.isVar() ? null : type;
        TriviaRun typeTrivia = type.isVar()
                ? TriviaRun.ofTokens(type.getTokens())
                : TriviaRun.concat(type.getLeadingTrivia(), type.getTrailingTrivia());
        return new QueryClause(
                QueryClauseKind.FROM,
                leading,
                explicitType,
                forEach.getIdentifier().withoutTrivia(),
                forEach.getExpression(),
                commentsOf(
                        forEach.getForEachKeyword().getTrailingTrivia(),
                        forEach.getOpenParen().getAllTrivia(),
                        typeTrivia,
                        forEach.getIdentifier().getAllTrivia(),
                        forEach.getInKeyword().getAllTrivia(),
                        outerTrivia(forEach.getExpression()),
                        forEach.getCloseParen().getAllTrivia()),
                trailing);
    }

    QueryClause whereClause(IfStatement ifStatement, TriviaRun leading, TriviaRun trailing) {
        return new QueryClause(
                QueryClauseKind.WHERE,
                leading,
                null,
                null,
                ifStatement.getCondition(),
                commentsOf(
                        ifStatement.getIfKeyword().getTrailingTrivia(),
                        ifStatement.getOpenParen().getAllTrivia(),
                        outerTrivia(ifStatement.getCondition()),
                        ifStatement.getCloseParen().getAllTrivia()),
                trailing);
    }

    QueryClause letClause(VariableDeclarator declarator, TriviaRun leading, TriviaRun trailing) {
        EqualsValueClause initializer = declarator.getInitializer();
        if (initializer == null) {
            throw new IllegalArgumentException("let needs an initialized variable: " + declarator);
        }
        return new QueryClause(
                QueryClauseKind.LET,
                leading,
                null,
                declarator.getIdentifier().withoutTrivia(),
                initializer.getValue(),
                commentsOf(
                        declarator.getIdentifier().getTrailingTrivia(),
                        initializer.getEqualsToken().getAllTrivia(),
                        outerTrivia(initializer.getValue())),
                trailing);
    }

    QueryClause selectClause(Expression expression) {
        return new QueryClause(
                QueryClauseKind.SELECT,
                TriviaRun.EMPTY,
                null,
                null,
                expression,
                commentsOf(outerTrivia(expression)),
                TriviaRun.EMPTY);
    }

    /**
     * Requests the query namespace import unless it is already in scope at the loop.
     */
    public @Nullable NamespaceImportRequest importRequest(ForEachChain chain) {
        String namespace = options.getQueryNamespace();
        if (chain.getSemanticModel().isNamespaceInScope(namespace, chain.getForEachStatement())) {
            return null;
        }
        logger.debug("Namespace {} is not in scope, requesting import", namespace);
        return new NamespaceImportRequest(namespace);
    }

    private static TriviaRun outerTrivia(Expression expression) {
        return TriviaRun.concat(expression.getLeadingTrivia(), expression.getTrailingTrivia());
    }

    static TriviaRun commentsOf(TriviaRun... runs) {
        List<Trivia> comments = new ArrayList<>();
        for (TriviaRun run : runs) {
            comments.addAll(run.getComments());
        }
        return TriviaRun.of(comments);
    }
}
