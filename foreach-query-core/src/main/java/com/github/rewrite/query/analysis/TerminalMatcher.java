package com.github.rewrite.query.analysis;

import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.semantic.CancellationToken;
import com.github.rewrite.query.semantic.MethodSymbol;
import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.syntax.BlockStatement;
import com.github.rewrite.query.syntax.BodiedDeclaration;
import com.github.rewrite.query.syntax.Expression;
import com.github.rewrite.query.syntax.ExpressionKind;
import com.github.rewrite.query.syntax.ExpressionStatement;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.IdentifierName;
import com.github.rewrite.query.syntax.InvocationExpression;
import com.github.rewrite.query.syntax.MemberAccessExpression;
import com.github.rewrite.query.syntax.PostfixUnaryExpression;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.StatementKind;
import com.github.rewrite.query.syntax.SyntaxNode;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.YieldStatement;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Chooses the rewrite for a classified loop by looking at the statement where descent stopped.
 * <p>
 * Only a single terminal statement can select a specialized strategy:
 * <ul>
 *   <li>{@code c++;} selects {@link CountStrategy}</li>
 *   <li>{@code list.Add(item);} on the generic list type selects {@link ToListStrategy}; the method
 *       name is {@link ConversionOptions#getListAddMethod()}</li>
 *   <li>{@code yield return item;} in a loop that ends its member selects {@link YieldReturnStrategy}</li>
 * </ul>
 * Everything else, including a clean end of descent, selects {@link DefaultStrategy}.
 * <p>
 * Each semantic lookup is preceded by a cancellation check. A canceled match throws
 * {@link com.github.rewrite.query.semantic.AnalysisCanceledException} instead of returning a strategy.
 */
public class TerminalMatcher {

    private static final Logger logger = LogManager.getLogger(TerminalMatcher.class);

    private final ConversionOptions options;

    public TerminalMatcher() {
        this(ConversionOptions.defaults());
    }

    public TerminalMatcher(ConversionOptions options) {
        this.options = options;
    }

    public ConversionStrategy match(ForEachChain chain, CancellationToken cancellationToken) {
        ConversionStrategy strategy = matchSpecific(chain, cancellationToken);
        if (strategy == null || !options.isEnabled(strategy.getKind())) {
            strategy = DefaultStrategy.INSTANCE;
        }
        logger.debug("Selected {} for loop over '{}'", strategy.getKind(),
                chain.getForEachStatement().getExpression());
        return strategy;
    }

    private @Nullable ConversionStrategy matchSpecific(ForEachChain chain, CancellationToken cancellationToken) {
        // Multi-statement remainders are only ever converted with the default strategy
        if (chain.getTerminalStatements().size() != 1) {
            return null;
        }
        Statement terminal = chain.getTerminalStatements().get(0);
        return switch (terminal.getKind()) {
            case EXPRESSION -> matchExpressionStatement(chain, (ExpressionStatement) terminal, cancellationToken);
            case YIELD_RETURN -> matchYieldReturn(chain, (YieldStatement) terminal, cancellationToken);
            default -> null;
        };
    }

    private @Nullable ConversionStrategy matchExpressionStatement(ForEachChain chain, ExpressionStatement statement,
                                                        CancellationToken cancellationToken) {
        Expression expression = statement.getExpression();
        if (expression.getKind() == ExpressionKind.POST_INCREMENT) {
            // foreach (var x in a) { ... c++; }  ->  (from x in a ... select x).Count()
            PostfixUnaryExpression increment = (PostfixUnaryExpression) expression;
            Expression operand = increment.getOperand();
            return new CountStrategy(
                    new IdentifierName(chain.getRootIdentifier().withoutTrivia()),
                    operand,
                    TriviaRun.concat(
                            TriviaRun.ofTokens(operand.descendantTokens()),
                            increment.getOperatorToken().getAllTrivia(),
                            statement.getSemicolon().getAllTrivia()));
        }
        if (expression.getKind() == ExpressionKind.INVOCATION) {
            // foreach (var x in a) { ... list.Add(y); }  ->  (from x in a ... select y).ToList()
            return matchListAdd(chain, statement, (InvocationExpression) expression, cancellationToken);
        }
        return null;
    }

    private @Nullable ConversionStrategy matchListAdd(ForEachChain chain, ExpressionStatement statement,
                                            InvocationExpression invocation, CancellationToken cancellationToken) {
        if (invocation.getExpression().getKind() != ExpressionKind.MEMBER_ACCESS ||
                invocation.getArgumentList().getArguments().size() != 1) {
            return null;
        }
        MemberAccessExpression memberAccess = (MemberAccessExpression) invocation.getExpression();

        cancellationToken.throwIfCancellationRequested();
        SemanticModel semanticModel = chain.getSemanticModel();
        Optional<MethodSymbol> method = semanticModel.resolveInvocation(invocation, cancellationToken);
        if (method.isEmpty() || !isListAdd(method.get(), semanticModel)) {
            return null;
        }

        return new ToListStrategy(
                invocation.getArgumentList().getArguments().get(0),
                memberAccess.getExpression(),
                TriviaRun.concat(
                        TriviaRun.ofTokens(memberAccess.descendantTokens()),
                        invocation.getArgumentList().getOpenParen().getAllTrivia(),
                        invocation.getArgumentList().getCloseParen().getAllTrivia(),
                        statement.getSemicolon().getAllTrivia()));
    }

    private boolean isListAdd(MethodSymbol method, SemanticModel semanticModel) {
        return options.getListAddMethod().equals(method.getName()) &&
               method.getParameterCount() == 1 &&
               semanticModel.isGenericListType(method.getContainingType());
    }

    private @Nullable ConversionStrategy matchYieldReturn(ForEachChain chain, YieldStatement yieldReturn,
                                                CancellationToken cancellationToken) {
        if (yieldReturn.getExpression() == null) {
            return null;
        }
        ForEachStatement forEachStatement = chain.getForEachStatement();
        SemanticModel semanticModel = chain.getSemanticModel();

        cancellationToken.throwIfCancellationRequested();
        Optional<BodiedDeclaration> enclosing = semanticModel.getEnclosingMember(forEachStatement, cancellationToken);
        if (enclosing.isEmpty() || enclosing.get().getBody() == null) {
            return null;
        }
        BodiedDeclaration member = enclosing.get();
        BlockStatement body = member.getBody();

        // The loop has to be a direct statement of the member body, not nested in another block
        if (!containsInstance(body.getStatements(), forEachStatement)) {
            return null;
        }

        int yieldCount = countOwnedYields(body, member, semanticModel, cancellationToken);

        List<Statement> statements = new ArrayList<>();
        for (Statement statement : body.getStatements()) {
            if (statement.getKind() != StatementKind.LOCAL_FUNCTION) {
                statements.add(statement);
            }
        }
        Statement last = statements.get(statements.size() - 1);

        if (yieldCount == 1 && last == forEachStatement) {
            return new YieldReturnStrategy(yieldReturn, null);
        }

        // foreach (...) { yield return ...; }
        // yield break;
        // end of member
        if (yieldCount == 2 &&
                last.getKind() == StatementKind.YIELD_BREAK &&
                !last.containsDirectives() &&
                statements.size() >= 2 &&
                statements.get(statements.size() - 2) == forEachStatement) {
            return new YieldReturnStrategy(yieldReturn, (YieldStatement) last);
        }

        return null;
    }

    /**
     * Yields directly owned by {@code member}; yields of nested local functions belong to those.
     */
    private static int countOwnedYields(BlockStatement body, BodiedDeclaration member,
                                        SemanticModel semanticModel, CancellationToken cancellationToken) {
        int count = 0;
        for (SyntaxNode node : body.descendantNodes()) {
            if (!(node instanceof YieldStatement)) {
                continue;
            }
            cancellationToken.throwIfCancellationRequested();
            Optional<BodiedDeclaration> owner = semanticModel.getEnclosingMember(node, cancellationToken);
            if (owner.isPresent() && owner.get() == member) {
                count++;
            }
        }
        return count;
    }

    private static boolean containsInstance(List<Statement> statements, Statement statement) {
        for (Statement candidate : statements) {
            if (candidate == statement) {
                return true;
            }
        }
        return false;
    }
}
