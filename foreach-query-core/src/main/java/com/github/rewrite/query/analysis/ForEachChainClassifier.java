package com.github.rewrite.query.analysis;

import com.github.rewrite.query.config.ConversionOptions;
import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.syntax.BlockStatement;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.IfStatement;
import com.github.rewrite.query.syntax.LocalDeclarationStatement;
import com.github.rewrite.query.syntax.SeparatedSyntaxList;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.StatementKind;
import com.github.rewrite.query.syntax.SyntaxToken;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.TypeSyntax;
import com.github.rewrite.query.syntax.VariableDeclaration;
import com.github.rewrite.query.syntax.VariableDeclarator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Descends from a loop body and collects the statements that can become query clauses.
 * <p>
 * Descent is a single pass without backtracking:
 * <ul>
 *   <li>a block contributes its braces' trivia; all but its last statement must be fully
 *       initialized local declarations, the last one becomes the current statement</li>
 *   <li>a nested loop becomes a {@code from} clause, descent continues into its body</li>
 *   <li>an {@code if} without {@code else} becomes a {@code where} clause, descent continues</li>
 *   <li>a fully initialized local declaration becomes {@code let} clauses and ends descent</li>
 *   <li>an empty statement or empty block ends descent cleanly</li>
 *   <li>anything else ends descent and is left to the {@link TerminalMatcher}</li>
 * </ul>
 * <pre>
 * foreach (var x in xs)      from x in xs
 * {
 *     var y = x * 2;         let y = x * 2
 *     if (y > 3)             where y > 3
 *     {
 *         list.Add(y);       (terminal statement)
 *     }
 * }
 * </pre>
 */
public class ForEachChainClassifier {

    private static final Logger logger = LogManager.getLogger(ForEachChainClassifier.class);

    private final boolean convertLocalDeclarations;

    public ForEachChainClassifier() {
        this(ConversionOptions.defaults());
    }

    public ForEachChainClassifier(ConversionOptions options) {
        this.convertLocalDeclarations = options.isConvertLocalDeclarations();
    }

    public ForEachChain classify(ForEachStatement forEachStatement, SemanticModel semanticModel) {
        Descent descent = new Descent(forEachStatement);
        descent.run();
        ForEachChain chain = descent.seal(semanticModel);
        logger.debug("Classified loop over '{}': {} clause(s), {} terminal statement(s)",
                forEachStatement.getExpression(), chain.getConvertingNodes().size(),
                chain.getTerminalStatements().size());
        return chain;
    }

    /**
     * Mutable state of one classification. Discarded once the chain is sealed.
     */
    private final class Descent {

        private final ForEachStatement forEachStatement;
        private final List<SyntaxToken> identifiers = new ArrayList<>();
        private final List<ExtendedNode> convertingNodes = new ArrayList<>();
        private final List<SyntaxToken> trailingTokens = new ArrayList<>();
        private List<SyntaxToken> currentLeadingTokens = new ArrayList<>();
        private @Nullable List<Statement> terminalStatements;
        private Statement current;

        Descent(ForEachStatement forEachStatement) {
            this.forEachStatement = forEachStatement;
            this.identifiers.add(forEachStatement.getIdentifier());
            this.current = forEachStatement.getStatement();
        }

        void run() {
            while (terminalStatements == null) {
                switch (current.getKind()) {
                    case BLOCK -> visitBlock((BlockStatement) current);
                    case FOR_EACH -> visitForEach((ForEachStatement) current);
                    case IF -> visitIf((IfStatement) current);
                    case LOCAL_DECLARATION -> visitLocalDeclaration((LocalDeclarationStatement) current);
                    case EMPTY -> terminalStatements = Collections.emptyList();
                    default -> terminalStatements = Collections.singletonList(current);
                }
            }
        }

        private void visitBlock(BlockStatement block) {
            currentLeadingTokens.add(block.getOpenBrace());
            trailingTokens.add(block.getCloseBrace());

            List<Statement> statements = block.getStatements();
            if (statements.isEmpty()) {
                terminalStatements = Collections.emptyList();
                return;
            }

            // Everything before the last statement has to be a declaration we can turn into let clauses
            for (int i = 0; i < statements.size() - 1; i++) {
                Statement statement = statements.get(i);
                if (isConvertibleDeclaration(statement)) {
                    addDeclarators((LocalDeclarationStatement) statement);
                } else {
                    terminalStatements = List.copyOf(statements.subList(i, statements.size()));
                    return;
                }
            }

            current = statements.get(statements.size() - 1);
        }

        private void visitForEach(ForEachStatement nested) {
            identifiers.add(nested.getIdentifier());
            convertingNodes.add(new ExtendedNode(nested, takeLeadingTrivia(), TriviaRun.EMPTY));
            current = nested.getStatement();
        }

        private void visitIf(IfStatement ifStatement) {
            if (ifStatement.getElseClause() != null) {
                terminalStatements = Collections.singletonList(ifStatement);
                return;
            }
            convertingNodes.add(new ExtendedNode(ifStatement, takeLeadingTrivia(), TriviaRun.EMPTY));
            current = ifStatement.getStatement();
        }

        private void visitLocalDeclaration(LocalDeclarationStatement declaration) {
            if (isConvertibleDeclaration(declaration)) {
                addDeclarators(declaration);
                // Declarations have nothing nested to descend into
                terminalStatements = Collections.emptyList();
            } else {
                terminalStatements = Collections.singletonList(declaration);
            }
        }

        private boolean isConvertibleDeclaration(Statement statement) {
            return convertLocalDeclarations &&
                   statement.getKind() == StatementKind.LOCAL_DECLARATION &&
                   ((LocalDeclarationStatement) statement).getDeclaration().isFullyInitialized();
        }

        /**
         * One extended node per declared variable:
         * <pre>
         * int a = 1, b = 2;   ->   let a = 1  let b = 2
         * </pre>
         * The first variable takes the pending brace trivia and the type's trivia, later ones
         * the trivia after the preceding comma. The last one takes the semicolon's trivia.
         */
        private void addDeclarators(LocalDeclarationStatement statement) {
            VariableDeclaration declaration = statement.getDeclaration();
            TypeSyntax type = declaration.getType();
            SeparatedSyntaxList<VariableDeclarator> variables = declaration.getVariables();

            TriviaRun firstLeading = TriviaRun.concat(
                    TriviaRun.ofTokens(currentLeadingTokens),
                    type.getLeadingTrivia(),
                    type.getTrailingTrivia());
            TriviaRun lastTrailing = statement.getSemicolon().getAllTrivia();

            for (int i = 0; i < variables.size(); i++) {
                TriviaRun leading = i == 0 ? firstLeading : trailingTriviaOf(variables.getSeparator(i - 1));
                TriviaRun trailing = i == variables.size() - 1
                        ? lastTrailing
                        : leadingTriviaOf(variables.getSeparator(i));
                VariableDeclarator variable = variables.get(i);
                convertingNodes.add(new ExtendedNode(variable, leading, trailing));
                identifiers.add(variable.getIdentifier());
            }

            currentLeadingTokens = new ArrayList<>();
        }

        private TriviaRun takeLeadingTrivia() {
            TriviaRun trivia = TriviaRun.ofTokens(currentLeadingTokens);
            currentLeadingTokens = new ArrayList<>();
            return trivia;
        }

        ForEachChain seal(SemanticModel semanticModel) {
            // Closing braces were collected from the outermost block inwards; they are re-emitted innermost first
            List<SyntaxToken> reversedTrailing = new ArrayList<>(trailingTokens);
            Collections.reverse(reversedTrailing);

            return new ForEachChain(
                    forEachStatement,
                    semanticModel,
                    convertingNodes,
                    identifiers,
                    terminalStatements,
                    currentLeadingTokens,
                    reversedTrailing);
        }
    }

    // A separator may be missing in code with syntax errors
    private static TriviaRun leadingTriviaOf(@Nullable SyntaxToken separator) {
        return separator == null ? TriviaRun.EMPTY : separator.getLeadingTrivia();
    }

    private static TriviaRun trailingTriviaOf(@Nullable SyntaxToken separator) {
        return separator == null ? TriviaRun.EMPTY : separator.getTrailingTrivia();
    }
}
