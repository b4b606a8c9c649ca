package com.github.rewrite.query.analysis;

import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.Statement;
import com.github.rewrite.query.syntax.SyntaxToken;
import com.github.rewrite.query.syntax.TriviaRun;
import lombok.Value;

import java.util.List;

/**
 * Result of classifying a loop: the clause chain below the root loop and the
 * statements where classification stopped.
 * <p>
 * Built once by {@link ForEachChainClassifier} and never modified.
 */
@Value
public class ForEachChain {

    ForEachStatement forEachStatement;

    SemanticModel semanticModel;

    /**
     * One entry per future clause, root loop excluded.
     */
    List<ExtendedNode> convertingNodes;

    /**
     * Root iteration variable first, then one per nested loop or declared variable, in scope order.
     */
    List<SyntaxToken> identifiers;

    /**
     * Every statement from the first unconvertible one to the end of its block.
     * Empty when the chain ended cleanly.
     */
    List<Statement> terminalStatements;

    /**
     * Brace tokens collected after the last clause and not yet attached to one.
     */
    List<SyntaxToken> leadingTokens;

    /**
     * Closing braces of the blocks passed during descent, innermost first.
     */
    List<SyntaxToken> trailingTokens;

    public ForEachChain(ForEachStatement forEachStatement, SemanticModel semanticModel,
                        List<ExtendedNode> convertingNodes, List<SyntaxToken> identifiers,
                        List<Statement> terminalStatements, List<SyntaxToken> leadingTokens,
                        List<SyntaxToken> trailingTokens) {
        this.forEachStatement = forEachStatement;
        this.semanticModel = semanticModel;
        this.convertingNodes = List.copyOf(convertingNodes);
        this.identifiers = List.copyOf(identifiers);
        this.terminalStatements = List.copyOf(terminalStatements);
        this.leadingTokens = List.copyOf(leadingTokens);
        this.trailingTokens = List.copyOf(trailingTokens);
    }

    public SyntaxToken getRootIdentifier() {
        return identifiers.get(0);
    }

    public SyntaxToken getLastIdentifier() {
        return identifiers.get(identifiers.size() - 1);
    }

    public boolean isTerminatedCleanly() {
        return terminalStatements.isEmpty();
    }

    public TriviaRun getLeadingTrivia() {
        return TriviaRun.ofTokens(leadingTokens);
    }

    public TriviaRun getTrailingTrivia() {
        return TriviaRun.ofTokens(trailingTokens);
    }
}
