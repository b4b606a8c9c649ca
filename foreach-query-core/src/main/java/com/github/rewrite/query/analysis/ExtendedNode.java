package com.github.rewrite.query.analysis;

import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.IfStatement;
import com.github.rewrite.query.syntax.SyntaxNode;
import com.github.rewrite.query.syntax.TriviaRun;
import com.github.rewrite.query.syntax.VariableDeclarator;
import lombok.Value;

/**
 * A node that becomes one query clause, with the trivia that has to surround the clause.
 * <p>
 * The trivia comes from tokens the conversion drops (braces, declaration types,
 * separators) and is emitted verbatim before and after the generated clause.
 */
@Value
public class ExtendedNode {

    public enum Kind {
        /** A nested loop, becomes a {@code from} clause. */
        NESTED_LOOP,
        /** An {@code if} without {@code else}, becomes a {@code where} clause. */
        CONDITION,
        /** One declared variable, becomes a {@code let} clause. */
        DECLARATOR
    }

    SyntaxNode node;
    TriviaRun leadingTrivia;
    TriviaRun trailingTrivia;

    public ExtendedNode(SyntaxNode node, TriviaRun leadingTrivia, TriviaRun trailingTrivia) {
        if (!(node instanceof ForEachStatement) && !(node instanceof IfStatement) &&
                !(node instanceof VariableDeclarator)) {
            throw new IllegalArgumentException("Cannot become a query clause: " + node.getClass().getSimpleName());
        }
        this.node = node;
        this.leadingTrivia = leadingTrivia;
        this.trailingTrivia = trailingTrivia;
    }

    public Kind getKind() {
        if (node instanceof ForEachStatement) {
            return Kind.NESTED_LOOP;
        }
        if (node instanceof IfStatement) {
            return Kind.CONDITION;
        }
        return Kind.DECLARATOR;
    }
}
