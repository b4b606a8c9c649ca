package com.github.rewrite.query.semantic;

import com.github.rewrite.query.syntax.BodiedDeclaration;
import com.github.rewrite.query.syntax.InvocationExpression;
import com.github.rewrite.query.syntax.SyntaxNode;

import java.util.Optional;

/**
 * Semantic facts about a syntax tree, answered by the host's type-resolution engine.
 * <p>
 * Implementations are side-effect free. Lookups that may be expensive receive the
 * analysis' {@link CancellationToken} and may throw {@link AnalysisCanceledException}.
 */
public interface SemanticModel {

    /**
     * The method an invocation binds to, if it binds to exactly one.
     */
    Optional<MethodSymbol> resolveInvocation(InvocationExpression invocation, CancellationToken cancellationToken);

    /**
     * The innermost member or local function whose body contains {@code node}.
     */
    Optional<BodiedDeclaration> getEnclosingMember(SyntaxNode node, CancellationToken cancellationToken);

    /**
     * Whether {@code type} is the original definition of the host's generic list type.
     */
    boolean isGenericListType(TypeSymbol type);

    /**
     * Whether {@code namespace} is imported at {@code site}.
     */
    boolean isNamespaceInScope(String namespace, SyntaxNode site);

    /**
     * Whether the host reported syntax or binding errors inside {@code node}.
     */
    default boolean containsErrors(SyntaxNode node) {
        return false;
    }
}
