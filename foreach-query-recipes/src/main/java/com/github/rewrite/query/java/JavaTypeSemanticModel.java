package com.github.rewrite.query.java;

import com.github.rewrite.query.semantic.CancellationToken;
import com.github.rewrite.query.semantic.MethodSymbol;
import com.github.rewrite.query.semantic.SemanticModel;
import com.github.rewrite.query.semantic.TypeSymbol;
import com.github.rewrite.query.syntax.BodiedDeclaration;
import com.github.rewrite.query.syntax.ForEachStatement;
import com.github.rewrite.query.syntax.InvocationExpression;
import com.github.rewrite.query.syntax.SyntaxNode;
import org.jspecify.annotations.Nullable;
import org.openrewrite.java.tree.J;
import org.openrewrite.java.tree.JavaType;
import org.openrewrite.java.tree.TypeUtils;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Answers semantic questions from the type attribution OpenRewrite's Java parser attaches to the LST.
 * <p>
 * Java has no iterator blocks, so no node ever has an enclosing member with {@code yield} statements.
 */
public class JavaTypeSemanticModel implements SemanticModel {

    private final JavaSyntaxAdapter adapter;
    private final J.@Nullable CompilationUnit compilationUnit;
    private final Map<String, JavaType.FullyQualified> declaringTypes = new HashMap<>();

    public JavaTypeSemanticModel(JavaSyntaxAdapter adapter, J.@Nullable CompilationUnit compilationUnit) {
        this.adapter = adapter;
        this.compilationUnit = compilationUnit;
    }

    @Override
    public Optional<MethodSymbol> resolveInvocation(InvocationExpression invocation,
                                                    CancellationToken cancellationToken) {
        cancellationToken.throwIfCancellationRequested();
        J origin = adapter.getOrigin(invocation);
        if (!(origin instanceof J.MethodInvocation)) {
            return Optional.empty();
        }
        JavaType.Method method = ((J.MethodInvocation) origin).getMethodType();
        if (method == null) {
            return Optional.empty();
        }
        JavaType.FullyQualified declaringType = method.getDeclaringType();
        declaringTypes.putIfAbsent(declaringType.getFullyQualifiedName(), declaringType);
        return Optional.of(new MethodSymbol(
                method.getName(),
                new TypeSymbol(declaringType.getFullyQualifiedName()),
                method.getParameterTypes().size()));
    }

    @Override
    public Optional<BodiedDeclaration> getEnclosingMember(SyntaxNode node, CancellationToken cancellationToken) {
        return Optional.empty();
    }

    @Override
    public boolean isGenericListType(TypeSymbol type) {
        JavaType.FullyQualified declaringType = declaringTypes.get(type.getFullyQualifiedName());
        return declaringType != null && TypeUtils.isAssignableTo("java.util.List", declaringType);
    }

    /**
     * Whether {@code namespace}, a fully qualified class name, is usable by its simple name.
     */
    @Override
    public boolean isNamespaceInScope(String namespace, SyntaxNode site) {
        int lastDot = namespace.lastIndexOf('.');
        String packageName = lastDot < 0 ? "" : namespace.substring(0, lastDot);
        String simpleName = namespace.substring(lastDot + 1);
        if ("java.lang".equals(packageName)) {
            return true;
        }
        if (compilationUnit == null) {
            return false;
        }
        if (compilationUnit.getPackageDeclaration() != null &&
                packageName.equals(compilationUnit.getPackageDeclaration().getPackageName())) {
            return true;
        }
        for (J.Import anImport : compilationUnit.getImports()) {
            if (anImport.isStatic() || !packageName.equals(anImport.getPackageName())) {
                continue;
            }
            String className = anImport.getClassName();
            if ("*".equals(className) || simpleName.equals(className)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A loop whose iterated expression was not attributed could not be compiled.
     */
    @Override
    public boolean containsErrors(SyntaxNode node) {
        if (!(node instanceof ForEachStatement)) {
            return false;
        }
        J origin = adapter.getOrigin(((ForEachStatement) node).getExpression());
        if (!(origin instanceof org.openrewrite.java.tree.Expression)) {
            return true;
        }
        JavaType type = ((org.openrewrite.java.tree.Expression) origin).getType();
        return type == null || type instanceof JavaType.Unknown;
    }
}
