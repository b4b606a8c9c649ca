package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * {@code Type a = 1, b = 2}, without the terminating semicolon.
 */
public final class VariableDeclaration extends SyntaxNode {

    private final TypeSyntax type;
    private final SeparatedSyntaxList<VariableDeclarator> variables;

    public VariableDeclaration(TypeSyntax type, SeparatedSyntaxList<VariableDeclarator> variables) {
        this.type = type;
        this.variables = variables;
    }

    public TypeSyntax getType() {
        return type;
    }

    public SeparatedSyntaxList<VariableDeclarator> getVariables() {
        return variables;
    }

    /**
     * Whether every declared variable has an initializer.
     */
    public boolean isFullyInitialized() {
        for (VariableDeclarator variable : variables) {
            if (variable.getInitializer() == null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(type, variables);
    }
}
