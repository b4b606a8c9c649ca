package com.github.rewrite.query.syntax;

public abstract class Statement extends SyntaxNode {

    public abstract StatementKind getKind();
}
