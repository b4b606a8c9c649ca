package com.github.rewrite.query.syntax;

public abstract class Expression extends SyntaxNode {

    public abstract ExpressionKind getKind();
}
