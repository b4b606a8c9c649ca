package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A method, accessor or operator. Only the body is modelled; the signature is raw tokens.
 */
public final class MemberDeclaration extends SyntaxNode implements BodiedDeclaration {

    private final List<SyntaxToken> signature;
    private final @Nullable BlockStatement body;

    public MemberDeclaration(List<SyntaxToken> signature, @Nullable BlockStatement body) {
        this.signature = List.copyOf(signature);
        this.body = body;
    }

    public List<SyntaxToken> getSignature() {
        return signature;
    }

    @Override
    public @Nullable BlockStatement getBody() {
        return body;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(signature, body);
    }
}
