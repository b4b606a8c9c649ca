package com.github.rewrite.query.syntax;

import java.util.List;

/**
 * A function declared inside a block. Its signature is kept as raw tokens.
 */
public final class LocalFunctionStatement extends Statement implements BodiedDeclaration {

    private final List<SyntaxToken> signature;
    private final BlockStatement body;

    public LocalFunctionStatement(List<SyntaxToken> signature, BlockStatement body) {
        this.signature = List.copyOf(signature);
        this.body = body;
    }

    @Override
    public StatementKind getKind() {
        return StatementKind.LOCAL_FUNCTION;
    }

    public List<SyntaxToken> getSignature() {
        return signature;
    }

    @Override
    public BlockStatement getBody() {
        return body;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(signature, body);
    }
}
