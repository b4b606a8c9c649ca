package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

/**
 * A member or local function whose statements own the yields inside them.
 */
public interface BodiedDeclaration {

    /**
     * The block body, or {@code null} for expression-bodied and abstract declarations.
     */
    @Nullable
    BlockStatement getBody();
}
