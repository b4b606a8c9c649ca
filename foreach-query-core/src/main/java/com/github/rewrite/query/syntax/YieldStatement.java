package com.github.rewrite.query.syntax;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * {@code yield return expression;} or {@code yield break;}
 */
public final class YieldStatement extends Statement {

    private final StatementKind kind;
    private final SyntaxToken yieldKeyword;
    private final SyntaxToken returnOrBreakKeyword;
    private final @Nullable Expression expression;
    private final SyntaxToken semicolon;

    public YieldStatement(StatementKind kind, SyntaxToken yieldKeyword, SyntaxToken returnOrBreakKeyword,
                          @Nullable Expression expression, SyntaxToken semicolon) {
        if (kind != StatementKind.YIELD_RETURN && kind != StatementKind.YIELD_BREAK) {
            throw new IllegalArgumentException("Not a yield statement kind: " + kind);
        }
        this.kind = kind;
        this.yieldKeyword = yieldKeyword;
        this.returnOrBreakKeyword = returnOrBreakKeyword;
        this.expression = expression;
        this.semicolon = semicolon;
    }

    @Override
    public StatementKind getKind() {
        return kind;
    }

    public SyntaxToken getYieldKeyword() {
        return yieldKeyword;
    }

    public SyntaxToken getReturnOrBreakKeyword() {
        return returnOrBreakKeyword;
    }

    /**
     * The yielded value; {@code null} for {@code yield break} and for broken {@code yield return}s.
     */
    public @Nullable Expression getExpression() {
        return expression;
    }

    public SyntaxToken getSemicolon() {
        return semicolon;
    }

    @Override
    public List<SyntaxElement> getChildren() {
        return elements(yieldKeyword, returnOrBreakKeyword, expression, semicolon);
    }
}
