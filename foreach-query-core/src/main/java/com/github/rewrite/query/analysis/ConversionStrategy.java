package com.github.rewrite.query.analysis;

/**
 * The rewrite chosen by the {@link TerminalMatcher} together with its payload.
 *
 * @see DefaultStrategy
 * @see CountStrategy
 * @see ToListStrategy
 * @see YieldReturnStrategy
 */
public abstract class ConversionStrategy {

    public abstract StrategyKind getKind();
}
