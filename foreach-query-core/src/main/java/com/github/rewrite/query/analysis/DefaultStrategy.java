package com.github.rewrite.query.analysis;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@ToString
@EqualsAndHashCode(callSuper = false)
public final class DefaultStrategy extends ConversionStrategy {

    public static final DefaultStrategy INSTANCE = new DefaultStrategy();

    private DefaultStrategy() {
    }

    @Override
    public StrategyKind getKind() {
        return StrategyKind.DEFAULT;
    }
}
