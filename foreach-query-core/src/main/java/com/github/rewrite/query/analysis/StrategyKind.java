package com.github.rewrite.query.analysis;

import org.jspecify.annotations.Nullable;

/**
 * The shape of the construct a loop is rewritten into.
 * <ul>
 *   <li>{@code DEFAULT} - a plain query followed by the statements that could not be converted</li>
 *   <li>{@code COUNT} - the query wrapped in a counting operation, replacing {@code c++}</li>
 *   <li>{@code TO_LIST} - the query materialized to a list, replacing {@code list.Add(item)}</li>
 *   <li>{@code YIELD_RETURN} - {@code return query;}, replacing {@code yield return item;}</li>
 * </ul>
 */
public enum StrategyKind {
    DEFAULT,
    COUNT,
    TO_LIST,
    YIELD_RETURN;

    /**
     * Parses configuration values such as {@code toList}, {@code to-list} or {@code TO_LIST}.
     *
     * @return the kind, or {@code null} if the value names no kind
     */
    public static @Nullable StrategyKind fromString(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .toUpperCase()
                .replace('-', '_');
        try {
            return StrategyKind.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
