package com.github.rewrite.query.java;

/**
 * How an iterated expression is turned into a {@code java.util.stream.Stream}.
 */
public enum StreamSource {
    /** {@code expression.stream()} */
    COLLECTION,
    /** {@code Arrays.stream(expression)} */
    ARRAY,
    /** {@code Arrays.stream(expression).boxed()} for {@code int[]}, {@code long[]} and {@code double[]} */
    PRIMITIVE_ARRAY;

    public String open(String expression) {
        return switch (this) {
            case COLLECTION -> expression + ".stream()";
            case ARRAY -> "Arrays.stream(" + expression + ")";
            case PRIMITIVE_ARRAY -> "Arrays.stream(" + expression + ").boxed()";
        };
    }
}
