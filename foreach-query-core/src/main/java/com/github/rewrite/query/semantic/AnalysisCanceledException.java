package com.github.rewrite.query.semantic;

/**
 * Thrown when a {@link CancellationToken} is signalled during analysis.
 * <p>
 * Cancellation is not a fault: callers report the conversion as not applicable.
 */
public class AnalysisCanceledException extends RuntimeException {

    public AnalysisCanceledException() {
        super("Analysis was canceled");
    }

    public AnalysisCanceledException(String message) {
        super(message);
    }
}
