package com.github.rewrite.query.semantic;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Cooperative cancellation signal checked before every semantic lookup.
 */
public final class CancellationToken {

    public static final CancellationToken NONE = new CancellationToken(() -> false);

    private final BooleanSupplier requested;

    private CancellationToken(BooleanSupplier requested) {
        this.requested = requested;
    }

    public static CancellationToken of(BooleanSupplier requested) {
        return new CancellationToken(requested);
    }

    public static CancellationToken of(AtomicBoolean flag) {
        return new CancellationToken(flag::get);
    }

    public boolean isCancellationRequested() {
        return requested.getAsBoolean();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new AnalysisCanceledException();
        }
    }
}
