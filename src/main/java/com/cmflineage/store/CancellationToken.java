package com.cmflineage.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for long-running transactions. Checked before every staged write, so a
 * cancelled transaction is discarded before anything is published.
 */
public class CancellationToken {
    public static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC());

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;
    private final Clock clock;

    protected CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        return new CancellationToken(clock.instant().plus(timeout), clock);
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("NONE cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TransactionCancelledException(cancelled.get() ? "transaction cancelled" : "transaction deadline exceeded");
        }
    }
}
