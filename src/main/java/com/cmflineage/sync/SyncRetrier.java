package com.cmflineage.sync;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SyncRetrier {
    private static final Logger log = LoggerFactory.getLogger(SyncRetrier.class);

    private final int maxRetries;
    private final Duration backoff;
    private final Sleeper sleeper;

    public SyncRetrier(int maxRetries, Duration backoff) {
        this(maxRetries, backoff, Thread::sleep);
    }

    SyncRetrier(int maxRetries, Duration backoff, Sleeper sleeper) {
        this.maxRetries = Math.max(0, maxRetries);
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public static SyncRetrier none() {
        return new SyncRetrier(0, Duration.ZERO);
    }

    public <T> T run(String operation, SyncCall<T> call) throws InterruptedException {
        int maxAttempts = maxRetries + 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return call.execute();
            } catch (SyncTransportException e) {
                if (!e.isRetriable() || attempt >= maxAttempts) {
                    throw e;
                }
                long backoffMs = backoff.toMillis() * attempt;
                log.warn("sync.retry operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoffMs, e.getMessage());
                sleeper.sleep(backoffMs);
            }
        }
    }

    @FunctionalInterface
    public interface SyncCall<T> {
        T execute();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
