package com.driverag.ingest;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.driverag.error.DriveRagException;
import com.driverag.error.InvalidConfigException;

public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public RetryPolicy(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new InvalidConfigException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new InvalidConfigException("backoff must satisfy 0 <= initialBackoffMs <= maxBackoffMs");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public static RetryPolicy noRetries() {
        return new RetryPolicy(1, 0, 0);
    }

    public <T> T execute(String operation, Supplier<T> supplier) throws InterruptedException {
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (DriveRagException e) {
                if (!e.isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                long backoff = backoffMillis(attempt);
                log.warn("retry.scheduled operation={} attempt={} maxAttempts={} backoffMs={} reason={}",
                        operation, attempt, maxAttempts, backoff, e.getMessage());
                Thread.sleep(backoff);
            }
        }
    }

    long backoffMillis(int attempt) {
        long backoff = initialBackoffMs;
        for (int i = 1; i < attempt && backoff < maxBackoffMs; i++) {
            backoff *= 2;
        }
        return Math.min(backoff, maxBackoffMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
