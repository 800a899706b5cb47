package com.gt.recall.schedule;

import com.gt.recall.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

// Retries store work that failed with a transient error, doubling the pause between attempts
@Component
public class StoreRetry {

    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    public StoreRetry(@Value("${recall.store.retry.maxAttempts:3}") int maxAttempts,
                      @Value("${recall.store.retry.initialBackoffMs:100}") long initialBackoffMs,
                      @Value("${recall.store.retry.maxBackoffMs:2000}") long maxBackoffMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Invalid retry backoff, initial " + initialBackoffMs + "ms, max " + maxBackoffMs + "ms");
        }

        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = initialBackoffMs;
        this.maxBackoffMs = maxBackoffMs;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        long backoffMs = initialBackoffMs;

        for (int attempt = 1; ; attempt++) {
            try {
                return work.get();
            } catch (TransientDataAccessException | RecoverableDataAccessException ex) {
                if (attempt >= maxAttempts) {
                    log.error("Store unavailable for {} after {} attempts", operation, attempt, ex);
                    throw new StoreUnavailableException("Store unavailable for " + operation + " after " + attempt + " attempts", ex);
                }

                log.warn("Transient store failure for {} on attempt {} of {}, retrying in {}ms: {}",
                        operation, attempt, maxAttempts, backoffMs, ex.getMessage());
                pause(operation, backoffMs, ex);
                backoffMs = Math.min(maxBackoffMs, Math.max(1, backoffMs * 2));
            }
        }
    }

    private void pause(String operation, long backoffMs, RuntimeException cause) {
        if (backoffMs <= 0) {
            return;
        }

        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while retrying " + operation, cause);
        }
    }
}
