package com.gt.recall.schedule;

import com.gt.recall.exception.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(SpringExtension.class)
public class StoreRetryTests {

    private final StoreRetry storeRetry = new StoreRetry(3, 1, 4);

    @AfterEach
    public void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    public void testSucceedsAfterTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();

        String result = storeRetry.execute("test", () -> {
            if (attempts.incrementAndGet() < 3) {
                throw new QueryTimeoutException("timeout");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, attempts.get());
    }

    @Test
    public void testExhaustedRetries() {
        AtomicInteger attempts = new AtomicInteger();

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, () -> storeRetry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new RecoverableDataAccessException("connection reset");
        }));

        assertEquals(3, attempts.get());
        assertTrue(ex.getCause() instanceof RecoverableDataAccessException);
    }

    @Test
    public void testNonTransientFailureNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(DataIntegrityViolationException.class, () -> storeRetry.execute("test", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate");
        }));

        assertEquals(1, attempts.get());
    }

    @Test
    public void testInterruptedWhileWaiting() {
        Thread.currentThread().interrupt();

        assertThrows(StoreUnavailableException.class, () -> storeRetry.execute("test", () -> {
            throw new QueryTimeoutException("timeout");
        }));
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    public void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new StoreRetry(0, 1, 4));
        assertThrows(IllegalArgumentException.class, () -> new StoreRetry(3, 10, 4));
    }
}
