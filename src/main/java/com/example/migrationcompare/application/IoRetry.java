package com.example.migrationcompare.application;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * Bounded retry of I/O operations with linear backoff. Only {@link IOException}s are retried.
 */
public class IoRetry {
    private static final Logger log = LogManager.getLogger(IoRetry.class);

    private final int maxAttempts;
    private final Duration backoff;

    public IoRetry(int maxAttempts, Duration backoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff == null ? Duration.ZERO : backoff;
    }

    @FunctionalInterface
    public interface IoAction<T> {
        T call() throws IOException;
    }

    public <T> T call(String description, IoAction<T> action) throws IOException {
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.call();
            } catch (InterruptedIOException ex) {
                throw ex;
            } catch (IOException ex) {
                last = ex;
                if (attempt < maxAttempts) {
                    log.warn("{} failed (attempt {}/{}): {}", description, attempt, maxAttempts, ex.getMessage());
                    pause(attempt);
                }
            }
        }
        throw last;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private void pause(int attempt) throws InterruptedIOException {
        try {
            Thread.sleep(backoff.toMillis() * attempt);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
