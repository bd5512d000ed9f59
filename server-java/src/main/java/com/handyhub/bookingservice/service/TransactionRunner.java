package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Locale;

/**
 * Runs a unit of work in its own transaction and re-runs the whole unit when SQLite reports
 * that the database is locked. Backoff doubles from 100ms.
 */
@Component
public class TransactionRunner {

    private static final Logger logger = LoggerFactory.getLogger(TransactionRunner.class);

    private static final long BASE_DELAY_MS = 100;
    private static final long MAX_DELAY_MS = 3_000;

    private final TransactionTemplate transactionTemplate;
    private final int maxRetries;

    public TransactionRunner(PlatformTransactionManager transactionManager,
                             @Value("${booking.hold.max-retries:10}") int maxRetries) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxRetries = Math.max(1, maxRetries);
    }

    public <T> T execute(String operation, TransactionCallback<T> callback) {
        int retryCount = 0;
        while (true) {
            try {
                return transactionTemplate.execute(callback);
            } catch (RuntimeException e) {
                if (!isLockError(e)) {
                    throw e;
                }
                if (retryCount >= maxRetries - 1) {
                    logger.error("[TransactionRunner] {} gave up after {} attempts: database locked", operation, maxRetries);
                    throw new UpstreamFailureException(
                            "Failed to " + operation + " after " + maxRetries + " attempts due to database lock", e);
                }
                retryCount++;
                long delay = Math.min(BASE_DELAY_MS * (1L << (retryCount - 1)), MAX_DELAY_MS);
                logger.info("[TransactionRunner] Database locked during {}, retrying ({}/{}) after {}ms",
                        operation, retryCount, maxRetries, delay);
                sleep(delay, operation);
            }
        }
    }

    /**
     * Walks the cause chain looking for SQLite's busy/locked messages.
     */
    static boolean isLockError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 10) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("database is locked") || lower.contains("sqlite_busy")
                        || lower.contains("sqlite_locked")) {
                    return true;
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private static void sleep(long delay, String operation) {
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new UpstreamFailureException(operation + " interrupted while waiting for database lock", ie);
        }
    }
}
