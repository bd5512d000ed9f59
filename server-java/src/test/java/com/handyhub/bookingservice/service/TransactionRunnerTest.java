package com.handyhub.bookingservice.service;

import com.handyhub.bookingservice.exception.InvalidInputException;
import com.handyhub.bookingservice.exception.UpstreamFailureException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;

import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

class TransactionRunnerTest {

    private final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);

    @Test
    void retriesWholeUnitOnSqliteBusy() {
        TransactionRunner runner = new TransactionRunner(transactionManager, 5);
        AtomicInteger attempts = new AtomicInteger();

        String result = runner.execute("test", status -> {
            if (attempts.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("could not execute statement",
                        new SQLException("[SQLITE_BUSY] The database file is locked (database is locked)"));
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void otherErrorsAreNotRetried() {
        TransactionRunner runner = new TransactionRunner(transactionManager, 5);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(InvalidInputException.class, () -> runner.execute("test", status -> {
            attempts.incrementAndGet();
            throw new InvalidInputException("bad");
        }));
        assertThat(attempts).hasValue(1);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        TransactionRunner runner = new TransactionRunner(transactionManager, 2);
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(UpstreamFailureException.class, () -> runner.execute("test", status -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("SQLITE_BUSY_SNAPSHOT");
        }));
        assertThat(attempts).hasValue(2);
    }

    @Test
    void detectsLockMessagesAnywhereInTheCauseChain() {
        RuntimeException wrapped = new RuntimeException("outer", new RuntimeException("middle",
                new SQLException("database is locked")));

        assertThat(TransactionRunner.isLockError(wrapped)).isTrue();
        assertThat(TransactionRunner.isLockError(new RuntimeException("constraint failed"))).isFalse();
    }
}
