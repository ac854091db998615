package com.flagship.lending_pool.operation;

import com.flagship.lending_pool.config.LendingProperties;
import com.flagship.lending_pool.exception.LendingErrorCode;
import com.flagship.lending_pool.exception.LendingException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight guard held for the whole of one operation, across all pools.
 *
 * Usage:
 * <pre>
 * try (ExecutionGuard.Permit permit = guard.acquire()) {
 *     ...
 * }
 * </pre>
 *
 * A call that re-enters from the thread already holding the guard (for example
 * from inside a custody transfer) fails at once with REENTRANT_CALL. A caller
 * on another thread waits at most the configured timeout, then fails with BUSY.
 */
@Component
public class ExecutionGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final long acquireTimeoutMs;

    @Autowired
    public ExecutionGuard(LendingProperties properties) {
        this(properties.getGuard().getAcquireTimeoutMs());
    }

    public ExecutionGuard(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
    }

    public Permit acquire() {
        if (lock.isHeldByCurrentThread()) {
            throw new LendingException(LendingErrorCode.REENTRANT_CALL,
                "Lending operation already in progress on this call path");
        }
        try {
            if (!lock.tryLock(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new LendingException(LendingErrorCode.BUSY,
                    "Another lending operation is in progress, try again");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LendingException(LendingErrorCode.BUSY, "Interrupted while waiting for the execution guard", e);
        }
        return new Permit();
    }

    public boolean isHeld() {
        return lock.isLocked();
    }

    /**
     * Held guard; closing releases it exactly once.
     */
    public final class Permit implements AutoCloseable {

        private boolean released;

        private Permit() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
