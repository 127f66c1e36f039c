package com.lendingengine.pool;

import com.lendingengine.common.exception.ReentrantCallException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every mutating pool operation and forbids nested ones.
 *
 * One fair lock covers the whole pool, so operations are linearizable and
 * pool-wide totals need no further coordination. The lock is taken before the
 * database transaction starts and released after it commits, so the next writer
 * always sees committed state.
 *
 * A thread that already holds the guard (e.g. an asset adapter calling back into
 * the pool mid-transfer) is rejected instead of being let in.
 */
@Component
@Slf4j
public class ExecutionGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile String inFlight;

    public <T> T execute(String operation, Supplier<T> action) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Rejected reentrant call to '{}' during '{}'", operation, inFlight);
            throw new ReentrantCallException(operation, inFlight);
        }

        lock.lock();
        try {
            inFlight = operation;
            return action.get();
        } finally {
            inFlight = null;
            lock.unlock();
        }
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
