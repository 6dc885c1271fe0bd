package com.bookati.booking.service;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;

/**
 * A distributed lock held by the current thread, or an unguarded handle when Redis was
 * unavailable and the database constraints are the only guard.
 */
@Slf4j
public final class LockHandle implements AutoCloseable {

    private static final LockHandle UNGUARDED = new LockHandle(null);

    private final RLock lock;

    private LockHandle(RLock lock) {
        this.lock = lock;
    }

    static LockHandle of(RLock lock) {
        return new LockHandle(lock);
    }

    static LockHandle unguarded() {
        return UNGUARDED;
    }

    public boolean isGuarded() {
        return lock != null;
    }

    @Override
    public void close() {
        if (lock == null) {
            return;
        }
        try {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        } catch (Exception e) {
            log.warn("Failed to release lock: {}", lock.getName(), e);
        }
    }
}
