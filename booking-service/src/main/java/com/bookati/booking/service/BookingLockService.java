package com.bookati.booking.service;

import com.bookati.booking.config.BookingProperties;
import com.bookati.booking.domain.SlotKey;
import com.bookati.booking.exception.SlotUnavailableException;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Tier 1: Redis distributed locks.
 * Slot locks serialize booking writes per slot across pods with a bounded wait; pipeline locks
 * keep a single ticket pipeline in flight per booking. When Redis is down the circuit breaker
 * hands out unguarded handles and the database constraints alone decide.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingLockService {

    private static final String PIPELINE_LOCK_PREFIX = "lock:ticket:";

    private final RedissonClient redissonClient;
    private final BookingProperties bookingProperties;

    @CircuitBreaker(name = "redisLock", fallbackMethod = "acquireSlotLockFallback")
    public LockHandle acquireSlotLock(SlotKey slot) {
        RLock lock = redissonClient.getLock(slot.lockName());
        try {
            boolean acquired = lock.tryLock(
                    bookingProperties.getSlotLockWait().toMillis(),
                    bookingProperties.getSlotLockLease().toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new SlotUnavailableException(slot, "lock wait timed out");
            }
            return LockHandle.of(lock);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SlotUnavailableException(slot, "lock acquisition interrupted");
        }
    }

    /**
     * Non-blocking: fails with {@code TICKET_PIPELINE_BUSY} when another pipeline holds the booking.
     * The lock is renewed by the Redisson watchdog until released.
     */
    @CircuitBreaker(name = "redisLock", fallbackMethod = "acquirePipelineLockFallback")
    public LockHandle acquirePipelineLock(Long bookingId) {
        RLock lock = redissonClient.getLock(PIPELINE_LOCK_PREFIX + bookingId);
        try {
            if (!lock.tryLock(0, TimeUnit.MILLISECONDS)) {
                throw new BusinessException(ErrorCode.TICKET_PIPELINE_BUSY,
                        "Ticket pipeline already running for booking " + bookingId);
            }
            return LockHandle.of(lock);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.TICKET_PIPELINE_BUSY,
                    "Pipeline lock acquisition interrupted for booking " + bookingId);
        }
    }

    @SuppressWarnings("unused")
    private LockHandle acquireSlotLockFallback(SlotKey slot, BusinessException e) {
        throw e;
    }

    @SuppressWarnings("unused")
    private LockHandle acquireSlotLockFallback(SlotKey slot, Throwable t) {
        log.warn("Redis lock unavailable, slot ledger constraint decides: slot={}, cause={}", slot, t.toString());
        return LockHandle.unguarded();
    }

    @SuppressWarnings("unused")
    private LockHandle acquirePipelineLockFallback(Long bookingId, BusinessException e) {
        throw e;
    }

    @SuppressWarnings("unused")
    private LockHandle acquirePipelineLockFallback(Long bookingId, Throwable t) {
        log.warn("Redis lock unavailable, pipeline claim decides: bookingId={}, cause={}", bookingId, t.toString());
        return LockHandle.unguarded();
    }
}
