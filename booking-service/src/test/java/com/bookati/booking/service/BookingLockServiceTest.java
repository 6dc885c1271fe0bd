package com.bookati.booking.service;

import com.bookati.booking.config.BookingProperties;
import com.bookati.booking.domain.SlotKey;
import com.bookati.booking.exception.SlotUnavailableException;
import com.bookati.common.exception.BusinessException;
import com.bookati.common.response.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BookingLockServiceTest {

    private static final SlotKey SLOT = new SlotKey("spa-cairo", "room-1", LocalDateTime.of(2025, 1, 1, 10, 0));

    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RLock lock;

    private BookingLockService lockService;

    @BeforeEach
    void setUp() {
        BookingProperties properties = new BookingProperties();
        properties.setSlotLockWait(Duration.ofMillis(250));
        properties.setSlotLockLease(Duration.ofSeconds(5));
        lockService = new BookingLockService(redissonClient, properties);
    }

    @Test
    void acquireSlotLock_success_usesBoundedWaitAndReleasesOnClose() throws InterruptedException {
        when(redissonClient.getLock("lock:slot:spa-cairo:room-1:20250101T1000")).thenReturn(lock);
        when(lock.tryLock(250L, 5000L, TimeUnit.MILLISECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        try (LockHandle handle = lockService.acquireSlotLock(SLOT)) {
            assertThat(handle.isGuarded()).isTrue();
        }

        verify(lock).unlock();
    }

    @Test
    void acquireSlotLock_waitTimesOut_throwsSlotUnavailable() throws InterruptedException {
        when(redissonClient.getLock(anyString())).thenReturn(lock);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenReturn(false);

        assertThatThrownBy(() -> lockService.acquireSlotLock(SLOT))
                .isInstanceOf(SlotUnavailableException.class)
                .hasMessageContaining("lock wait timed out");
    }

    @Test
    void acquireSlotLock_interrupted_throwsSlotUnavailableAndKeepsFlag() throws InterruptedException {
        when(redissonClient.getLock(anyString())).thenReturn(lock);
        when(lock.tryLock(anyLong(), anyLong(), any(TimeUnit.class))).thenThrow(new InterruptedException());

        assertThatThrownBy(() -> lockService.acquireSlotLock(SLOT))
                .isInstanceOf(SlotUnavailableException.class);
        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void acquirePipelineLock_heldElsewhere_throwsBusy() throws InterruptedException {
        when(redissonClient.getLock("lock:ticket:42")).thenReturn(lock);
        when(lock.tryLock(0, TimeUnit.MILLISECONDS)).thenReturn(false);

        assertThatThrownBy(() -> lockService.acquirePipelineLock(42L))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.TICKET_PIPELINE_BUSY);
    }

    @Test
    void lockHandle_close_skipsLockNotHeldByCurrentThread() throws InterruptedException {
        when(redissonClient.getLock("lock:ticket:42")).thenReturn(lock);
        when(lock.tryLock(0, TimeUnit.MILLISECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(false);

        lockService.acquirePipelineLock(42L).close();

        verify(lock, never()).unlock();
    }

    @Test
    void unguardedHandle_closeIsNoop() {
        LockHandle handle = LockHandle.unguarded();

        handle.close();

        assertThat(handle.isGuarded()).isFalse();
    }
}
