package com.bookati.booking.scheduler;

import com.bookati.booking.config.TicketProperties;
import com.bookati.booking.jooq.TicketPipelineJooqRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Closes pipeline steps left in progress by a crashed instance. Interrupted steps are
 * marked failed and wait for an explicit regenerate or redeliver; nothing is retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TicketPipelineRecoveryScheduler {

    private final TicketPipelineJooqRepository pipelineRepository;
    private final TicketProperties ticketProperties;

    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    @SchedulerLock(name = "ticketPipelineRecovery", lockAtMostFor = "5m", lockAtLeastFor = "30s")
    public void recoverStuckPipelines() {
        LocalDateTime cutoff = LocalDateTime.now().minus(ticketProperties.getStuckAfter());
        List<Long> stuck = pipelineRepository.findStuck(cutoff, ticketProperties.getRecoveryBatchSize());
        if (stuck.isEmpty()) {
            return;
        }

        int interrupted = 0;
        for (Long bookingId : stuck) {
            try {
                if (pipelineRepository.markInterrupted(bookingId, cutoff)) {
                    interrupted++;
                    log.warn("Ticket pipeline interrupted: bookingId={}, idleSince<{}", bookingId, cutoff);
                }
            } catch (Exception e) {
                log.error("Failed to close stuck ticket pipeline: bookingId={}", bookingId, e);
            }
        }
        log.info("Stuck ticket pipelines closed: {}/{}", interrupted, stuck.size());
    }
}
