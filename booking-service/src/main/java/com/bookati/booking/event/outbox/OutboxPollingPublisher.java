package com.bookati.booking.event.outbox;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Polls outbox_events and hands pending rows to {@link OutboxEventPublisher}.
 * ShedLock ensures only one instance polls across all replicas.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxPollingPublisher {

    private static final int BATCH_SIZE = 50;
    private static final int RETENTION_DAYS = 3;

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxEventPublisher outboxEventPublisher;

    @Scheduled(fixedDelay = 1000)
    @SchedulerLock(name = "outboxPolling", lockAtMostFor = "30s", lockAtLeastFor = "500ms")
    public void pollAndPublish() {
        List<OutboxEvent> events = outboxEventRepository.findPendingEvents(BATCH_SIZE);
        if (events.isEmpty()) {
            return;
        }

        log.debug("Polling {} outbox events", events.size());

        // A failed event holds back later events of the same booking until the next poll
        Set<String> blockedKeys = new HashSet<>();
        for (OutboxEvent event : events) {
            if (blockedKeys.contains(event.getPartitionKey())) {
                continue;
            }
            if (!outboxEventPublisher.publishEvent(event)) {
                blockedKeys.add(event.getPartitionKey());
            }
        }
    }

    @Scheduled(cron = "0 0 4 * * *")
    @SchedulerLock(name = "outboxCleanup", lockAtMostFor = "5m", lockAtLeastFor = "1m")
    @Transactional
    public void cleanupPublishedEvents() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(RETENTION_DAYS);
        int deleted = outboxEventRepository.deletePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} published outbox events older than {}", deleted, cutoff);
        }
    }
}
