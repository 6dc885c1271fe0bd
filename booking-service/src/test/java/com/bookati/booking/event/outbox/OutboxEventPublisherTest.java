package com.bookati.booking.event.outbox;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxEventPublisherTest {

    @Mock
    private OutboxEventRepository outboxEventRepository;
    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private OutboxEventPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxEventPublisher(outboxEventRepository, kafkaTemplate);
    }

    @Test
    void publishEvent_sendSucceeds_marksPublished() {
        OutboxEvent event = OutboxEventTest.newEvent();
        when(kafkaTemplate.send("bookati.booking.confirmed", "1", "{}"))
                .thenReturn(CompletableFuture.completedFuture(new SendResult<>(null, null)));

        assertThat(publisher.publishEvent(event)).isTrue();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.PUBLISHED);
        verify(outboxEventRepository).save(event);
    }

    @Test
    void publishEvent_sendFails_marksRetrying() {
        OutboxEvent event = OutboxEventTest.newEvent();
        when(kafkaTemplate.send("bookati.booking.confirmed", "1", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThat(publisher.publishEvent(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.RETRYING);
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getLastError()).contains("broker down");
    }

    @Test
    void publishEvent_retriesExhausted_marksFailed() {
        OutboxEvent event = OutboxEventTest.newEvent();
        for (int i = 0; i < OutboxEventPublisher.MAX_RETRIES; i++) {
            event.markRetrying("timeout");
        }
        when(kafkaTemplate.send("bookati.booking.confirmed", "1", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThat(publisher.publishEvent(event)).isFalse();

        assertThat(event.getStatus()).isEqualTo(OutboxEvent.OutboxStatus.FAILED);
        verify(outboxEventRepository).save(event);
    }
}
