package com.bookati.booking.ticket;

import com.bookati.booking.config.TicketProperties;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Runs one pipeline step on the ticket worker pool under its step timeout. The returned
 * future completes exceptionally with a {@link java.util.concurrent.TimeoutException}
 * once the timeout passes.
 */
@Component
public class TicketStepExecutor {

    private final ExecutorService workers;
    private final ScheduledExecutorService timeoutScheduler;
    private final TimeLimiter pdfTimeLimiter;
    private final TimeLimiter channelTimeLimiter;

    public TicketStepExecutor(TicketProperties ticketProperties) {
        this.workers = Executors.newFixedThreadPool(ticketProperties.getWorkerThreads(),
                new CustomizableThreadFactory("ticket-step-"));
        this.timeoutScheduler = Executors.newSingleThreadScheduledExecutor(
                new CustomizableThreadFactory("ticket-timeout-"));
        this.pdfTimeLimiter = timeLimiter("ticketPdf", ticketProperties.getPdfTimeout());
        this.channelTimeLimiter = timeLimiter("ticketChannel", ticketProperties.getChannelTimeout());
    }

    public <T> CompletableFuture<T> run(TicketChannel step, Supplier<T> work) {
        return limiterFor(step)
                .executeCompletionStage(timeoutScheduler, () -> CompletableFuture.supplyAsync(work, workers))
                .toCompletableFuture();
    }

    public Duration timeoutOf(TicketChannel step) {
        return limiterFor(step).getTimeLimiterConfig().getTimeoutDuration();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        timeoutScheduler.shutdown();
    }

    private TimeLimiter limiterFor(TicketChannel step) {
        return step == TicketChannel.PDF ? pdfTimeLimiter : channelTimeLimiter;
    }

    private static TimeLimiter timeLimiter(String name, Duration timeout) {
        return TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    }
}
