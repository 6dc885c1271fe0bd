package com.bookati.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bookati.ticket")
public class TicketProperties {

    private Duration pdfTimeout = Duration.ofSeconds(20);
    private Duration channelTimeout = Duration.ofSeconds(15);
    private int workerThreads = 8;
    /** In-progress steps older than this are treated as interrupted by a crash. */
    private Duration stuckAfter = Duration.ofMinutes(10);
    private int recoveryBatchSize = 50;
}
