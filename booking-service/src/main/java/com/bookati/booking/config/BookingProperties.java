package com.bookati.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bookati.booking")
public class BookingProperties {

    /** Longest a request waits for a contended slot before failing as unavailable. */
    private Duration slotLockWait = Duration.ofSeconds(3);
    private Duration slotLockLease = Duration.ofSeconds(10);
    private Duration holdTtl = Duration.ofSeconds(120);
    private int holdExpiryBatchSize = 100;
}
