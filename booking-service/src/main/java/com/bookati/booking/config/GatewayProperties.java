package com.bookati.booking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Endpoints of the external ticket collaborators: PDF renderer, WhatsApp and email gateways.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bookati.gateways")
public class GatewayProperties {

    private Endpoint renderer = new Endpoint();
    private Endpoint whatsapp = new Endpoint();
    private Endpoint email = new Endpoint();

    @Getter
    @Setter
    public static class Endpoint {
        private String baseUrl;
        private String apiKey;
        private Duration connectTimeout = Duration.ofMillis(500);
        private Duration readTimeout = Duration.ofSeconds(10);
    }
}
