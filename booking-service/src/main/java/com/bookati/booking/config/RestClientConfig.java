package com.bookati.booking.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

/**
 * One RestClient per ticket collaborator. Read timeouts stay below the pipeline step
 * timeouts so a slow gateway surfaces as an HTTP error before the step is abandoned.
 */
@Configuration
@RequiredArgsConstructor
public class RestClientConfig {

    private final GatewayProperties gatewayProperties;

    @Bean
    public RestClient rendererRestClient(RestClient.Builder builder) {
        return build(builder, gatewayProperties.getRenderer());
    }

    @Bean
    public RestClient whatsAppRestClient(RestClient.Builder builder) {
        return build(builder, gatewayProperties.getWhatsapp());
    }

    @Bean
    public RestClient emailRestClient(RestClient.Builder builder) {
        return build(builder, gatewayProperties.getEmail());
    }

    private RestClient build(RestClient.Builder builder, GatewayProperties.Endpoint endpoint) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(endpoint.getConnectTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(endpoint.getReadTimeout());

        RestClient.Builder configured = builder.clone()
                .baseUrl(endpoint.getBaseUrl())
                .requestFactory(requestFactory);
        if (endpoint.getApiKey() != null && !endpoint.getApiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + endpoint.getApiKey());
        }
        return configured.build();
    }
}
