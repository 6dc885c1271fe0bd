package com.bookati.booking.ticket.client;

import com.bookati.booking.ticket.RenderException;
import com.bookati.booking.ticket.TicketSnapshot;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Calls the ticket rendering service, which answers with the finished PDF.
 */
@Slf4j
@Component
public class HttpTicketRenderer implements TicketRenderer {

    private final RestClient rendererRestClient;

    public HttpTicketRenderer(@Qualifier("rendererRestClient") RestClient rendererRestClient) {
        this.rendererRestClient = rendererRestClient;
    }

    @Override
    @CircuitBreaker(name = "ticketRenderer", fallbackMethod = "renderFallback")
    public byte[] render(TicketSnapshot snapshot) {
        log.debug("Rendering ticket: bookingId={}, language={}", snapshot.bookingId(), snapshot.language());

        byte[] pdf = rendererRestClient.post()
                .uri("/v1/tickets/render")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_PDF)
                .body(snapshot)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw new RenderException("Renderer responded " + response.getStatusCode().value());
                })
                .body(byte[].class);

        if (pdf == null || pdf.length == 0) {
            throw new RenderException("Renderer returned an empty document");
        }
        return pdf;
    }

    @SuppressWarnings("unused")
    private byte[] renderFallback(TicketSnapshot snapshot, RenderException e) {
        throw e;
    }

    @SuppressWarnings("unused")
    private byte[] renderFallback(TicketSnapshot snapshot, Throwable t) {
        throw new RenderException("Renderer unavailable: " + t.getMessage(), t);
    }
}
