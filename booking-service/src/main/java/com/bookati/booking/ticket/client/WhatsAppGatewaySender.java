package com.bookati.booking.ticket.client;

import com.bookati.booking.ticket.ChannelException;
import com.bookati.booking.ticket.TicketAttachment;
import com.bookati.booking.ticket.TicketChannel;
import com.bookati.booking.ticket.TicketMessages;
import com.bookati.booking.ticket.TicketSnapshot;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Base64;
import java.util.Optional;

/**
 * Sends the ticket PDF as a WhatsApp document message through the messaging gateway.
 */
@Slf4j
@Component
public class WhatsAppGatewaySender implements TicketChannelSender {

    private final RestClient whatsAppRestClient;

    public WhatsAppGatewaySender(@Qualifier("whatsAppRestClient") RestClient whatsAppRestClient) {
        this.whatsAppRestClient = whatsAppRestClient;
    }

    @Override
    public TicketChannel channel() {
        return TicketChannel.WHATSAPP;
    }

    @Override
    public Optional<String> destination(TicketSnapshot snapshot) {
        return Optional.ofNullable(snapshot.customerPhone()).filter(phone -> !phone.isBlank());
    }

    @Override
    @CircuitBreaker(name = "whatsappGateway", fallbackMethod = "sendFallback")
    public DeliveryResult send(TicketAttachment attachment, String destination) {
        DocumentMessage message = new DocumentMessage(
                destination,
                attachment.fileName(),
                TicketAttachment.CONTENT_TYPE,
                TicketMessages.whatsAppCaption(attachment.language(), attachment.reason()),
                Base64.getEncoder().encodeToString(attachment.content()));

        GatewayResponse response = whatsAppRestClient.post()
                .uri("/v1/messages/document")
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, res) -> {
                    throw new ChannelException(TicketChannel.WHATSAPP,
                            "WhatsApp gateway responded " + res.getStatusCode().value());
                })
                .body(GatewayResponse.class);

        if (response == null) {
            throw new ChannelException(TicketChannel.WHATSAPP, "WhatsApp gateway returned no body");
        }
        if (response.isRejected()) {
            return DeliveryResult.rejected("WhatsApp gateway rejected message: " + response.error());
        }
        log.debug("WhatsApp document accepted: bookingId={}, messageId={}",
                attachment.booking().bookingId(), response.messageId());
        return DeliveryResult.delivered(response.messageId());
    }

    @SuppressWarnings("unused")
    private DeliveryResult sendFallback(TicketAttachment attachment, String destination, ChannelException e) {
        throw e;
    }

    @SuppressWarnings("unused")
    private DeliveryResult sendFallback(TicketAttachment attachment, String destination, Throwable t) {
        throw new ChannelException(TicketChannel.WHATSAPP, "WhatsApp gateway unavailable: " + t.getMessage(), t);
    }

    record DocumentMessage(String to, String fileName, String mimeType, String caption, String document) {
    }

    record GatewayResponse(String messageId, String status, String error) {

        boolean isRejected() {
            return "failed".equalsIgnoreCase(status) || "rejected".equalsIgnoreCase(status);
        }
    }
}
