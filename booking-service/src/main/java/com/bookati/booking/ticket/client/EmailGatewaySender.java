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
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class EmailGatewaySender implements TicketChannelSender {

    private final RestClient emailRestClient;

    public EmailGatewaySender(@Qualifier("emailRestClient") RestClient emailRestClient) {
        this.emailRestClient = emailRestClient;
    }

    @Override
    public TicketChannel channel() {
        return TicketChannel.EMAIL;
    }

    @Override
    public Optional<String> destination(TicketSnapshot snapshot) {
        return Optional.ofNullable(snapshot.customerEmail()).filter(email -> !email.isBlank());
    }

    @Override
    @CircuitBreaker(name = "emailGateway", fallbackMethod = "sendFallback")
    public DeliveryResult send(TicketAttachment attachment, String destination) {
        EmailMessage message = new EmailMessage(
                destination,
                TicketMessages.emailSubject(attachment.language()),
                TicketMessages.emailBody(attachment),
                List.of(new Attachment(
                        attachment.fileName(),
                        TicketAttachment.CONTENT_TYPE,
                        Base64.getEncoder().encodeToString(attachment.content()))));

        EmailResponse response = emailRestClient.post()
                .uri("/v1/emails")
                .contentType(MediaType.APPLICATION_JSON)
                .body(message)
                .retrieve()
                .onStatus(HttpStatusCode::is4xxClientError, (request, res) -> {
                    throw new ChannelException(TicketChannel.EMAIL,
                            "Email gateway refused message: status=" + res.getStatusCode().value());
                })
                .onStatus(HttpStatusCode::is5xxServerError, (request, res) -> {
                    throw new ChannelException(TicketChannel.EMAIL,
                            "Email gateway unavailable: status=" + res.getStatusCode().value());
                })
                .body(EmailResponse.class);

        String messageId = response != null ? response.id() : null;
        log.debug("Ticket email accepted: bookingId={}, messageId={}", attachment.booking().bookingId(), messageId);
        return DeliveryResult.delivered(messageId);
    }

    @SuppressWarnings("unused")
    private DeliveryResult sendFallback(TicketAttachment attachment, String destination, ChannelException e) {
        throw e;
    }

    @SuppressWarnings("unused")
    private DeliveryResult sendFallback(TicketAttachment attachment, String destination, Throwable t) {
        throw new ChannelException(TicketChannel.EMAIL, "Email gateway unavailable: " + t.getMessage(), t);
    }

    record EmailMessage(String to, String subject, String text, List<Attachment> attachments) {
    }

    record Attachment(String fileName, String contentType, String content) {
    }

    record EmailResponse(String id) {
    }
}
