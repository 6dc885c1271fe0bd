package com.bookati.booking.ticket.client;

import com.bookati.booking.TestFixtures;
import com.bookati.booking.domain.CustomerContact;
import com.bookati.booking.domain.TicketLanguage;
import com.bookati.booking.ticket.ChannelException;
import com.bookati.booking.ticket.TicketAttachment;
import com.bookati.booking.ticket.TicketReason;
import com.bookati.booking.ticket.TicketSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WhatsAppGatewaySenderTest {

    private static final String BASE_URL = "http://whatsapp.test";
    private static final byte[] PDF = "%PDF-1.7 ticket".getBytes();

    private MockRestServiceServer server;
    private WhatsAppGatewaySender sender;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        sender = new WhatsAppGatewaySender(builder.build());
    }

    @Test
    void send_accepted_returnsMessageId() {
        server.expect(requestTo(BASE_URL + "/v1/messages/document"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.to").value("+201001234567"))
                .andExpect(jsonPath("$.fileName").value("booking_ticket_1.pdf"))
                .andExpect(jsonPath("$.mimeType").value("application/pdf"))
                .andExpect(jsonPath("$.caption").value("Your booking is confirmed! Please find your ticket attached."))
                .andExpect(jsonPath("$.document").value(Base64.getEncoder().encodeToString(PDF)))
                .andRespond(withSuccess("{\"messageId\":\"wamid.1\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        DeliveryResult result = sender.send(attachment(TicketReason.CONFIRMED), "+201001234567");

        assertThat(result).isEqualTo(DeliveryResult.delivered("wamid.1"));
        server.verify();
    }

    @Test
    void send_rescheduled_usesUpdatedTicketCaption() {
        server.expect(requestTo(BASE_URL + "/v1/messages/document"))
                .andExpect(jsonPath("$.caption").value(
                        "Your booking time has been changed! Please find your updated ticket attached."))
                .andRespond(withSuccess("{\"messageId\":\"wamid.2\",\"status\":\"queued\"}", MediaType.APPLICATION_JSON));

        assertThat(sender.send(attachment(TicketReason.RESCHEDULED), "+201001234567").delivered()).isTrue();
    }

    @Test
    void send_gatewayRejects_reportedAsNotDelivered() {
        server.expect(requestTo(BASE_URL + "/v1/messages/document"))
                .andRespond(withSuccess("{\"status\":\"failed\",\"error\":\"number not on WhatsApp\"}",
                        MediaType.APPLICATION_JSON));

        DeliveryResult result = sender.send(attachment(TicketReason.CONFIRMED), "+201001234567");

        assertThat(result.delivered()).isFalse();
        assertThat(result.detail()).contains("number not on WhatsApp");
    }

    @Test
    void send_serverError_throwsChannelException() {
        server.expect(requestTo(BASE_URL + "/v1/messages/document"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> sender.send(attachment(TicketReason.CONFIRMED), "+201001234567"))
                .isInstanceOf(ChannelException.class)
                .hasMessageContaining("502");
    }

    @Test
    void destination_noPhoneOnBooking_isEmpty() {
        CustomerContact emailOnly = new CustomerContact("Omar", "omar@example.com", null, TicketLanguage.EN);
        TicketSnapshot snapshot = TicketSnapshot.from(TestFixtures.booking(2L, emailOnly, null));

        assertThat(sender.destination(snapshot)).isEmpty();
    }

    private static TicketAttachment attachment(TicketReason reason) {
        return TicketAttachment.of(TicketSnapshot.from(TestFixtures.confirmedBooking(1L)), PDF, reason);
    }
}
