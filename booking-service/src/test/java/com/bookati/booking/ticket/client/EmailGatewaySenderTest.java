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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class EmailGatewaySenderTest {

    private static final String BASE_URL = "http://mail.test";
    private static final byte[] PDF = "%PDF-1.7 ticket".getBytes();

    private MockRestServiceServer server;
    private EmailGatewaySender sender;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        sender = new EmailGatewaySender(builder.build());
    }

    @Test
    void send_accepted_returnsProviderId() {
        server.expect(requestTo(BASE_URL + "/v1/emails"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.to").value("mona@example.com"))
                .andExpect(jsonPath("$.subject").value("Booking Ticket"))
                .andExpect(jsonPath("$.attachments[0].fileName").value("booking_ticket_1.pdf"))
                .andExpect(jsonPath("$.attachments[0].contentType").value("application/pdf"))
                .andRespond(withSuccess("{\"id\":\"email-77\"}", MediaType.APPLICATION_JSON));

        DeliveryResult result = sender.send(attachment(TestFixtures.customer()), "mona@example.com");

        assertThat(result).isEqualTo(DeliveryResult.delivered("email-77"));
        server.verify();
    }

    @Test
    void send_arabicCustomer_usesBilingualSubject() {
        CustomerContact arabic = new CustomerContact("منى", "mona@example.com", null, TicketLanguage.AR);
        server.expect(requestTo(BASE_URL + "/v1/emails"))
                .andExpect(jsonPath("$.subject").value("تذكرة الحجز - Booking Ticket"))
                .andRespond(withSuccess("{\"id\":\"email-78\"}", MediaType.APPLICATION_JSON));

        assertThat(sender.send(attachment(arabic), "mona@example.com").delivered()).isTrue();
    }

    @Test
    void send_clientError_throwsRefused() {
        server.expect(requestTo(BASE_URL + "/v1/emails"))
                .andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

        assertThatThrownBy(() -> sender.send(attachment(TestFixtures.customer()), "mona@example.com"))
                .isInstanceOf(ChannelException.class)
                .hasMessageContaining("refused")
                .hasMessageContaining("422");
    }

    @Test
    void send_serverError_throwsUnavailable() {
        server.expect(requestTo(BASE_URL + "/v1/emails"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> sender.send(attachment(TestFixtures.customer()), "mona@example.com"))
                .isInstanceOf(ChannelException.class)
                .hasMessageContaining("unavailable");
    }

    private static TicketAttachment attachment(CustomerContact customer) {
        TicketSnapshot snapshot = TicketSnapshot.from(TestFixtures.booking(1L, customer, null));
        return TicketAttachment.of(snapshot, PDF, TicketReason.CONFIRMED);
    }
}
