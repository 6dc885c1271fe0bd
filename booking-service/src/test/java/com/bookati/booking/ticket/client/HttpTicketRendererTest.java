package com.bookati.booking.ticket.client;

import com.bookati.booking.TestFixtures;
import com.bookati.booking.ticket.RenderException;
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

class HttpTicketRendererTest {

    private static final String BASE_URL = "http://renderer.test";

    private MockRestServiceServer server;
    private HttpTicketRenderer renderer;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        renderer = new HttpTicketRenderer(builder.build());
    }

    @Test
    void render_returnsPdfBytes() {
        byte[] pdf = "%PDF-1.7 ticket".getBytes();
        server.expect(requestTo(BASE_URL + "/v1/tickets/render"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.bookingId").value(1))
                .andExpect(jsonPath("$.lines.length()").value(2))
                .andRespond(withSuccess(pdf, MediaType.APPLICATION_PDF));

        assertThat(renderer.render(snapshot())).isEqualTo(pdf);
        server.verify();
    }

    @Test
    void render_serverError_throwsRenderException() {
        server.expect(requestTo(BASE_URL + "/v1/tickets/render"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> renderer.render(snapshot()))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("500");
    }

    @Test
    void render_emptyBody_throwsRenderException() {
        server.expect(requestTo(BASE_URL + "/v1/tickets/render"))
                .andRespond(withSuccess(new byte[0], MediaType.APPLICATION_PDF));

        assertThatThrownBy(() -> renderer.render(snapshot()))
                .isInstanceOf(RenderException.class)
                .hasMessageContaining("empty");
    }

    private static TicketSnapshot snapshot() {
        return TicketSnapshot.from(TestFixtures.confirmedBooking(1L));
    }
}
