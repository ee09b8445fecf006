package com.updesk.helpdesk.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.updesk.helpdesk.integration.telegram.TelegramUpdate;
import com.updesk.helpdesk.integration.telegram.TelegramUpdateCorrelator;
import com.updesk.helpdesk.security.SecurityConfig;

import reactor.core.publisher.Mono;

@WebFluxTest(controllers = TelegramWebhookController.class)
@Import(SecurityConfig.class)
@DisplayName("Telegram webhook")
class TelegramWebhookControllerTest {

    private static final String UPDATE = """
        {"update_id": 900, "message": {"message_id": 55, "text": "Resolvido #42",
         "chat": {"id": -100}, "from": {"id": 3, "first_name": "Carlos"}}}""";

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private TelegramUpdateCorrelator correlator;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    @Test
    @DisplayName("hands the parsed update to the correlator without authentication")
    void shouldForwardUpdate() {
        when(correlator.onUpdate(any())).thenReturn(Mono.empty());

        webClient.post().uri("/api/telegram/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(UPDATE)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.ok").isEqualTo(true);

        var updateCaptor = ArgumentCaptor.forClass(TelegramUpdate.class);
        verify(correlator).onUpdate(updateCaptor.capture());
        assertThat(updateCaptor.getValue().updateId()).isEqualTo(900L);
        assertThat(updateCaptor.getValue().effectiveMessage().text()).isEqualTo("Resolvido #42");
    }

    @Test
    @DisplayName("acknowledges a malformed payload without processing it")
    void shouldAcknowledgeGarbage() {
        webClient.post().uri("/api/telegram/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{not json")
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.ok").isEqualTo(true);

        verifyNoInteractions(correlator);
    }

    @Test
    @DisplayName("acknowledges an empty body")
    void shouldAcknowledgeEmptyBody() {
        webClient.post().uri("/api/telegram/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.ok").isEqualTo(true);

        verifyNoInteractions(correlator);
    }

    @Test
    @DisplayName("acknowledges the update even when correlation fails outright")
    void shouldAcknowledgeWhenCorrelatorFails() {
        when(correlator.onUpdate(any())).thenReturn(
            Mono.error(new DataAccessResourceFailureException("Failed to obtain R2DBC Connection")));

        webClient.post().uri("/api/telegram/webhook")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(UPDATE)
            .exchange()
            .expectStatus().isOk()
            .expectBody().jsonPath("$.ok").isEqualTo(true);

        verify(correlator).onUpdate(any());
    }
}
