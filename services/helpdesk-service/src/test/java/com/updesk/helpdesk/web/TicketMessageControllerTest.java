package com.updesk.helpdesk.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

import java.time.LocalDateTime;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.updesk.helpdesk.domain.Interaction;
import com.updesk.helpdesk.domain.InteractionOrigin;
import com.updesk.helpdesk.notification.NotificationOutcome;
import com.updesk.helpdesk.notification.NotificationOutcome.DeliveryState;
import com.updesk.helpdesk.security.Actor;
import com.updesk.helpdesk.security.SecurityConfig;
import com.updesk.helpdesk.service.ChatPostResult;
import com.updesk.helpdesk.service.InteractionService;
import com.updesk.helpdesk.service.TicketNotFoundException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@WebFluxTest(controllers = TicketMessageController.class)
@Import({SecurityConfig.class, TicketMapper.class})
@DisplayName("Ticket chat endpoints")
class TicketMessageControllerTest {

    private static final LocalDateTime AT = LocalDateTime.of(2024, 5, 2, 14, 5);

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private InteractionService interactionService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    private WebTestClient asUser() {
        return webClient.mutateWith(mockJwt().jwt(jwt -> jwt.subject("5").claim("name", "Ana")));
    }

    private static Interaction stored(long id, InteractionOrigin origin) {
        return new Interaction(id, 7L, 5L, "Ana", "Ainda sem rede", origin, AT);
    }

    @Test
    @DisplayName("posting a message answers ok when both channels delivered")
    void shouldAnswerOk() {
        when(interactionService.post(eq(7L), any(Actor.class), eq("Ainda sem rede"), isNull(), isNull()))
            .thenReturn(Mono.just(new ChatPostResult(stored(30L, InteractionOrigin.PANEL),
                new NotificationOutcome(DeliveryState.DELIVERED, DeliveryState.DELIVERED))));

        asUser().post().uri("/api/tickets/7/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("mensagem", "  Ainda sem rede "))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("ok")
            .jsonPath("$.interactionId").isEqualTo(30);
    }

    @Test
    @DisplayName("synonymous text fields and contact overrides are accepted")
    void shouldAcceptSynonymousFields() {
        when(interactionService.post(eq(7L), any(Actor.class), eq("Ainda sem rede"), eq("bia@example.com"), eq("Bia")))
            .thenReturn(Mono.just(new ChatPostResult(stored(31L, InteractionOrigin.PANEL),
                new NotificationOutcome(DeliveryState.DELIVERED, DeliveryState.SKIPPED))));

        asUser().post().uri("/api/tickets/7/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("mensagem_usuario", "Ainda sem rede", "email", "bia@example.com", "nome", "Bia"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("ok");

        verify(interactionService).post(eq(7L), any(Actor.class), eq("Ainda sem rede"), eq("bia@example.com"), eq("Bia"));
    }

    @Test
    @DisplayName("a message without text answers 400 and stores nothing")
    void shouldRejectEmptyMessage() {
        asUser().post().uri("/api/tickets/7/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("texto", "   "))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.saved").isEqualTo(false);

        verifyNoInteractions(interactionService);
    }

    @Test
    @DisplayName("anonymous callers get 401")
    void shouldRequireAuthentication() {
        webClient.post().uri("/api/tickets/7/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("mensagem", "Oi"))
            .exchange()
            .expectStatus().isUnauthorized();

        verifyNoInteractions(interactionService);
    }

    @Test
    @DisplayName("a failed notification answers 500 while reporting the message as saved")
    void shouldReportPartialSuccess() {
        when(interactionService.post(eq(7L), any(Actor.class), any(), any(), any()))
            .thenReturn(Mono.just(new ChatPostResult(stored(32L, InteractionOrigin.PANEL),
                new NotificationOutcome(DeliveryState.FAILED, DeliveryState.DELIVERED))));

        asUser().post().uri("/api/tickets/7/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("conteudo", "Oi"))
            .exchange()
            .expectStatus().is5xxServerError()
            .expectBody()
            .jsonPath("$.status").isEqualTo("partial")
            .jsonPath("$.saved").isEqualTo(true)
            .jsonPath("$.interactionId").isEqualTo(32);
    }

    @Test
    @DisplayName("posting to an unknown ticket answers 404")
    void shouldReturnNotFoundForUnknownTicket() {
        when(interactionService.post(eq(99L), any(Actor.class), any(), any(), any()))
            .thenReturn(Mono.error(new TicketNotFoundException(99L)));

        asUser().post().uri("/api/tickets/99/messages")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("mensagem", "Oi"))
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("the conversation is listed with formatted timestamps and origin")
    void shouldListMessages() {
        when(interactionService.list(7L)).thenReturn(Flux.just(
            stored(30L, InteractionOrigin.PANEL),
            new Interaction(33L, 7L, 1L, "Suporte", "Verificando", InteractionOrigin.TELEGRAM, AT.plusMinutes(3))));

        asUser().get().uri("/api/tickets/7/messages")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].id").isEqualTo(30)
            .jsonPath("$[0].authorName").isEqualTo("Ana")
            .jsonPath("$[0].createdAt").isEqualTo("02/05/2024 14:05")
            .jsonPath("$[0].origin").isEqualTo("painel")
            .jsonPath("$[1].origin").isEqualTo("telegram")
            .jsonPath("$[1].createdAt").isEqualTo("02/05/2024 14:08");
    }
}
