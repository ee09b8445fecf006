package com.updesk.helpdesk.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.updesk.helpdesk.security.Actor;
import com.updesk.helpdesk.service.InteractionService;
import com.updesk.helpdesk.web.dto.ChatMessageRequest;
import com.updesk.helpdesk.web.dto.ChatMessageResponse;
import com.updesk.helpdesk.web.dto.InteractionResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping(path = "/api/tickets/{ticketId}/messages", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketMessageController {

    private final InteractionService interactionService;
    private final TicketMapper ticketMapper;

    public TicketMessageController(InteractionService interactionService, TicketMapper ticketMapper) {
        this.interactionService = interactionService;
        this.ticketMapper = ticketMapper;
    }

    @GetMapping
    public Flux<InteractionResponse> list(@PathVariable Long ticketId) {
        return interactionService.list(ticketId)
            .map(ticketMapper::toResponse);
    }

    /**
     * Stores a chat message. Answers 500 with {@code status=partial} when the message
     * was saved but the support notification failed; the message is never rolled back.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ChatMessageResponse>> post(
        @PathVariable Long ticketId,
        @Valid @RequestBody ChatMessageRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        Actor author = Actor.from(jwt);
        String text = request.resolveText();
        if (text == null) {
            return Mono.just(ResponseEntity.badRequest()
                .body(new ChatMessageResponse("error", "Mensagem vazia.", null, false)));
        }
        return interactionService.post(ticketId, author, text, request.getEmail(), request.getNome())
            .map(result -> result.notificationFailed()
                ? ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ChatMessageResponse.partial(result.interaction().getId()))
                : ResponseEntity.ok(ChatMessageResponse.ok(result.interaction().getId())));
    }
}
