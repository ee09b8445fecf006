package com.updesk.helpdesk.service;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.updesk.helpdesk.domain.Interaction;
import com.updesk.helpdesk.domain.InteractionOrigin;
import com.updesk.helpdesk.notification.NotificationBridge;
import com.updesk.helpdesk.repository.InteractionRepository;
import com.updesk.helpdesk.repository.TicketRepository;
import com.updesk.helpdesk.security.Actor;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The in-app chat of a ticket. A posted message is stored first; the notification
 * bridge only runs once the row exists, so a notification outage never loses the message.
 */
@Service
public class InteractionService {

    private static final Logger log = LoggerFactory.getLogger(InteractionService.class);

    private final TicketRepository ticketRepository;
    private final InteractionRepository interactionRepository;
    private final NotificationBridge notificationBridge;
    private final Clock clock;

    public InteractionService(
        TicketRepository ticketRepository,
        InteractionRepository interactionRepository,
        NotificationBridge notificationBridge,
        Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.interactionRepository = interactionRepository;
        this.notificationBridge = notificationBridge;
        this.clock = clock;
    }

    public Flux<Interaction> list(Long ticketId) {
        return ticketRepository.existsById(ticketId)
            .flatMapMany(exists -> exists
                ? interactionRepository.findByTicketIdOrderByCreatedAtAscIdAsc(ticketId)
                : Flux.error(new TicketNotFoundException(ticketId)));
    }

    /**
     * Stores {@code text} as a panel message by {@code author}, then notifies support.
     *
     * <p>The requester contact used for the confirmation e-mail is resolved from the
     * explicit override, then the author's own claims, then the ticket record.</p>
     */
    public Mono<ChatPostResult> post(Long ticketId, Actor author, String text, String emailOverride, String nameOverride) {
        if (!StringUtils.hasText(text)) {
            return Mono.error(new IllegalArgumentException("Mensagem vazia."));
        }
        String message = text.strip();
        return ticketRepository.findById(ticketId)
            .switchIfEmpty(Mono.error(new TicketNotFoundException(ticketId)))
            .flatMap(ticket -> interactionRepository.save(Interaction.newInteraction(
                    ticketId, author.userId(), authorName(author), message, InteractionOrigin.PANEL,
                    LocalDateTime.now(clock)))
                .doOnNext(saved -> log.info("Interaction {} stored on ticket {} by user {}",
                    saved.getId(), ticketId, author.userId()))
                .flatMap(saved -> notificationBridge.notify(
                        "[Chamado #%d]\n%s".formatted(ticketId, message),
                        firstText(emailOverride, author.email(), ticket.getRequesterEmail()),
                        firstText(nameOverride, author.displayName(), ticket.getRequesterDisplayName()),
                        ticketId)
                    .map(outcome -> new ChatPostResult(saved, outcome))))
            .doOnNext(result -> {
                if (result.notificationFailed()) {
                    log.warn("Interaction {} saved but support notification failed: {}",
                        result.interaction().getId(), result.notification());
                }
            });
    }

    private static String authorName(Actor author) {
        if (StringUtils.hasText(author.displayName())) {
            return author.displayName();
        }
        return StringUtils.hasText(author.email()) ? author.email() : "Usuário " + author.userId();
    }

    private static String firstText(String... candidates) {
        for (String candidate : candidates) {
            if (StringUtils.hasText(candidate)) {
                return candidate.trim();
            }
        }
        return null;
    }
}
