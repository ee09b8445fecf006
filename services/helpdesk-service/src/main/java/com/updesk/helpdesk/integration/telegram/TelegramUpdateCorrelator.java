package com.updesk.helpdesk.integration.telegram;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.updesk.helpdesk.domain.Interaction;
import com.updesk.helpdesk.domain.InteractionOrigin;
import com.updesk.helpdesk.domain.TelegramMessageLink;
import com.updesk.helpdesk.integration.props.IntegrationProperties;
import com.updesk.helpdesk.integration.telegram.TelegramUpdate.TelegramMessage;
import com.updesk.helpdesk.repository.InteractionRepository;
import com.updesk.helpdesk.repository.TelegramMessageLinkRepository;
import com.updesk.helpdesk.repository.TicketRepository;

import reactor.core.publisher.Mono;

/**
 * Turns inbound Telegram updates into interactions on the ticket they mention.
 *
 * <p>The ticket is found by the {@code #<id>} marker in the message text, then in the
 * text of the message being replied to, and finally through the outbound link
 * recorded when the replied-to message was sent. Anything that cannot be tied to an
 * existing ticket is logged and dropped. Messages are attributed to the configured
 * support user.</p>
 */
@Component
public class TelegramUpdateCorrelator {

    private static final Logger log = LoggerFactory.getLogger(TelegramUpdateCorrelator.class);

    private final TicketRepository ticketRepository;
    private final InteractionRepository interactionRepository;
    private final TelegramMessageLinkRepository linkRepository;
    private final IntegrationProperties.TelegramProperties properties;
    private final Clock clock;

    public TelegramUpdateCorrelator(
        TicketRepository ticketRepository,
        InteractionRepository interactionRepository,
        TelegramMessageLinkRepository linkRepository,
        IntegrationProperties integrationProperties,
        Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.interactionRepository = interactionRepository;
        this.linkRepository = linkRepository;
        this.properties = integrationProperties.getTelegram();
        this.clock = clock;
    }

    /**
     * Processes one update. Emits the stored interaction, or completes empty when the
     * update was dropped; never signals an error.
     */
    @Transactional
    public Mono<Interaction> onUpdate(TelegramUpdate update) {
        TelegramMessage message = update == null ? null : update.effectiveMessage();
        if (message == null) {
            log.info("Telegram update without 'message' or 'edited_message'; ignoring");
            return Mono.empty();
        }
        String text = message.text();
        if (text == null || text.isBlank()) {
            log.info("Telegram message {} has no text; ignoring", message.messageId());
            return Mono.empty();
        }

        return resolveTicketId(message)
            .switchIfEmpty(Mono.defer(() -> {
                log.warn("Could not find a ticket id in Telegram message: {}", preview(text));
                return Mono.empty();
            }))
            .flatMap(ticketId -> ticketRepository.existsById(ticketId)
                .flatMap(exists -> {
                    if (!exists) {
                        log.warn("Ticket {} referenced from Telegram does not exist", ticketId);
                        return Mono.empty();
                    }
                    return appendInteraction(ticketId, text);
                }))
            .onErrorResume(error -> {
                log.error("Failed to process Telegram update {}: {}", update.updateId(), error.getMessage(), error);
                return Mono.empty();
            });
    }

    private Mono<Long> resolveTicketId(TelegramMessage message) {
        Optional<Long> fromText = TicketIdExtractor.extract(message);
        if (fromText.isPresent()) {
            return Mono.just(fromText.get());
        }
        TelegramMessage replied = message.replyToMessage();
        if (replied == null || replied.messageId() == null) {
            return Mono.empty();
        }
        return linkRepository.findFirstByTelegramMessageIdOrderByCreatedAtDesc(replied.messageId())
            .map(TelegramMessageLink::getTicketId)
            .doOnNext(ticketId -> log.debug("Telegram reply to {} linked to ticket {}", replied.messageId(), ticketId));
    }

    private Mono<Interaction> appendInteraction(Long ticketId, String text) {
        Interaction interaction = Interaction.newInteraction(
            ticketId,
            properties.getSupportUserId(),
            properties.getSupportDisplayName(),
            text,
            InteractionOrigin.TELEGRAM,
            LocalDateTime.now(clock)
        );
        return interactionRepository.save(interaction)
            .doOnNext(saved -> log.info("Telegram interaction {} recorded on ticket {} as user {}",
                saved.getId(), ticketId, properties.getSupportUserId()));
    }

    private static String preview(String text) {
        return text.length() > 80 ? text.substring(0, 80) + "..." : text;
    }
}
