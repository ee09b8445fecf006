package com.updesk.helpdesk.notification;

import java.time.Clock;
import java.time.LocalDateTime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.updesk.helpdesk.domain.TelegramMessageLink;
import com.updesk.helpdesk.integration.mail.EmailNotifier;
import com.updesk.helpdesk.integration.telegram.TelegramClient;
import com.updesk.helpdesk.notification.NotificationOutcome.DeliveryState;
import com.updesk.helpdesk.repository.TelegramMessageLinkRepository;

import reactor.core.publisher.Mono;

/**
 * Mirrors a support message to the Telegram support chat and confirms receipt to the
 * requester by e-mail.
 *
 * <p>Both legs are best-effort side channels: they run after the interaction has been
 * stored, each one is isolated, and failures are reported in the
 * {@link NotificationOutcome} instead of being thrown. A successful Telegram send for a
 * known ticket leaves a {@link TelegramMessageLink} behind.</p>
 */
@Component
public class NotificationBridge {

    private static final Logger log = LoggerFactory.getLogger(NotificationBridge.class);

    static final String EMAIL_SUBJECT = "Recebemos sua mensagem - UpDesk";
    static final String MISSING_EMAIL_NOTE = "(⚠️ E-mail do solicitante não disponível)";

    private final TelegramClient telegramClient;
    private final EmailNotifier emailNotifier;
    private final TelegramMessageLinkRepository linkRepository;
    private final Clock clock;

    public NotificationBridge(
        TelegramClient telegramClient,
        EmailNotifier emailNotifier,
        TelegramMessageLinkRepository linkRepository,
        Clock clock
    ) {
        this.telegramClient = telegramClient;
        this.emailNotifier = emailNotifier;
        this.linkRepository = linkRepository;
        this.clock = clock;
    }

    /**
     * Sends {@code message} to Telegram, then a confirmation e-mail to
     * {@code recipientEmail}.
     *
     * @param ticketId optional; when present the Telegram message is linked to it
     */
    public Mono<NotificationOutcome> notify(String message, String recipientEmail, String recipientName, Long ticketId) {
        if (!StringUtils.hasText(recipientEmail)) {
            return notifyWithoutEmail(message, ticketId);
        }

        String telegramText = """
            Nova mensagem de suporte (UpDesk)

            Usuário: %s
            E-mail: %s

            Mensagem:
            %s""".formatted(StringUtils.hasText(recipientName) ? recipientName : "N/D", recipientEmail, message);

        return sendTelegram(telegramText, ticketId)
            .flatMap(telegram -> sendConfirmation(recipientEmail, recipientName, message)
                .map(email -> new NotificationOutcome(telegram, email)))
            .doOnNext(outcome -> log.info("Support notification for ticket {}: telegram={}, email={}",
                ticketId, outcome.telegram(), outcome.email()));
    }

    /**
     * Telegram-only variant for when no requester e-mail can be resolved. The message is
     * flagged so the support team knows no confirmation went out.
     */
    public Mono<NotificationOutcome> notifyWithoutEmail(String message, Long ticketId) {
        log.warn("No requester e-mail for ticket {}; notifying Telegram only", ticketId);
        String telegramText = message + "\n\n" + MISSING_EMAIL_NOTE;
        return sendTelegram(telegramText, ticketId)
            .map(telegram -> new NotificationOutcome(telegram, DeliveryState.SKIPPED));
    }

    private Mono<DeliveryState> sendTelegram(String text, Long ticketId) {
        return telegramClient.sendMessage(text)
            .flatMap(messageId -> recordLink(ticketId, messageId).thenReturn(DeliveryState.DELIVERED))
            .defaultIfEmpty(DeliveryState.SKIPPED)
            .onErrorResume(error -> {
                log.error("Telegram notification for ticket {} failed: {}", ticketId, error.getMessage());
                return Mono.just(DeliveryState.FAILED);
            });
    }

    private Mono<Void> recordLink(Long ticketId, Long messageId) {
        if (ticketId == null) {
            return Mono.empty();
        }
        return linkRepository.save(new TelegramMessageLink(null, ticketId, messageId, LocalDateTime.now(clock)))
            .doOnNext(link -> log.info("Telegram message {} linked to ticket {}", messageId, ticketId))
            .onErrorResume(error -> {
                log.error("Could not record Telegram link for ticket {}: {}", ticketId, error.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private Mono<DeliveryState> sendConfirmation(String recipientEmail, String recipientName, String message) {
        String body = """
            Olá %s,

            Recebemos a sua mensagem de suporte no UpDesk:

            %s

            Nossa equipe entrará em contato em breve.

            Atenciosamente,
            Equipe UpDesk""".formatted(recipientName == null ? "" : recipientName, message);

        return emailNotifier.send(recipientEmail, EMAIL_SUBJECT, body)
            .map(sent -> sent ? DeliveryState.DELIVERED : DeliveryState.SKIPPED)
            .onErrorResume(error -> {
                log.error("Confirmation e-mail to {} failed: {}", recipientEmail, error.getMessage());
                return Mono.just(DeliveryState.FAILED);
            });
    }
}
