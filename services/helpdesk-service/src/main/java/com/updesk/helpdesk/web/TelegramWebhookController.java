package com.updesk.helpdesk.web;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.updesk.helpdesk.integration.props.IntegrationProperties;
import com.updesk.helpdesk.integration.telegram.TelegramUpdate;
import com.updesk.helpdesk.integration.telegram.TelegramUpdateCorrelator;

import reactor.core.publisher.Mono;

/**
 * Receives Bot API updates. The provider always gets {@code {"ok": true}} back, whatever
 * happened to the update, so it never starts redelivering.
 */
@RestController
@RequestMapping(path = "/api/telegram/webhook", produces = MediaType.APPLICATION_JSON_VALUE)
public class TelegramWebhookController {

    static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private static final Logger log = LoggerFactory.getLogger(TelegramWebhookController.class);
    private static final Map<String, Boolean> ACK = Map.of("ok", true);

    private final TelegramUpdateCorrelator correlator;
    private final ObjectMapper objectMapper;
    private final String webhookSecret;

    public TelegramWebhookController(
        TelegramUpdateCorrelator correlator,
        ObjectMapper objectMapper,
        IntegrationProperties integrationProperties
    ) {
        this.correlator = correlator;
        this.objectMapper = objectMapper;
        this.webhookSecret = integrationProperties.getTelegram().getWebhookSecret();
    }

    @PostMapping
    public Mono<Map<String, Boolean>> receive(
        @RequestBody(required = false) String body,
        @RequestHeader(name = SECRET_HEADER, required = false) String secret
    ) {
        if (StringUtils.hasText(webhookSecret) && !secretMatches(secret)) {
            log.warn("Dropping Telegram update with a missing or wrong secret token");
            return Mono.just(ACK);
        }
        if (!StringUtils.hasText(body)) {
            log.info("Dropping empty Telegram update");
            return Mono.just(ACK);
        }
        TelegramUpdate update;
        try {
            update = objectMapper.readValue(body, TelegramUpdate.class);
        } catch (JsonProcessingException malformed) {
            log.warn("Dropping unreadable Telegram update: {}", malformed.getOriginalMessage());
            return Mono.just(ACK);
        }
        Long updateId = update.updateId();
        return Mono.defer(() -> correlator.onUpdate(update))
            .onErrorResume(error -> {
                log.error("Telegram update {} failed; acknowledging it anyway", updateId, error);
                return Mono.empty();
            })
            .then(Mono.just(ACK));
    }

    private boolean secretMatches(String secret) {
        if (secret == null) {
            return false;
        }
        return MessageDigest.isEqual(
            webhookSecret.getBytes(StandardCharsets.UTF_8),
            secret.getBytes(StandardCharsets.UTF_8));
    }
}
