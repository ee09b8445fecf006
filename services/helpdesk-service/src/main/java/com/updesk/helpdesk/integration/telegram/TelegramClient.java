package com.updesk.helpdesk.integration.telegram;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.updesk.helpdesk.integration.props.IntegrationProperties;

import reactor.core.publisher.Mono;

/**
 * Sends plain-text messages to the support chat through the Telegram Bot API.
 *
 * <p>Without a bot token and chat id every call completes empty, so the rest of the
 * notification flow runs the same way in environments without Telegram.</p>
 */
@Component
public class TelegramClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramClient.class);

    private final IntegrationProperties.TelegramProperties properties;
    private final WebClient webClient;

    public TelegramClient(WebClient.Builder builder, IntegrationProperties integrationProperties) {
        this.properties = integrationProperties.getTelegram();
        this.webClient = builder.clone()
            .baseUrl(this.properties.getBaseUrl())
            .build();
    }

    /**
     * Posts {@code text} to the configured chat.
     *
     * @return the Telegram message id of the sent message, or empty when Telegram is
     *         not configured
     */
    public Mono<Long> sendMessage(String text) {
        if (!properties.isConfigured()) {
            log.warn("Telegram not configured (bot token / chat id missing); message not sent");
            return Mono.empty();
        }

        Map<String, Object> payload = Map.of(
            "chat_id", properties.getChatId(),
            "text", text
        );

        return webClient.post()
            .uri(uriBuilder -> uriBuilder.path("/bot" + properties.getBotToken() + "/sendMessage").build())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new TelegramDeliveryException(
                    "Telegram sendMessage failed with HTTP %d: %s".formatted(response.statusCode().value(), body))))
            .bodyToMono(SendMessageResponse.class)
            .timeout(properties.getTimeout())
            .flatMap(response -> {
                if (!response.ok() || response.result() == null || response.result().messageId() == null) {
                    return Mono.error(new TelegramDeliveryException(
                        "Telegram rejected the message: " + response.description()));
                }
                return Mono.just(response.result().messageId());
            })
            .doOnNext(messageId -> log.debug("Telegram accepted message {}", messageId));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SendMessageResponse(boolean ok, SentMessage result, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SentMessage(@JsonProperty("message_id") Long messageId) {
    }
}
