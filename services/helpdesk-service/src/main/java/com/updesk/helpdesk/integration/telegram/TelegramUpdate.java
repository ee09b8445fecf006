package com.updesk.helpdesk.integration.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of a Bot API update the correlator reads. Everything else in the payload is
 * ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
    @JsonProperty("update_id") Long updateId,
    TelegramMessage message,
    @JsonProperty("edited_message") TelegramMessage editedMessage
) {

    /**
     * The message carried by this update, preferring a new message over an edit.
     */
    public TelegramMessage effectiveMessage() {
        return message != null ? message : editedMessage;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TelegramMessage(
        @JsonProperty("message_id") Long messageId,
        String text,
        @JsonProperty("reply_to_message") TelegramMessage replyToMessage
    ) {
    }
}
