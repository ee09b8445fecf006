package com.updesk.helpdesk.integration.telegram;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.updesk.helpdesk.integration.telegram.TelegramUpdate.TelegramMessage;

/**
 * Finds the ticket a Telegram message refers to by its {@code #<digits>} marker, first
 * in the message itself, then in the message it replies to.
 */
public final class TicketIdExtractor {

    private static final Pattern TICKET_MARKER = Pattern.compile("#(\\d+)");

    private TicketIdExtractor() {
    }

    public static Optional<Long> extract(TelegramMessage message) {
        if (message == null) {
            return Optional.empty();
        }
        Optional<Long> own = fromText(message.text());
        if (own.isPresent()) {
            return own;
        }
        TelegramMessage replied = message.replyToMessage();
        return replied == null ? Optional.empty() : fromText(replied.text());
    }

    static Optional<Long> fromText(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = TICKET_MARKER.matcher(text);
        while (matcher.find()) {
            try {
                return Optional.of(Long.parseLong(matcher.group(1)));
            } catch (NumberFormatException overflow) {
                // digits beyond the range of an id, keep scanning
            }
        }
        return Optional.empty();
    }
}
