package com.updesk.helpdesk.integration.telegram;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.updesk.helpdesk.integration.telegram.TelegramUpdate.TelegramMessage;

class TicketIdExtractorTest {

    private static TelegramMessage message(String text) {
        return new TelegramMessage(1L, text, null);
    }

    @Test
    @DisplayName("finds the id in the message itself")
    void shouldReadOwnText() {
        assertThat(TicketIdExtractor.extract(message("Obrigado! #42"))).contains(42L);
    }

    @Test
    @DisplayName("falls back to the text of the replied-to message")
    void shouldReadRepliedText() {
        TelegramMessage reply = new TelegramMessage(2L, "Já resolvi por aqui",
            message("[Chamado #7]\nMinha impressora parou"));

        assertThat(TicketIdExtractor.extract(reply)).contains(7L);
    }

    @Test
    @DisplayName("the message's own marker wins over the replied-to one")
    void shouldPreferOwnText() {
        TelegramMessage reply = new TelegramMessage(2L, "Na verdade é o #9", message("[Chamado #7]"));

        assertThat(TicketIdExtractor.extract(reply)).contains(9L);
    }

    @Test
    @DisplayName("no marker anywhere resolves to nothing")
    void shouldReturnEmptyWithoutMarker() {
        assertThat(TicketIdExtractor.extract(message("Bom dia, equipe"))).isEmpty();
        assertThat(TicketIdExtractor.extract(new TelegramMessage(3L, "ok", message("sem número")))).isEmpty();
        assertThat(TicketIdExtractor.extract(null)).isEmpty();
    }

    @Test
    @DisplayName("skips a marker too large for an id and keeps scanning")
    void shouldSkipOverflowingMarker() {
        assertThat(TicketIdExtractor.fromText("#99999999999999999999999 e depois #12")).contains(12L);
    }
}
