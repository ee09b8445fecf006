package com.updesk.helpdesk.domain;

import java.time.LocalDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Records that an outbound Telegram notification for a ticket produced a given
 * Telegram message id, so a reply to that message can be traced back to the ticket.
 */
@Table("telegram_message_links")
public class TelegramMessageLink {

    @Id
    private Long id;

    @Column("ticket_id")
    private Long ticketId;

    @Column("telegram_message_id")
    private Long telegramMessageId;

    @Column("created_at")
    private LocalDateTime createdAt;

    public TelegramMessageLink() {
    }

    public TelegramMessageLink(Long id, Long ticketId, Long telegramMessageId, LocalDateTime createdAt) {
        this.id = id;
        this.ticketId = ticketId;
        this.telegramMessageId = telegramMessageId;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public Long getTicketId() {
        return ticketId;
    }

    public Long getTelegramMessageId() {
        return telegramMessageId;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
