package com.updesk.helpdesk.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * One chat message attached to a ticket. Rows are append-only: there are no setters
 * for the content once built.
 */
@Table("interactions")
public class Interaction {

    @Id
    private Long id;

    @Column("ticket_id")
    private Long ticketId;

    @Column("user_id")
    private Long userId;

    @Column("author_name")
    private String authorName;

    private String message;

    private InteractionOrigin origin;

    @Column("created_at")
    private LocalDateTime createdAt;

    public Interaction() {
        // default constructor required by Spring Data
    }

    public Interaction(
        Long id,
        Long ticketId,
        Long userId,
        String authorName,
        String message,
        InteractionOrigin origin,
        LocalDateTime createdAt
    ) {
        this.id = id;
        this.ticketId = ticketId;
        this.userId = userId;
        this.authorName = authorName;
        this.message = message;
        this.origin = origin;
        this.createdAt = createdAt;
    }

    public static Interaction newInteraction(
        Long ticketId,
        Long userId,
        String authorName,
        String message,
        InteractionOrigin origin,
        LocalDateTime createdAt
    ) {
        Objects.requireNonNull(ticketId, "ticketId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        return new Interaction(null, ticketId, userId, authorName, message, origin, createdAt);
    }

    public Long getId() {
        return id;
    }

    public Long getTicketId() {
        return ticketId;
    }

    public Long getUserId() {
        return userId;
    }

    public String getAuthorName() {
        return authorName;
    }

    public String getMessage() {
        return message;
    }

    public InteractionOrigin getOrigin() {
        return origin;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}
