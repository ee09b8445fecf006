package com.updesk.helpdesk.web.dto;

/**
 * One chat message as shown in the ticket conversation.
 *
 * @param createdAt formatted as {@code dd/MM/yyyy HH:mm}
 * @param origin    {@code painel}, {@code telegram} or {@code email}
 */
public record InteractionResponse(
    Long id,
    Long ticketId,
    Long authorId,
    String authorName,
    String message,
    String createdAt,
    String origin
) {
}
