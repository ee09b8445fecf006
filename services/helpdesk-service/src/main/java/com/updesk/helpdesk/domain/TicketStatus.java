package com.updesk.helpdesk.domain;

/**
 * Lifecycle state of a support ticket.
 *
 * <p>{@link #OPEN} is the triage queue, {@link #IN_PROGRESS} is the only state in which a
 * ticket carries an assignee, the two resolved states are terminal from the requester's
 * point of view but can still be reopened by an agent. The value is stored as plain text.</p>
 */
public enum TicketStatus {
    OPEN("Aberto"),
    IN_PROGRESS("Em Atendimento"),
    RESOLVED("Resolvido"),
    RESOLVED_BY_AI("Resolvido por IA");

    private final String label;

    TicketStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Accepts either the enum name ({@code IN_PROGRESS}) or the display label
     * ({@code Em Atendimento}), ignoring case.
     */
    public static TicketStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Ticket status must not be blank");
        }
        String candidate = value.trim();
        for (TicketStatus status : values()) {
            if (status.name().equalsIgnoreCase(candidate) || status.label.equalsIgnoreCase(candidate)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ticket status '%s'".formatted(value));
    }
}
