package com.updesk.helpdesk.domain;

import java.util.Optional;

/**
 * Urgency assigned to a ticket, either by the AI triage or by an agent override.
 * {@link #UNCLASSIFIED} stands in whenever no usable classification exists, so a ticket
 * never has an empty priority.
 */
public enum Priority {
    LOW("Baixa"),
    MEDIUM("Média"),
    HIGH("Alta"),
    UNCLASSIFIED("Não Classificada");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a label produced by the model or typed by an agent. Accents on
     * {@code Média} are optional.
     */
    public static Optional<Priority> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = value.trim();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(candidate) || priority.label.equalsIgnoreCase(candidate)) {
                return Optional.of(priority);
            }
        }
        if ("media".equalsIgnoreCase(candidate)) {
            return Optional.of(MEDIUM);
        }
        return Optional.empty();
    }

    public static Priority parse(String value) {
        return fromLabel(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown priority '%s'".formatted(value)));
    }
}
