package com.updesk.helpdesk.integration.ai;

import java.util.Objects;

import com.updesk.helpdesk.domain.Priority;

/**
 * Result of an AI consultation: the solution shown to the requester and the urgency
 * used as the ticket priority. Always populated, even when the provider was unusable.
 */
public record AiSuggestion(String solution, Priority priority) {

    public AiSuggestion {
        Objects.requireNonNull(solution, "solution must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
    }

    public static AiSuggestion unclassified(String solution) {
        return new AiSuggestion(solution, Priority.UNCLASSIFIED);
    }
}
