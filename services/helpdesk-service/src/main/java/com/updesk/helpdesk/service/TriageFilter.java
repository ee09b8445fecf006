package com.updesk.helpdesk.service;

import java.util.Map;

import org.springframework.data.domain.Sort;

import com.updesk.helpdesk.domain.Priority;
import com.updesk.helpdesk.domain.TicketStatus;

/**
 * Composable filters of the triage listing. A {@code null} priority or status means
 * "any". Pages are 1-based.
 *
 * @param search free text: digits match the ticket id, anything else a title substring
 */
public record TriageFilter(
    String search,
    Priority priority,
    TicketStatus status,
    CreationPeriod period,
    String orderBy,
    Sort.Direction direction,
    int page
) {

    private static final Map<String, String> SORTABLE = Map.of(
        "id", "id",
        "title", "title",
        "priority", "priority",
        "status", "status",
        "createdAt", "createdAt",
        "lastModifiedAt", "lastModifiedAt"
    );

    public TriageFilter {
        if (period == null) {
            period = CreationPeriod.ANY;
        }
        if (orderBy == null || orderBy.isBlank()) {
            orderBy = "createdAt";
        }
        if (!SORTABLE.containsKey(orderBy)) {
            throw new IllegalArgumentException("Cannot sort tickets by '%s'".formatted(orderBy));
        }
        if (direction == null) {
            direction = Sort.Direction.ASC;
        }
        if (page < 1) {
            page = 1;
        }
    }

    /**
     * Open tickets, oldest first: the default triage view.
     */
    public static TriageFilter openQueue() {
        return new TriageFilter(null, null, TicketStatus.OPEN, CreationPeriod.ANY, "createdAt", Sort.Direction.ASC, 1);
    }

    Sort sort() {
        return Sort.by(direction, SORTABLE.get(orderBy)).and(Sort.by(Sort.Direction.ASC, "id"));
    }
}
