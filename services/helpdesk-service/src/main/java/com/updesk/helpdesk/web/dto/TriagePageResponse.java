package com.updesk.helpdesk.web.dto;

import java.util.List;

public record TriagePageResponse(
    List<TicketResponse> tickets,
    int page,
    int pageSize,
    long totalElements,
    int totalPages,
    Counters counters
) {

    public record Counters(long awaitingTriage, long triagedToday, long pendingOver24h) {
    }
}
