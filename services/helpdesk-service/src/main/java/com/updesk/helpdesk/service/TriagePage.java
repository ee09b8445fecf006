package com.updesk.helpdesk.service;

import java.util.List;

import com.updesk.helpdesk.domain.Ticket;

public record TriagePage(
    List<Ticket> tickets,
    int page,
    int pageSize,
    long totalElements,
    TriageCounters counters
) {

    public int totalPages() {
        return (int) ((totalElements + pageSize - 1) / pageSize);
    }
}
