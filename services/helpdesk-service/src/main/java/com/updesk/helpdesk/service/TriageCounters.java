package com.updesk.helpdesk.service;

/**
 * Live triage indicators, computed on every request.
 *
 * @param awaitingTriage tickets currently open
 * @param triagedToday   tickets in progress whose last transition happened today
 * @param pendingOver24h open tickets created more than 24 hours ago
 */
public record TriageCounters(long awaitingTriage, long triagedToday, long pendingOver24h) {
}
