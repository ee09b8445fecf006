package com.updesk.helpdesk.web.dto;

import com.updesk.helpdesk.domain.Priority;

/**
 * What the requester sees before deciding whether the AI answer was enough.
 */
public record TicketProposalResponse(
    Long draftId,
    String title,
    Priority priority,
    String priorityLabel,
    String suggestedSolution,
    boolean attachmentAccepted
) {
}
