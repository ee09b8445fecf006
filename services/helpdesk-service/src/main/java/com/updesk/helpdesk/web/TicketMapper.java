package com.updesk.helpdesk.web;

import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Component;

import com.updesk.helpdesk.domain.Interaction;
import com.updesk.helpdesk.domain.Ticket;
import com.updesk.helpdesk.domain.TicketDraft;
import com.updesk.helpdesk.service.TriagePage;
import com.updesk.helpdesk.web.dto.InteractionResponse;
import com.updesk.helpdesk.web.dto.TicketProposalResponse;
import com.updesk.helpdesk.web.dto.TicketResponse;
import com.updesk.helpdesk.web.dto.TriagePageResponse;

/**
 * Centralises conversion between persistence objects and API DTOs so the shape of
 * responses stays consistent across controllers.
 */
@Component
public class TicketMapper {

    static final DateTimeFormatter CHAT_TIMESTAMP = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    public TicketResponse toResponse(Ticket ticket) {
        return new TicketResponse(
            ticket.getId(),
            ticket.getTitle(),
            ticket.getDescription(),
            ticket.getAffectedArea(),
            ticket.getPriority(),
            ticket.getStatus(),
            ticket.getRequesterId(),
            ticket.getRequesterEmail(),
            ticket.getAssigneeId(),
            ticket.getSuggestedSolution(),
            ticket.hasAttachment(),
            ticket.getAttachmentName(),
            ticket.getCreatedAt(),
            ticket.getLastModifiedAt()
        );
    }

    public TicketProposalResponse toProposal(TicketDraft draft) {
        return new TicketProposalResponse(
            draft.getId(),
            draft.getTitle(),
            draft.getPriority(),
            draft.getPriority().label(),
            draft.getSuggestedSolution(),
            draft.getAttachment() != null
        );
    }

    public TriagePageResponse toResponse(TriagePage page) {
        return new TriagePageResponse(
            page.tickets().stream().map(this::toResponse).toList(),
            page.page(),
            page.pageSize(),
            page.totalElements(),
            page.totalPages(),
            new TriagePageResponse.Counters(
                page.counters().awaitingTriage(),
                page.counters().triagedToday(),
                page.counters().pendingOver24h())
        );
    }

    public InteractionResponse toResponse(Interaction interaction) {
        return new InteractionResponse(
            interaction.getId(),
            interaction.getTicketId(),
            interaction.getUserId(),
            interaction.getAuthorName(),
            interaction.getMessage(),
            interaction.getCreatedAt() == null ? null : CHAT_TIMESTAMP.format(interaction.getCreatedAt()),
            interaction.getOrigin().wireValue()
        );
    }
}
