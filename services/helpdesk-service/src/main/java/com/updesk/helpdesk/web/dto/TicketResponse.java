package com.updesk.helpdesk.web.dto;

import java.time.LocalDateTime;

import com.updesk.helpdesk.domain.Priority;
import com.updesk.helpdesk.domain.TicketStatus;

/**
 * API view of a ticket. The attachment content itself is never returned, only whether
 * one exists.
 */
public class TicketResponse {

    private final Long id;
    private final String title;
    private final String description;
    private final String affectedArea;
    private final Priority priority;
    private final String priorityLabel;
    private final TicketStatus status;
    private final String statusLabel;
    private final Long requesterId;
    private final String requesterEmail;
    private final Long assigneeId;
    private final String suggestedSolution;
    private final boolean hasAttachment;
    private final String attachmentName;
    private final LocalDateTime createdAt;
    private final LocalDateTime lastModifiedAt;

    public TicketResponse(
        Long id,
        String title,
        String description,
        String affectedArea,
        Priority priority,
        TicketStatus status,
        Long requesterId,
        String requesterEmail,
        Long assigneeId,
        String suggestedSolution,
        boolean hasAttachment,
        String attachmentName,
        LocalDateTime createdAt,
        LocalDateTime lastModifiedAt
    ) {
        this.id = id;
        this.title = title;
        this.description = description;
        this.affectedArea = affectedArea;
        this.priority = priority;
        this.priorityLabel = priority == null ? null : priority.label();
        this.status = status;
        this.statusLabel = status == null ? null : status.label();
        this.requesterId = requesterId;
        this.requesterEmail = requesterEmail;
        this.assigneeId = assigneeId;
        this.suggestedSolution = suggestedSolution;
        this.hasAttachment = hasAttachment;
        this.attachmentName = attachmentName;
        this.createdAt = createdAt;
        this.lastModifiedAt = lastModifiedAt;
    }

    public Long getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getAffectedArea() {
        return affectedArea;
    }

    public Priority getPriority() {
        return priority;
    }

    public String getPriorityLabel() {
        return priorityLabel;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public String getStatusLabel() {
        return statusLabel;
    }

    public Long getRequesterId() {
        return requesterId;
    }

    public String getRequesterEmail() {
        return requesterEmail;
    }

    public Long getAssigneeId() {
        return assigneeId;
    }

    public String getSuggestedSolution() {
        return suggestedSolution;
    }

    public boolean isHasAttachment() {
        return hasAttachment;
    }

    public String getAttachmentName() {
        return attachmentName;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getLastModifiedAt() {
        return lastModifiedAt;
    }
}
