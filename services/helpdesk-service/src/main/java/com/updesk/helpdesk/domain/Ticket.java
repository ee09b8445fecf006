package com.updesk.helpdesk.domain;

import java.time.LocalDateTime;
import java.util.Objects;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Persistent representation of a support ticket.
 *
 * <p>Status changes go through {@link #assignTo}, {@link #returnToTriage} and
 * {@link #resolve} so the assignee is present exactly while the ticket is
 * {@link TicketStatus#IN_PROGRESS}. Requester contact data is captured when the ticket
 * is drafted and is what the notification bridge falls back to.</p>
 */
@Table("tickets")
public class Ticket {

    @Id
    private Long id;

    private String title;

    private String description;

    @Column("affected_area")
    private String affectedArea;

    private Priority priority;

    private TicketStatus status;

    @Column("requester_id")
    private Long requesterId;

    @Column("requester_email")
    private String requesterEmail;

    @Column("requester_display_name")
    private String requesterDisplayName;

    @Column("assignee_id")
    private Long assigneeId;

    @Column("suggested_solution")
    private String suggestedSolution;

    private byte[] attachment;

    @Column("attachment_name")
    private String attachmentName;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("last_modified_at")
    private LocalDateTime lastModifiedAt;

    public Ticket() {
        // default constructor required by Spring Data
    }

    /**
     * Builds an unsaved ticket from a confirmed draft. The draft already carries the
     * AI classification, so the only remaining decision is the initial status.
     */
    public static Ticket fromDraft(TicketDraft draft, TicketStatus initialStatus, LocalDateTime now) {
        Objects.requireNonNull(draft, "draft must not be null");
        Objects.requireNonNull(draft.getRequesterId(), "requesterId must not be null");
        if (initialStatus == TicketStatus.IN_PROGRESS) {
            throw new IllegalArgumentException("A new ticket cannot start in progress without an assignee");
        }
        Ticket ticket = new Ticket();
        ticket.title = draft.getTitle();
        ticket.description = draft.getDescription();
        ticket.affectedArea = draft.getAffectedArea();
        ticket.priority = draft.getPriority() != null ? draft.getPriority() : Priority.UNCLASSIFIED;
        ticket.status = initialStatus;
        ticket.requesterId = draft.getRequesterId();
        ticket.requesterEmail = draft.getRequesterEmail();
        ticket.requesterDisplayName = draft.getRequesterDisplayName();
        ticket.suggestedSolution = draft.getSuggestedSolution();
        ticket.attachment = draft.getAttachment();
        ticket.attachmentName = draft.getAttachmentName();
        ticket.createdAt = now;
        return ticket;
    }

    public void assignTo(Long agentId, LocalDateTime now) {
        Objects.requireNonNull(agentId, "agentId must not be null");
        this.status = TicketStatus.IN_PROGRESS;
        this.assigneeId = agentId;
        this.lastModifiedAt = now;
    }

    public void returnToTriage(LocalDateTime now) {
        this.status = TicketStatus.OPEN;
        this.assigneeId = null;
        this.lastModifiedAt = now;
    }

    public void resolve(LocalDateTime now) {
        this.status = TicketStatus.RESOLVED;
        this.assigneeId = null;
        this.lastModifiedAt = now;
    }

    public boolean hasAttachment() {
        return attachment != null && attachment.length > 0;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getAffectedArea() {
        return affectedArea;
    }

    public void setAffectedArea(String affectedArea) {
        this.affectedArea = affectedArea;
    }

    public Priority getPriority() {
        return priority;
    }

    public void setPriority(Priority priority) {
        this.priority = priority;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public void setStatus(TicketStatus status) {
        this.status = status;
    }

    public Long getRequesterId() {
        return requesterId;
    }

    public void setRequesterId(Long requesterId) {
        this.requesterId = requesterId;
    }

    public String getRequesterEmail() {
        return requesterEmail;
    }

    public void setRequesterEmail(String requesterEmail) {
        this.requesterEmail = requesterEmail;
    }

    public String getRequesterDisplayName() {
        return requesterDisplayName;
    }

    public void setRequesterDisplayName(String requesterDisplayName) {
        this.requesterDisplayName = requesterDisplayName;
    }

    public Long getAssigneeId() {
        return assigneeId;
    }

    public void setAssigneeId(Long assigneeId) {
        this.assigneeId = assigneeId;
    }

    public String getSuggestedSolution() {
        return suggestedSolution;
    }

    public void setSuggestedSolution(String suggestedSolution) {
        this.suggestedSolution = suggestedSolution;
    }

    public byte[] getAttachment() {
        return attachment;
    }

    public void setAttachment(byte[] attachment) {
        this.attachment = attachment;
    }

    public String getAttachmentName() {
        return attachmentName;
    }

    public void setAttachmentName(String attachmentName) {
        this.attachmentName = attachmentName;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getLastModifiedAt() {
        return lastModifiedAt;
    }

    public void setLastModifiedAt(LocalDateTime lastModifiedAt) {
        this.lastModifiedAt = lastModifiedAt;
    }
}
