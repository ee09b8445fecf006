package com.updesk.helpdesk.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload received when a user starts opening a ticket. The attachment travels as
 * base64 in JSON.
 */
public class TicketProposalRequest {

    @NotBlank
    @Size(max = 255)
    private String title;

    @NotBlank
    private String description;

    @Size(max = 100)
    private String affectedArea;

    @Size(max = 255)
    private String attachmentName;

    private byte[] attachment;

    public TicketProposalRequest() {
    }

    public TicketProposalRequest(String title, String description, String affectedArea) {
        this.title = title;
        this.description = description;
        this.affectedArea = affectedArea;
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

    public String getAttachmentName() {
        return attachmentName;
    }

    public void setAttachmentName(String attachmentName) {
        this.attachmentName = attachmentName;
    }

    public byte[] getAttachment() {
        return attachment;
    }

    public void setAttachment(byte[] attachment) {
        this.attachment = attachment;
    }
}
