package com.updesk.helpdesk.web.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Payload for moving a ticket back to triage or onto the calling agent, optionally
 * overriding its priority.
 */
public class TransferRequest {

    public enum Destination {
        TRIAGE,
        AGENT
    }

    @NotNull
    private Destination destination;

    private String priority;

    public TransferRequest() {
    }

    public TransferRequest(Destination destination, String priority) {
        this.destination = destination;
        this.priority = priority;
    }

    public Destination getDestination() {
        return destination;
    }

    public void setDestination(Destination destination) {
        this.destination = destination;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(String priority) {
        this.priority = priority;
    }
}
