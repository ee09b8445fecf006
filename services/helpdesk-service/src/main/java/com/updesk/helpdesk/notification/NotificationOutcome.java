package com.updesk.helpdesk.notification;

/**
 * What happened on each notification leg. {@link DeliveryState#SKIPPED} covers both a
 * missing configuration and a leg that does not apply (no recipient e-mail); only
 * {@link DeliveryState#FAILED} counts as a failure.
 */
public record NotificationOutcome(DeliveryState telegram, DeliveryState email) {

    public enum DeliveryState {
        DELIVERED,
        SKIPPED,
        FAILED
    }

    public boolean hasFailures() {
        return telegram == DeliveryState.FAILED || email == DeliveryState.FAILED;
    }
}
