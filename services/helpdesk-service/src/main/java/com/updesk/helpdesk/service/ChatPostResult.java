package com.updesk.helpdesk.service;

import com.updesk.helpdesk.domain.Interaction;
import com.updesk.helpdesk.notification.NotificationOutcome;

/**
 * A stored chat message together with what happened on the notification side channels.
 */
public record ChatPostResult(Interaction interaction, NotificationOutcome notification) {

    public boolean notificationFailed() {
        return notification.hasFailures();
    }
}
