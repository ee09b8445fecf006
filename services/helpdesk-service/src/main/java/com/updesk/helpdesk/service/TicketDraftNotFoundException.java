package com.updesk.helpdesk.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The draft does not exist, was already consumed, or belongs to another requester.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TicketDraftNotFoundException extends RuntimeException {

    public TicketDraftNotFoundException(Long id) {
        super("Ticket draft with id %d not found".formatted(id));
    }
}
