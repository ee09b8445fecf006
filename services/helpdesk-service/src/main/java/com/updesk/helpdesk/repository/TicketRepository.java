package com.updesk.helpdesk.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.updesk.helpdesk.domain.Ticket;

/**
 * Reactive persistence gateway for tickets. Filtered listings live in
 * {@link com.updesk.helpdesk.service.TicketQueryService}, which composes criteria
 * dynamically.
 */
@Repository
public interface TicketRepository extends ReactiveCrudRepository<Ticket, Long> {

}
