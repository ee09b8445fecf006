package com.updesk.helpdesk.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.updesk.helpdesk.domain.Interaction;

import reactor.core.publisher.Flux;

/**
 * Append-only interaction log. Ties on {@code created_at} are broken by id so the
 * conversation order is stable.
 */
@Repository
public interface InteractionRepository extends ReactiveCrudRepository<Interaction, Long> {

    Flux<Interaction> findByTicketIdOrderByCreatedAtAscIdAsc(Long ticketId);
}
