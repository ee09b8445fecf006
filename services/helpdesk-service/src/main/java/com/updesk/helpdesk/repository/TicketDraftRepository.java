package com.updesk.helpdesk.repository;

import java.time.LocalDateTime;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.updesk.helpdesk.domain.TicketDraft;

import reactor.core.publisher.Mono;

@Repository
public interface TicketDraftRepository extends ReactiveCrudRepository<TicketDraft, Long> {

    /**
     * Finds a draft of {@code requesterId} created after {@code cutoff}; expired and
     * foreign drafts are not returned.
     */
    Mono<TicketDraft> findByIdAndRequesterIdAndCreatedAtAfter(Long id, Long requesterId, LocalDateTime cutoff);

    Mono<Integer> deleteByCreatedAtBefore(LocalDateTime cutoff);
}
