package com.updesk.helpdesk.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.updesk.helpdesk.domain.TelegramMessageLink;

import reactor.core.publisher.Mono;

@Repository
public interface TelegramMessageLinkRepository extends ReactiveCrudRepository<TelegramMessageLink, Long> {

    Mono<TelegramMessageLink> findFirstByTelegramMessageIdOrderByCreatedAtDesc(Long telegramMessageId);
}
