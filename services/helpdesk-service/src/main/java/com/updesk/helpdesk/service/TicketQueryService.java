package com.updesk.helpdesk.service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.updesk.helpdesk.domain.Ticket;
import com.updesk.helpdesk.domain.TicketStatus;
import com.updesk.helpdesk.integration.props.IntegrationProperties;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only queries over tickets: the general listing and the triage queue with its
 * counters. Nothing here is stored; every figure is derived at query time.
 */
@Service
public class TicketQueryService {

    private final R2dbcEntityTemplate template;
    private final Clock clock;
    private final int pageSize;

    public TicketQueryService(R2dbcEntityTemplate template, IntegrationProperties integrationProperties, Clock clock) {
        this.template = template;
        this.clock = clock;
        this.pageSize = integrationProperties.getTriage().getPageSize();
    }

    /**
     * All tickets, newest first, optionally narrowed by a title search and a status.
     */
    public Flux<Ticket> listTickets(String search, TicketStatus status) {
        List<Criteria> parts = new ArrayList<>();
        if (StringUtils.hasText(search)) {
            parts.add(titleContains(search.trim()));
        }
        if (status != null) {
            parts.add(Criteria.where("status").is(status.name()));
        }
        Query query = Query.query(Criteria.from(parts))
            .sort(Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));
        return template.select(query, Ticket.class);
    }

    public Mono<TriagePage> triage(TriageFilter filter) {
        Criteria criteria = triageCriteria(filter);
        Query pageQuery = Query.query(criteria)
            .sort(filter.sort())
            .limit(pageSize)
            .offset((long) (filter.page() - 1) * pageSize);

        return Mono.zip(
                template.select(pageQuery, Ticket.class).collectList(),
                template.count(Query.query(criteria), Ticket.class),
                counters())
            .map(result -> new TriagePage(result.getT1(), filter.page(), pageSize, result.getT2(), result.getT3()));
    }

    public Mono<TriageCounters> counters() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime startOfDay = now.toLocalDate().atStartOfDay();

        Mono<Long> awaiting = template.count(
            Query.query(Criteria.where("status").is(TicketStatus.OPEN.name())), Ticket.class);
        Mono<Long> triagedToday = template.count(
            Query.query(Criteria.where("status").is(TicketStatus.IN_PROGRESS.name())
                .and("lastModifiedAt").isNotNull()
                .and("lastModifiedAt").greaterThanOrEquals(startOfDay)), Ticket.class);
        Mono<Long> stale = template.count(
            Query.query(Criteria.where("status").is(TicketStatus.OPEN.name())
                .and("createdAt").lessThanOrEquals(now.minusHours(24))), Ticket.class);

        return Mono.zip(awaiting, triagedToday, stale)
            .map(counts -> new TriageCounters(counts.getT1(), counts.getT2(), counts.getT3()));
    }

    private Criteria triageCriteria(TriageFilter filter) {
        List<Criteria> parts = new ArrayList<>();
        if (StringUtils.hasText(filter.search())) {
            String search = filter.search().trim();
            parts.add(isNumeric(search) ? Criteria.where("id").is(Long.parseLong(search)) : titleContains(search));
        }
        if (filter.priority() != null) {
            parts.add(Criteria.where("priority").is(filter.priority().name()));
        }
        if (filter.status() != null) {
            parts.add(Criteria.where("status").is(filter.status().name()));
        }
        filter.period().lowerBound(LocalDateTime.now(clock))
            .ifPresent(bound -> parts.add(Criteria.where("createdAt").greaterThanOrEquals(bound)));
        return Criteria.from(parts);
    }

    private static Criteria titleContains(String search) {
        String escaped = search.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        return Criteria.where("title").like("%" + escaped + "%").ignoreCase(true);
    }

    private static boolean isNumeric(String value) {
        return value.length() <= 18 && value.chars().allMatch(Character::isDigit);
    }
}
