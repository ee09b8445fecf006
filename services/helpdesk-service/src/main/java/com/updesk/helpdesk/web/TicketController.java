package com.updesk.helpdesk.web;

import java.net.URI;

import org.springframework.data.domain.Sort;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.updesk.helpdesk.domain.Priority;
import com.updesk.helpdesk.domain.Ticket;
import com.updesk.helpdesk.domain.TicketStatus;
import com.updesk.helpdesk.security.Actor;
import com.updesk.helpdesk.service.CreationPeriod;
import com.updesk.helpdesk.service.TicketLifecycleService;
import com.updesk.helpdesk.service.TicketQueryService;
import com.updesk.helpdesk.service.TriageFilter;
import com.updesk.helpdesk.web.dto.TicketProposalRequest;
import com.updesk.helpdesk.web.dto.TicketProposalResponse;
import com.updesk.helpdesk.web.dto.TicketResponse;
import com.updesk.helpdesk.web.dto.TransferRequest;
import com.updesk.helpdesk.web.dto.TriagePageResponse;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Ticket API used by requesters (proposal and confirmation) and by agents (triage and
 * lifecycle transitions).
 */
@RestController
@RequestMapping(path = "/api/tickets", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketController {

    private final TicketLifecycleService lifecycleService;
    private final TicketQueryService queryService;
    private final TicketMapper ticketMapper;

    public TicketController(
        TicketLifecycleService lifecycleService,
        TicketQueryService queryService,
        TicketMapper ticketMapper
    ) {
        this.lifecycleService = lifecycleService;
        this.queryService = queryService;
        this.ticketMapper = ticketMapper;
    }

    @PostMapping(path = "/proposals", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketProposalResponse> propose(
        @Valid @RequestBody TicketProposalRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        return lifecycleService.propose(request, Actor.from(jwt))
            .map(ticketMapper::toProposal);
    }

    @PostMapping("/proposals/{draftId}/confirm")
    public Mono<ResponseEntity<TicketResponse>> confirm(@PathVariable Long draftId, @AuthenticationPrincipal Jwt jwt) {
        return created(lifecycleService.confirm(draftId, Actor.from(jwt)));
    }

    @PostMapping("/proposals/{draftId}/resolved-by-ai")
    public Mono<ResponseEntity<TicketResponse>> resolvedByAi(@PathVariable Long draftId, @AuthenticationPrincipal Jwt jwt) {
        return created(lifecycleService.resolveByAi(draftId, Actor.from(jwt)));
    }

    @GetMapping
    public Flux<TicketResponse> listTickets(
        @RequestParam(name = "q", required = false) String search,
        @RequestParam(name = "status", required = false) String status
    ) {
        TicketStatus statusFilter = StringUtils.hasText(status) && !"ALL".equalsIgnoreCase(status)
            ? TicketStatus.parse(status) : null;
        return queryService.listTickets(search, statusFilter)
            .map(ticketMapper::toResponse);
    }

    /**
     * Triage queue. Without a {@code status} parameter only open tickets are listed;
     * {@code status=ALL} lifts the filter.
     */
    @GetMapping("/triage")
    public Mono<TriagePageResponse> triage(
        @RequestParam(name = "q", required = false) String search,
        @RequestParam(name = "priority", required = false) String priority,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "period", required = false) String period,
        @RequestParam(name = "orderBy", required = false) String orderBy,
        @RequestParam(name = "direction", defaultValue = "ASC") String direction,
        @RequestParam(name = "page", defaultValue = "1") int page
    ) {
        return Mono.fromCallable(() -> new TriageFilter(
                search,
                StringUtils.hasText(priority) ? Priority.parse(priority) : null,
                triageStatus(status),
                CreationPeriod.parse(period),
                orderBy,
                Sort.Direction.fromString(direction),
                page))
            .flatMap(queryService::triage)
            .map(ticketMapper::toResponse);
    }

    @GetMapping("/{id}")
    public Mono<TicketResponse> getTicket(@PathVariable Long id) {
        return lifecycleService.getTicket(id)
            .map(ticketMapper::toResponse);
    }

    @PostMapping("/{id}/claim")
    public Mono<TicketResponse> claim(@PathVariable Long id, @AuthenticationPrincipal Jwt jwt) {
        return lifecycleService.claim(id, Actor.from(jwt))
            .map(ticketMapper::toResponse);
    }

    @PostMapping(path = "/{id}/transfer", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> transfer(
        @PathVariable Long id,
        @Valid @RequestBody TransferRequest request,
        @AuthenticationPrincipal Jwt jwt
    ) {
        return lifecycleService.transfer(id, request, Actor.from(jwt))
            .map(ticketMapper::toResponse);
    }

    @PostMapping("/{id}/return-to-triage")
    public Mono<TicketResponse> returnToTriage(@PathVariable Long id) {
        return lifecycleService.returnToTriage(id)
            .map(ticketMapper::toResponse);
    }

    @PostMapping("/{id}/reopen")
    public Mono<TicketResponse> reopen(@PathVariable Long id) {
        return lifecycleService.reopen(id)
            .map(ticketMapper::toResponse);
    }

    @PostMapping("/{id}/close")
    public Mono<TicketResponse> close(@PathVariable Long id) {
        return lifecycleService.close(id)
            .map(ticketMapper::toResponse);
    }

    private Mono<ResponseEntity<TicketResponse>> created(Mono<Ticket> ticket) {
        return ticket
            .map(ticketMapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/tickets/" + response.getId()))
                .body(response));
    }

    private static TicketStatus triageStatus(String status) {
        if (!StringUtils.hasText(status)) {
            return TicketStatus.OPEN;
        }
        return "ALL".equalsIgnoreCase(status) ? null : TicketStatus.parse(status);
    }
}
