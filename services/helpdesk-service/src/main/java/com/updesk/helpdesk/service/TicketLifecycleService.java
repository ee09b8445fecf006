package com.updesk.helpdesk.service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.updesk.helpdesk.domain.Priority;
import com.updesk.helpdesk.domain.Ticket;
import com.updesk.helpdesk.domain.TicketDraft;
import com.updesk.helpdesk.domain.TicketStatus;
import com.updesk.helpdesk.integration.ai.AiTriageClient;
import com.updesk.helpdesk.integration.props.IntegrationProperties;
import com.updesk.helpdesk.repository.TicketDraftRepository;
import com.updesk.helpdesk.repository.TicketRepository;
import com.updesk.helpdesk.security.Actor;
import com.updesk.helpdesk.web.dto.TicketProposalRequest;
import com.updesk.helpdesk.web.dto.TransferRequest;

import reactor.core.publisher.Mono;

/**
 * Drives tickets through their lifecycle.
 *
 * <p>Creation is two-phase: {@link #propose} consults the AI and stores a draft,
 * {@link #confirm} or {@link #resolveByAi} turn the draft into a ticket. Agent
 * transitions accept any current status (closing a closed ticket or claiming a claimed
 * one is allowed) and always leave the assignee set exactly while the ticket is in
 * progress. Each transition is saved as one transaction.</p>
 */
@Service
public class TicketLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TicketLifecycleService.class);

    private final TicketRepository ticketRepository;
    private final TicketDraftRepository draftRepository;
    private final AiTriageClient aiTriageClient;
    private final IntegrationProperties.AttachmentProperties attachmentProperties;
    private final Duration draftTtl;
    private final Clock clock;

    public TicketLifecycleService(
        TicketRepository ticketRepository,
        TicketDraftRepository draftRepository,
        AiTriageClient aiTriageClient,
        IntegrationProperties integrationProperties,
        Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.draftRepository = draftRepository;
        this.aiTriageClient = aiTriageClient;
        this.attachmentProperties = integrationProperties.getAttachments();
        this.draftTtl = integrationProperties.getTriage().getDraftTtl();
        this.clock = clock;
    }

    /**
     * Runs the AI consultation and keeps the result as a draft owned by {@code requester}.
     * Never fails because of the AI provider. Drafts past their lifetime are purged first.
     */
    public Mono<TicketDraft> propose(TicketProposalRequest request, Actor requester) {
        return purgeExpiredDrafts()
            .then(aiTriageClient.suggest(request.getTitle(), request.getDescription()))
            .flatMap(suggestion -> {
                TicketDraft draft = new TicketDraft();
                draft.setRequesterId(requester.userId());
                draft.setRequesterEmail(requester.email());
                draft.setRequesterDisplayName(requester.displayName());
                draft.setTitle(request.getTitle());
                draft.setDescription(request.getDescription());
                draft.setAffectedArea(request.getAffectedArea());
                draft.setPriority(suggestion.priority());
                draft.setSuggestedSolution(suggestion.solution());
                applyAttachment(draft, request);
                draft.setCreatedAt(now());
                return draftRepository.save(draft);
            })
            .doOnNext(draft -> log.info("Draft {} proposed by user {} with priority {}",
                draft.getId(), requester.userId(), draft.getPriority()));
    }

    /**
     * The requester still wants a human: opens the ticket in the triage queue.
     */
    @Transactional
    public Mono<Ticket> confirm(Long draftId, Actor requester) {
        return createFromDraft(draftId, requester, TicketStatus.OPEN);
    }

    /**
     * The requester accepted the AI answer: the ticket is recorded as already resolved.
     */
    @Transactional
    public Mono<Ticket> resolveByAi(Long draftId, Actor requester) {
        return createFromDraft(draftId, requester, TicketStatus.RESOLVED_BY_AI);
    }

    public Mono<Ticket> getTicket(Long id) {
        return ticketRepository.findById(id)
            .switchIfEmpty(Mono.error(new TicketNotFoundException(id)));
    }

    /**
     * Takes a ticket out of triage and assigns it to the calling agent.
     */
    @Transactional
    public Mono<Ticket> claim(Long id, Actor agent) {
        return transition(id, "claim", ticket -> ticket.assignTo(agent.userId(), now()));
    }

    @Transactional
    public Mono<Ticket> transfer(Long id, TransferRequest request, Actor agent) {
        return Mono.defer(() -> {
            Priority override = StringUtils.hasText(request.getPriority()) ? Priority.parse(request.getPriority()) : null;
            return transition(id, "transfer to " + request.getDestination(), ticket -> {
                if (override != null) {
                    ticket.setPriority(override);
                }
                if (request.getDestination() == TransferRequest.Destination.TRIAGE) {
                    ticket.returnToTriage(now());
                } else {
                    ticket.assignTo(agent.userId(), now());
                }
            });
        });
    }

    @Transactional
    public Mono<Ticket> returnToTriage(Long id) {
        return transition(id, "return to triage", ticket -> ticket.returnToTriage(now()));
    }

    @Transactional
    public Mono<Ticket> reopen(Long id) {
        return transition(id, "reopen", ticket -> ticket.returnToTriage(now()));
    }

    @Transactional
    public Mono<Ticket> close(Long id) {
        return transition(id, "close", ticket -> ticket.resolve(now()));
    }

    private Mono<Ticket> transition(Long id, String name, Consumer<Ticket> change) {
        return getTicket(id)
            .flatMap(ticket -> {
                TicketStatus before = ticket.getStatus();
                change.accept(ticket);
                return ticketRepository.save(ticket)
                    .doOnNext(saved -> log.info("Ticket {} {}: {} -> {} (assignee {})",
                        saved.getId(), name, before, saved.getStatus(), saved.getAssigneeId()));
            });
    }

    private Mono<Ticket> createFromDraft(Long draftId, Actor requester, TicketStatus initialStatus) {
        return draftRepository.findByIdAndRequesterIdAndCreatedAtAfter(draftId, requester.userId(), draftCutoff())
            .switchIfEmpty(Mono.error(new TicketDraftNotFoundException(draftId)))
            .flatMap(draft -> ticketRepository.save(Ticket.fromDraft(draft, initialStatus, now()))
                .flatMap(ticket -> draftRepository.delete(draft).thenReturn(ticket)))
            .doOnNext(ticket -> log.info("Ticket {} created from draft {} as {}",
                ticket.getId(), draftId, ticket.getStatus()));
    }

    private Mono<Integer> purgeExpiredDrafts() {
        return draftRepository.deleteByCreatedAtBefore(draftCutoff())
            .doOnNext(purged -> {
                if (purged > 0) {
                    log.info("Purged {} expired ticket drafts", purged);
                }
            });
    }

    private LocalDateTime draftCutoff() {
        return now().minus(draftTtl);
    }

    private void applyAttachment(TicketDraft draft, TicketProposalRequest request) {
        byte[] content = request.getAttachment();
        if (content == null || content.length == 0) {
            return;
        }
        String filename = StringUtils.getFilename(StringUtils.cleanPath(
            request.getAttachmentName() == null ? "" : request.getAttachmentName()));
        if (!attachmentProperties.isAllowed(filename)) {
            log.warn("Attachment '{}' has a disallowed type; dropping it", request.getAttachmentName());
            return;
        }
        draft.setAttachment(content);
        draft.setAttachmentName(filename);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
