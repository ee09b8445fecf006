package com.updesk.helpdesk.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.updesk.helpdesk.domain.Priority;
import com.updesk.helpdesk.domain.Ticket;
import com.updesk.helpdesk.domain.TicketDraft;
import com.updesk.helpdesk.domain.TicketStatus;
import com.updesk.helpdesk.integration.ai.AiSuggestion;
import com.updesk.helpdesk.integration.ai.AiTriageClient;
import com.updesk.helpdesk.integration.props.IntegrationProperties;
import com.updesk.helpdesk.repository.TicketDraftRepository;
import com.updesk.helpdesk.repository.TicketRepository;
import com.updesk.helpdesk.security.Actor;
import com.updesk.helpdesk.web.dto.TicketProposalRequest;
import com.updesk.helpdesk.web.dto.TransferRequest;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@DisplayName("Ticket lifecycle")
class TicketLifecycleServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-02T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 2, 12, 0);
    private static final LocalDateTime DRAFT_CUTOFF = NOW.minusHours(2);

    private static final Actor REQUESTER = new Actor(5L, "ana@example.com", "Ana");
    private static final Actor AGENT = new Actor(9L, "carlos@example.com", "Carlos");

    private TicketRepository ticketRepository;
    private TicketDraftRepository draftRepository;
    private AiTriageClient aiTriageClient;
    private TicketLifecycleService service;

    @BeforeEach
    void setUp() {
        ticketRepository = mock(TicketRepository.class);
        draftRepository = mock(TicketDraftRepository.class);
        aiTriageClient = mock(AiTriageClient.class);
        service = new TicketLifecycleService(
            ticketRepository, draftRepository, aiTriageClient, new IntegrationProperties(), CLOCK);
        when(ticketRepository.save(any(Ticket.class))).thenAnswer(invocation -> {
            Ticket ticket = invocation.getArgument(0);
            if (ticket.getId() == null) {
                ticket.setId(100L);
            }
            return Mono.just(ticket);
        });
        when(draftRepository.save(any(TicketDraft.class))).thenAnswer(invocation -> {
            TicketDraft draft = invocation.getArgument(0);
            draft.setId(11L);
            return Mono.just(draft);
        });
        when(draftRepository.delete(any(TicketDraft.class))).thenReturn(Mono.empty());
        when(draftRepository.deleteByCreatedAtBefore(any(LocalDateTime.class))).thenReturn(Mono.just(0));
    }

    private Ticket stored(TicketStatus status, Long assignee) {
        Ticket ticket = new Ticket();
        ticket.setId(1L);
        ticket.setTitle("Sem rede");
        ticket.setDescription("Cabo desconectado?");
        ticket.setPriority(Priority.MEDIUM);
        ticket.setStatus(status);
        ticket.setRequesterId(5L);
        ticket.setAssigneeId(assignee);
        ticket.setCreatedAt(NOW.minusDays(1));
        when(ticketRepository.findById(1L)).thenReturn(Mono.just(ticket));
        return ticket;
    }

    private static void assertAssigneeInvariant(Ticket ticket) {
        assertThat(ticket.getAssigneeId() != null).isEqualTo(ticket.getStatus() == TicketStatus.IN_PROGRESS);
    }

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("a proposal stores the AI classification in a draft owned by the requester")
        void shouldStoreDraft() {
            when(aiTriageClient.suggest("Sem rede", "Cabo desconectado?"))
                .thenReturn(Mono.just(new AiSuggestion("Reconecte o cabo.", Priority.HIGH)));
            TicketProposalRequest request = new TicketProposalRequest("Sem rede", "Cabo desconectado?", "TI");
            request.setAttachment(new byte[] {1, 2});
            request.setAttachmentName("../../etc/print.PNG");

            StepVerifier.create(service.propose(request, REQUESTER))
                .assertNext(draft -> {
                    assertThat(draft.getId()).isEqualTo(11L);
                    assertThat(draft.getRequesterId()).isEqualTo(5L);
                    assertThat(draft.getRequesterEmail()).isEqualTo("ana@example.com");
                    assertThat(draft.getPriority()).isEqualTo(Priority.HIGH);
                    assertThat(draft.getSuggestedSolution()).isEqualTo("Reconecte o cabo.");
                    assertThat(draft.getAttachmentName()).isEqualTo("print.PNG");
                    assertThat(draft.getCreatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an attachment with a disallowed type is dropped, the proposal proceeds")
        void shouldDropDisallowedAttachment() {
            when(aiTriageClient.suggest(anyString(), anyString()))
                .thenReturn(Mono.just(AiSuggestion.unclassified(AiTriageClient.GENERIC_FALLBACK)));
            TicketProposalRequest request = new TicketProposalRequest("Sem rede", "Cabo", null);
            request.setAttachment(new byte[] {1});
            request.setAttachmentName("virus.exe");

            StepVerifier.create(service.propose(request, REQUESTER))
                .assertNext(draft -> {
                    assertThat(draft.getAttachment()).isNull();
                    assertThat(draft.getPriority()).isEqualTo(Priority.UNCLASSIFIED);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("confirming turns the draft into an open ticket and consumes it")
        void shouldConfirmDraft() {
            TicketDraft draft = draft();
            when(draftRepository.findByIdAndRequesterIdAndCreatedAtAfter(11L, 5L, DRAFT_CUTOFF)).thenReturn(Mono.just(draft));

            StepVerifier.create(service.confirm(11L, REQUESTER))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertThat(ticket.getAssigneeId()).isNull();
                    assertThat(ticket.getPriority()).isEqualTo(Priority.HIGH);
                    assertThat(ticket.getSuggestedSolution()).isEqualTo("Reconecte o cabo.");
                    assertThat(ticket.getRequesterEmail()).isEqualTo("ana@example.com");
                    assertThat(ticket.getCreatedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
            verify(draftRepository).delete(draft);
        }

        @Test
        @DisplayName("accepting the AI answer records the ticket as resolved by AI")
        void shouldResolveByAi() {
            when(draftRepository.findByIdAndRequesterIdAndCreatedAtAfter(11L, 5L, DRAFT_CUTOFF)).thenReturn(Mono.just(draft()));

            StepVerifier.create(service.resolveByAi(11L, REQUESTER))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.RESOLVED_BY_AI);
                    assertAssigneeInvariant(ticket);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a draft of another requester is not found")
        void shouldNotConsumeForeignDraft() {
            when(draftRepository.findByIdAndRequesterIdAndCreatedAtAfter(11L, 9L, DRAFT_CUTOFF)).thenReturn(Mono.empty());

            StepVerifier.create(service.confirm(11L, AGENT))
                .expectError(TicketDraftNotFoundException.class)
                .verify();
            verify(ticketRepository, never()).save(any());
        }

        @Test
        @DisplayName("a draft past its lifetime can no longer be confirmed")
        void shouldRejectExpiredDraft() {
            when(draftRepository.findByIdAndRequesterIdAndCreatedAtAfter(11L, 5L, DRAFT_CUTOFF)).thenReturn(Mono.empty());

            StepVerifier.create(service.resolveByAi(11L, REQUESTER))
                .expectError(TicketDraftNotFoundException.class)
                .verify();
            verify(ticketRepository, never()).save(any());
        }

        @Test
        @DisplayName("a new proposal purges drafts past their lifetime")
        void shouldPurgeExpiredDraftsOnProposal() {
            when(draftRepository.deleteByCreatedAtBefore(DRAFT_CUTOFF)).thenReturn(Mono.just(3));
            when(aiTriageClient.suggest(anyString(), anyString()))
                .thenReturn(Mono.just(new AiSuggestion("Reinicie.", Priority.LOW)));

            StepVerifier.create(service.propose(new TicketProposalRequest("Sem rede", "Cabo", null), REQUESTER))
                .assertNext(draft -> assertThat(draft.getId()).isEqualTo(11L))
                .verifyComplete();
            verify(draftRepository).deleteByCreatedAtBefore(DRAFT_CUTOFF);
        }

        private TicketDraft draft() {
            TicketDraft draft = new TicketDraft();
            draft.setId(11L);
            draft.setRequesterId(5L);
            draft.setRequesterEmail("ana@example.com");
            draft.setTitle("Sem rede");
            draft.setDescription("Cabo desconectado?");
            draft.setPriority(Priority.HIGH);
            draft.setSuggestedSolution("Reconecte o cabo.");
            draft.setCreatedAt(NOW.minusMinutes(2));
            return draft;
        }
    }

    @Nested
    @DisplayName("transitions")
    class Transitions {

        @Test
        @DisplayName("claiming assigns the agent and marks the ticket in progress")
        void shouldClaim() {
            stored(TicketStatus.OPEN, null);

            StepVerifier.create(service.claim(1L, AGENT))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
                    assertThat(ticket.getAssigneeId()).isEqualTo(9L);
                    assertThat(ticket.getLastModifiedAt()).isEqualTo(NOW);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("returning to triage twice leaves the same state")
        void shouldReturnToTriageIdempotently() {
            stored(TicketStatus.IN_PROGRESS, 9L);

            StepVerifier.create(service.returnToTriage(1L).then(service.returnToTriage(1L)))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertThat(ticket.getAssigneeId()).isNull();
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("closing resolves the ticket and clears the assignee")
        void shouldCloseAndClearAssignee() {
            stored(TicketStatus.IN_PROGRESS, 9L);

            StepVerifier.create(service.close(1L))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.RESOLVED);
                    assertAssigneeInvariant(ticket);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("reopening a resolved ticket puts it back in triage")
        void shouldReopen() {
            stored(TicketStatus.RESOLVED, null);

            StepVerifier.create(service.reopen(1L))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertAssigneeInvariant(ticket);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("transferring to triage with a priority override")
        void shouldTransferToTriage() {
            stored(TicketStatus.IN_PROGRESS, 9L);

            StepVerifier.create(service.transfer(1L, new TransferRequest(TransferRequest.Destination.TRIAGE, "Baixa"), AGENT))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
                    assertThat(ticket.getPriority()).isEqualTo(Priority.LOW);
                    assertAssigneeInvariant(ticket);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("transferring to an agent assigns the caller and keeps the priority")
        void shouldTransferToAgent() {
            stored(TicketStatus.OPEN, null);

            StepVerifier.create(service.transfer(1L, new TransferRequest(TransferRequest.Destination.AGENT, null), AGENT))
                .assertNext(ticket -> {
                    assertThat(ticket.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
                    assertThat(ticket.getAssigneeId()).isEqualTo(9L);
                    assertThat(ticket.getPriority()).isEqualTo(Priority.MEDIUM);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("an unknown priority on transfer is rejected without saving")
        void shouldRejectUnknownPriority() {
            stored(TicketStatus.OPEN, null);

            StepVerifier.create(service.transfer(1L, new TransferRequest(TransferRequest.Destination.TRIAGE, "urgente"), AGENT))
                .expectError(IllegalArgumentException.class)
                .verify();
            verify(ticketRepository, never()).save(any());
        }

        @Test
        @DisplayName("transitions on a missing ticket fail with not found")
        void shouldFailForMissingTicket() {
            when(ticketRepository.findById(404L)).thenReturn(Mono.empty());

            StepVerifier.create(service.claim(404L, AGENT))
                .expectError(TicketNotFoundException.class)
                .verify();
        }

        @Test
        @DisplayName("every transition keeps the assignee set exactly while in progress")
        void shouldKeepInvariantAcrossSequence() {
            Ticket ticket = stored(TicketStatus.OPEN, null);

            service.claim(1L, AGENT).block();
            assertAssigneeInvariant(ticket);
            service.returnToTriage(1L).block();
            assertAssigneeInvariant(ticket);
            service.transfer(1L, new TransferRequest(TransferRequest.Destination.AGENT, "Alta"), AGENT).block();
            assertAssigneeInvariant(ticket);
            service.close(1L).block();
            assertAssigneeInvariant(ticket);
            service.reopen(1L).block();
            assertAssigneeInvariant(ticket);

            verify(ticketRepository, times(5)).save(any(Ticket.class));
        }
    }
}
