package com.seat.exchange.service;

import com.seat.exchange.config.Beans;
import com.seat.exchange.dto.ConfirmationResponse;
import com.seat.exchange.dto.ExchangeActionResponse;
import com.seat.exchange.dto.ExchangeProposal;
import com.seat.exchange.dto.RequestsResponse;
import com.seat.exchange.dto.SeatInfo;
import com.seat.exchange.dto.SendExchangeRequest;
import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.dto.enums.ExchangeStatus;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.BadRequestException;
import com.seat.exchange.exceptions.ForbiddenException;
import com.seat.exchange.exceptions.ResourceNotFoundException;
import com.seat.exchange.models.AppUser;
import com.seat.exchange.models.ExchangeRequest;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.repo.ExchangeRequestRepository;
import com.seat.exchange.repo.TicketRepository;
import com.seat.exchange.repo.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.support.TransactionOperations;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.seat.exchange.TestFixtures.DATE;
import static com.seat.exchange.TestFixtures.TRAIN;
import static com.seat.exchange.TestFixtures.passenger;
import static com.seat.exchange.TestFixtures.ticket;
import static com.seat.exchange.TestFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExchangeServiceImplTest {

    private final UUID requesterId = UUID.randomUUID();
    private final UUID targetId = UUID.randomUUID();

    private ExchangeRequestRepository exchangeRequestRepository;
    private TicketRepository ticketRepository;
    private UserRepository userRepository;
    private SimpleMeterRegistry meterRegistry;
    private ExchangeServiceImpl service;

    private AppUser requester;
    private AppUser target;
    private final Map<UUID, Integer> exchangeCounts = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() {
        exchangeRequestRepository = mock(ExchangeRequestRepository.class);
        ticketRepository = mock(TicketRepository.class);
        userRepository = mock(UserRepository.class);
        meterRegistry = new SimpleMeterRegistry();
        service = new ExchangeServiceImpl(exchangeRequestRepository, ticketRepository, userRepository,
                TransactionOperations.withoutTransaction(), new Beans().optimisticLockRetryTemplate(), meterRegistry);

        requester = user(requesterId, "Asha");
        target = user(targetId, "Ravi");
        when(userRepository.findById(requesterId)).thenReturn(Optional.of(requester));
        when(userRepository.findById(targetId)).thenReturn(Optional.of(target));
        when(userRepository.findAllById(anyIterable())).thenReturn(List.of(requester, target));
        when(userRepository.incrementTotalExchanges(anyCollection(), any(LocalDateTime.class))).thenAnswer(inv -> {
            Collection<UUID> ids = inv.getArgument(0);
            ids.forEach(id -> exchangeCounts.merge(id, 1, Integer::sum));
            return ids.size();
        });
        when(exchangeRequestRepository.save(any(ExchangeRequest.class))).thenAnswer(inv -> inv.getArgument(0));
        when(exchangeRequestRepository.saveAndFlush(any(ExchangeRequest.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private int exchangesOf(UUID userId) {
        return exchangeCounts.getOrDefault(userId, 0);
    }

    private ExchangeRequest stored(ExchangeStatus status) {
        return stored(status, targetId);
    }

    private ExchangeRequest stored(ExchangeStatus status, UUID targetUserId) {
        ExchangeRequest request = ExchangeRequest.builder()
                .id(UUID.randomUUID())
                .requesterId(requesterId)
                .requesterTicketId(UUID.randomUUID())
                .targetUserId(targetUserId)
                .targetTicketId(UUID.randomUUID())
                .trainNumber(TRAIN)
                .travelDate(DATE)
                .proposal(new ExchangeProposal(List.of(seat(10)), List.of(seat(11)), 40))
                .status(status)
                .build();
        when(exchangeRequestRepository.findById(request.getId())).thenReturn(Optional.of(request));
        return request;
    }

    private static SeatInfo seat(int number) {
        return SeatInfo.builder().coach("B2").seatNumber(number).berthType(BerthType.LB).build();
    }

    @Test
    void requesterOnlyConfirmationLeavesRequestAccepted() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);

        ConfirmationResponse response = service.confirm(request.getId(), requesterId);

        assertThat(response.getStatus()).isEqualTo(ExchangeStatus.ACCEPTED);
        assertThat(response.isRequesterConfirmed()).isTrue();
        assertThat(response.isTargetConfirmed()).isFalse();
        assertThat(exchangesOf(requesterId)).isZero();
        assertThat(exchangesOf(targetId)).isZero();
        verify(userRepository, never()).incrementTotalExchanges(anyCollection(), any());
    }

    @Test
    void secondConfirmationCompletesAndCountsOnce() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);

        service.confirm(request.getId(), requesterId);
        ConfirmationResponse completed = service.confirm(request.getId(), targetId);

        assertThat(completed.getStatus()).isEqualTo(ExchangeStatus.COMPLETED);
        assertThat(exchangesOf(requesterId)).isEqualTo(1);
        assertThat(exchangesOf(targetId)).isEqualTo(1);
        assertThat(meterRegistry.counter("exchange_completed_total").count()).isEqualTo(1.0);
    }

    @Test
    void confirmingACompletedRequestIsANoOp() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);
        service.confirm(request.getId(), requesterId);
        service.confirm(request.getId(), targetId);

        ConfirmationResponse again = service.confirm(request.getId(), targetId);
        service.confirm(request.getId(), requesterId);

        assertThat(again.getMessage()).isEqualTo("Exchange already completed");
        assertThat(again.getStatus()).isEqualTo(ExchangeStatus.COMPLETED);
        assertThat(exchangesOf(requesterId)).isEqualTo(1);
        assertThat(exchangesOf(targetId)).isEqualTo(1);
        verify(userRepository, times(1)).incrementTotalExchanges(anyCollection(), any());
    }

    @Test
    void concurrentConfirmationsCompleteExactlyOnce() throws Exception {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ConfirmationResponse>> futures = List.of(
                    pool.submit(() -> { start.await(); return service.confirm(request.getId(), requesterId); }),
                    pool.submit(() -> { start.await(); return service.confirm(request.getId(), targetId); }),
                    pool.submit(() -> { start.await(); return service.confirm(request.getId(), requesterId); }),
                    pool.submit(() -> { start.await(); return service.confirm(request.getId(), targetId); }));
            start.countDown();
            for (Future<ConfirmationResponse> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.COMPLETED);
        assertThat(exchangesOf(requesterId)).isEqualTo(1);
        assertThat(exchangesOf(targetId)).isEqualTo(1);
    }

    @Test
    void completionsSharingAUserCountEachExchange() throws Exception {
        UUID thirdId = UUID.randomUUID();
        ExchangeRequest first = stored(ExchangeStatus.ACCEPTED);
        ExchangeRequest second = stored(ExchangeStatus.ACCEPTED, thirdId);
        service.confirm(first.getId(), targetId);
        service.confirm(second.getId(), thirdId);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<ConfirmationResponse>> futures = List.of(
                    pool.submit(() -> { start.await(); return service.confirm(first.getId(), requesterId); }),
                    pool.submit(() -> { start.await(); return service.confirm(second.getId(), requesterId); }));
            start.countDown();
            for (Future<ConfirmationResponse> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(ExchangeStatus.COMPLETED);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(exchangesOf(requesterId)).isEqualTo(2);
        assertThat(exchangesOf(targetId)).isEqualTo(1);
        assertThat(exchangesOf(thirdId)).isEqualTo(1);
        verify(userRepository).incrementTotalExchanges(eq(List.of(requesterId, targetId)), any());
        verify(userRepository).incrementTotalExchanges(eq(List.of(requesterId, thirdId)), any());
    }

    @Test
    void versionConflictIsRetriedInAFreshAttempt() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);
        when(exchangeRequestRepository.saveAndFlush(any(ExchangeRequest.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(ExchangeRequest.class, request.getId()))
                .thenAnswer(inv -> inv.getArgument(0));

        ConfirmationResponse response = service.confirm(request.getId(), requesterId);

        assertThat(response.getMessage()).isEqualTo("Confirmation recorded");
        assertThat(response.isRequesterConfirmed()).isTrue();
        verify(exchangeRequestRepository, times(2)).saveAndFlush(request);
    }

    @Test
    void persistentVersionConflictGivesUpAfterThreeAttempts() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);
        when(exchangeRequestRepository.saveAndFlush(any(ExchangeRequest.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(ExchangeRequest.class, request.getId()));

        assertThatThrownBy(() -> service.confirm(request.getId(), requesterId))
                .isInstanceOf(OptimisticLockingFailureException.class);
        verify(exchangeRequestRepository, times(3)).saveAndFlush(request);
        verify(userRepository, never()).incrementTotalExchanges(anyCollection(), any());
    }

    @Test
    void confirmRejectsOutsidersAndUnknownRequests() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);

        assertThatThrownBy(() -> service.confirm(request.getId(), UUID.randomUUID()))
                .isInstanceOf(ForbiddenException.class);
        assertThatThrownBy(() -> service.confirm(UUID.randomUUID(), requesterId))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void confirmRequiresAcceptedRequest() {
        ExchangeRequest request = stored(ExchangeStatus.PENDING);

        assertThatThrownBy(() -> service.confirm(request.getId(), requesterId))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Cannot confirm request with status: pending");
    }

    @Test
    void acceptMovesPendingToAccepted() {
        ExchangeRequest request = stored(ExchangeStatus.PENDING);

        ExchangeActionResponse response = service.accept(request.getId(), targetId);

        assertThat(response.getStatus()).isEqualTo(ExchangeStatus.ACCEPTED);
        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.ACCEPTED);
    }

    @Test
    void acceptNamesCurrentStatusWhenNotPending() {
        ExchangeRequest request = stored(ExchangeStatus.DECLINED);

        assertThatThrownBy(() -> service.accept(request.getId(), targetId))
                .isInstanceOf(BadRequestException.class)
                .hasMessage("Cannot accept request with status: declined");
    }

    @Test
    void onlyTargetMayAccept() {
        ExchangeRequest request = stored(ExchangeStatus.PENDING);

        assertThatThrownBy(() -> service.accept(request.getId(), requesterId))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.PENDING);
    }

    @Test
    void repeatedDeclineIsIdempotent() {
        ExchangeRequest request = stored(ExchangeStatus.PENDING);

        service.decline(request.getId(), targetId);
        ExchangeActionResponse second = service.decline(request.getId(), targetId);

        assertThat(second.getStatus()).isEqualTo(ExchangeStatus.DECLINED);
        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.DECLINED);
        verify(exchangeRequestRepository, times(1)).save(request);
    }

    @Test
    void acceptedRequestCanStillBeDeclined() {
        ExchangeRequest request = stored(ExchangeStatus.ACCEPTED);

        service.decline(request.getId(), targetId);

        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.DECLINED);
    }

    @Test
    void completedRequestCannotBeDeclined() {
        ExchangeRequest request = stored(ExchangeStatus.COMPLETED);

        assertThatThrownBy(() -> service.decline(request.getId(), targetId))
                .isInstanceOf(BadRequestException.class);
        assertThat(request.getStatus()).isEqualTo(ExchangeStatus.COMPLETED);
    }

    @Test
    void createStoresPendingRequestForSharedTrip() {
        Ticket targetTicket = ticket(targetId, passenger("B2", 11, BerthType.LB));
        Ticket requesterTicket = ticket(requesterId, passenger("B2", 10, BerthType.UB));
        when(ticketRepository.findById(targetTicket.getId())).thenReturn(Optional.of(targetTicket));
        when(ticketRepository.findFirstByUserIdAndTrainNumberAndTravelDateAndStatus(
                requesterId, TRAIN, DATE, TicketStatus.ACTIVE)).thenReturn(Optional.of(requesterTicket));

        service.create(requesterId, sendRequest(targetTicket.getId()));

        ArgumentCaptor<ExchangeRequest> captor = ArgumentCaptor.forClass(ExchangeRequest.class);
        verify(exchangeRequestRepository).save(captor.capture());
        ExchangeRequest saved = captor.getValue();
        assertThat(saved.getStatus()).isEqualTo(ExchangeStatus.PENDING);
        assertThat(saved.isRequesterConfirmed()).isFalse();
        assertThat(saved.isTargetConfirmed()).isFalse();
        assertThat(saved.getRequesterTicketId()).isEqualTo(requesterTicket.getId());
        assertThat(saved.getTrainNumber()).isEqualTo(TRAIN);
    }

    @Test
    void createRequiresRequesterTicketOnSameTrip() {
        Ticket targetTicket = ticket(targetId, passenger("B2", 11, BerthType.LB));
        when(ticketRepository.findById(targetTicket.getId())).thenReturn(Optional.of(targetTicket));
        when(ticketRepository.findFirstByUserIdAndTrainNumberAndTravelDateAndStatus(
                requesterId, TRAIN, DATE, TicketStatus.ACTIVE)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.create(requesterId, sendRequest(targetTicket.getId())))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("active ticket");
    }

    @Test
    void createRejectsSelfRequestsAndMissingTargets() {
        Ticket targetTicket = ticket(targetId, passenger("B2", 11, BerthType.LB));
        when(ticketRepository.findById(targetTicket.getId())).thenReturn(Optional.of(targetTicket));

        assertThatThrownBy(() -> service.create(targetId, sendRequest(targetTicket.getId())))
                .isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> service.create(requesterId, sendRequest(UUID.randomUUID())))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listCarriesOtherPartyOrNull() {
        ExchangeRequest received = stored(ExchangeStatus.PENDING);
        when(exchangeRequestRepository.findByTargetUserIdOrderByCreatedAtDesc(targetId)).thenReturn(List.of(received));
        when(exchangeRequestRepository.findByRequesterIdOrderByCreatedAtDesc(targetId)).thenReturn(List.of());
        when(userRepository.findAllById(anyIterable())).thenReturn(List.of());

        RequestsResponse response = service.list(targetId);

        assertThat(response.getReceived()).singleElement()
                .satisfies(v -> assertThat(v.getOtherParty()).isNull());
        assertThat(response.getSent()).isEmpty();
    }

    private SendExchangeRequest sendRequest(UUID targetTicketId) {
        return SendExchangeRequest.builder()
                .targetUserId(targetId)
                .targetTicketId(targetTicketId)
                .give(List.of(seat(10)))
                .receive(List.of(seat(11)))
                .improvementScore(35)
                .message("Swap so we sit together?")
                .build();
    }
}
