package com.seat.exchange.service;

import com.google.common.util.concurrent.Striped;
import com.seat.exchange.dto.ConfirmationResponse;
import com.seat.exchange.dto.ExchangeActionResponse;
import com.seat.exchange.dto.ExchangeProposal;
import com.seat.exchange.dto.ExchangeRequestView;
import com.seat.exchange.dto.PartySummary;
import com.seat.exchange.dto.RequestsResponse;
import com.seat.exchange.dto.SendExchangeRequest;
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
import com.seat.exchange.utils.basic.DefaultValuesPopulator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class ExchangeServiceImpl implements ExchangeService {
    private final ExchangeRequestRepository exchangeRequestRepository;
    private final TicketRepository ticketRepository;
    private final UserRepository userRepository;
    private final TransactionOperations transactionOperations;
    private final RetryTemplate retryTemplate;
    private final MeterRegistry meterRegistry;
    private final Striped<Lock> requestLocks = Striped.lazyWeakLock(64);

    public ExchangeServiceImpl(
            ExchangeRequestRepository exchangeRequestRepository,
            TicketRepository ticketRepository,
            UserRepository userRepository,
            TransactionOperations transactionOperations,
            @Qualifier("optimisticLockRetryTemplate") RetryTemplate retryTemplate,
            MeterRegistry meterRegistry
    ) {
        this.exchangeRequestRepository = exchangeRequestRepository;
        this.ticketRepository = ticketRepository;
        this.userRepository = userRepository;
        this.transactionOperations = transactionOperations;
        this.retryTemplate = retryTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    @Transactional
    public ExchangeActionResponse create(UUID requesterId, SendExchangeRequest request) {
        AppUser target = userRepository.findById(request.getTargetUserId())
                .orElseThrow(() -> new ResourceNotFoundException("Target user not found"));
        Ticket targetTicket = ticketRepository.findById(request.getTargetTicketId())
                .filter(t -> t.getUserId().equals(target.getId()))
                .orElseThrow(() -> new ResourceNotFoundException("Target ticket not found"));

        if (requesterId.equals(target.getId())) {
            throw new BadRequestException("Cannot send an exchange request to yourself");
        }
        if (request.getGive() == null || request.getGive().isEmpty()
                || request.getReceive() == null || request.getReceive().isEmpty()) {
            throw new BadRequestException("Proposal must give and receive at least one seat");
        }

        Ticket requesterTicket = resolveRequesterTicket(requesterId, request.getRequesterTicketId(), targetTicket);

        ExchangeRequest saved = exchangeRequestRepository.save(ExchangeRequest.builder()
                .requesterId(requesterId)
                .requesterTicketId(requesterTicket.getId())
                .targetUserId(target.getId())
                .targetTicketId(targetTicket.getId())
                .trainNumber(targetTicket.getTrainNumber())
                .travelDate(targetTicket.getTravelDate())
                .proposal(new ExchangeProposal(request.getGive(), request.getReceive(), request.getImprovementScore()))
                .message(request.getMessage())
                .status(ExchangeStatus.PENDING)
                .createdAt(DefaultValuesPopulator.getCurrentTimestamp())
                .updatedAt(DefaultValuesPopulator.getCurrentTimestamp())
                .build());

        log.info("Exchange request created: requestId={}, requesterId={}, targetUserId={}, trainNumber={}, travelDate={}",
                saved.getId(), requesterId, target.getId(), saved.getTrainNumber(), saved.getTravelDate());
        return ExchangeActionResponse.builder()
                .message("Exchange request sent successfully")
                .requestId(saved.getId())
                .status(saved.getStatus())
                .build();
    }

    private Ticket resolveRequesterTicket(UUID requesterId, UUID requesterTicketId, Ticket targetTicket) {
        if (requesterTicketId == null) {
            return ticketRepository.findFirstByUserIdAndTrainNumberAndTravelDateAndStatus(
                            requesterId, targetTicket.getTrainNumber(), targetTicket.getTravelDate(), TicketStatus.ACTIVE)
                    .orElseThrow(() -> new BadRequestException("You don't have an active ticket for this train and date"));
        }
        return ticketRepository.findById(requesterTicketId)
                .filter(t -> t.getUserId().equals(requesterId))
                .filter(t -> t.getStatus() == TicketStatus.ACTIVE)
                .filter(t -> Objects.equals(t.getTrainNumber(), targetTicket.getTrainNumber())
                        && Objects.equals(t.getTravelDate(), targetTicket.getTravelDate()))
                .orElseThrow(() -> new BadRequestException("You don't have an active ticket for this train and date"));
    }

    @Override
    @Transactional(readOnly = true)
    public RequestsResponse list(UUID userId) {
        List<ExchangeRequest> received = exchangeRequestRepository.findByTargetUserIdOrderByCreatedAtDesc(userId);
        List<ExchangeRequest> sent = exchangeRequestRepository.findByRequesterIdOrderByCreatedAtDesc(userId);

        Set<UUID> others = new HashSet<>();
        received.forEach(r -> others.add(r.getRequesterId()));
        sent.forEach(r -> others.add(r.getTargetUserId()));
        Map<UUID, AppUser> users = userRepository.findAllById(others).stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));

        return new RequestsResponse(
                received.stream().map(r -> ExchangeRequestView.of(r, summary(users.get(r.getRequesterId())))).toList(),
                sent.stream().map(r -> ExchangeRequestView.of(r, summary(users.get(r.getTargetUserId())))).toList());
    }

    private static PartySummary summary(AppUser user) {
        return user == null ? null : new PartySummary(user.getId(), user.getName(), user.getRating());
    }

    @Override
    @Transactional
    public ExchangeActionResponse accept(UUID requestId, UUID userId) {
        ExchangeRequest request = receivedRequest(requestId, userId);
        if (request.getStatus() != ExchangeStatus.PENDING) {
            throw new BadRequestException("Cannot accept request with status: " + request.getStatus().label());
        }
        request.setStatus(ExchangeStatus.ACCEPTED);
        request.setUpdatedAt(DefaultValuesPopulator.getCurrentTimestamp());
        exchangeRequestRepository.save(request);

        log.info("Exchange request accepted: requestId={}, userId={}", requestId, userId);
        return ExchangeActionResponse.builder()
                .message("Exchange request accepted")
                .requestId(requestId)
                .status(request.getStatus())
                .build();
    }

    @Override
    @Transactional
    public ExchangeActionResponse decline(UUID requestId, UUID userId) {
        ExchangeRequest request = receivedRequest(requestId, userId);
        switch (request.getStatus()) {
            case DECLINED -> log.debug("Exchange request already declined: requestId={}", requestId);
            case PENDING, ACCEPTED -> {
                request.setStatus(ExchangeStatus.DECLINED);
                request.setUpdatedAt(DefaultValuesPopulator.getCurrentTimestamp());
                exchangeRequestRepository.save(request);
                log.info("Exchange request declined: requestId={}, userId={}", requestId, userId);
            }
            default -> throw new BadRequestException(
                    "Cannot decline request with status: " + request.getStatus().label());
        }
        return ExchangeActionResponse.builder()
                .message("Exchange request declined")
                .requestId(requestId)
                .status(ExchangeStatus.DECLINED)
                .build();
    }

    private ExchangeRequest receivedRequest(UUID requestId, UUID userId) {
        return exchangeRequestRepository.findById(requestId)
                .filter(r -> r.getTargetUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Exchange request not found"));
    }

    /**
     * Records one party's confirmation. The call that sets the second flag completes the request and
     * increments both users' exchange counters; later calls leave the counters untouched.
     * Serialized per request in this process and guarded across processes by the entity version;
     * version conflicts are retried with a fresh transaction.
     */
    @Override
    public ConfirmationResponse confirm(UUID requestId, UUID userId) {
        Lock lock = requestLocks.get(requestId);
        lock.lock();
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Concurrent update on requestId={}, retry {}", requestId, context.getRetryCount());
                }
                return transactionOperations.execute(status -> confirmInTransaction(requestId, userId));
            });
        } finally {
            lock.unlock();
        }
    }

    private ConfirmationResponse confirmInTransaction(UUID requestId, UUID userId) {
        ExchangeRequest request = exchangeRequestRepository.findById(requestId)
                .orElseThrow(() -> new ResourceNotFoundException("Exchange request not found"));
        if (!request.isParty(userId)) {
            throw new ForbiddenException("Not authorized to confirm this exchange");
        }
        if (request.getStatus() == ExchangeStatus.COMPLETED) {
            return confirmation("Exchange already completed", request);
        }
        if (request.getStatus() != ExchangeStatus.ACCEPTED) {
            throw new BadRequestException("Cannot confirm request with status: " + request.getStatus().label());
        }

        if (request.getRequesterId().equals(userId)) {
            request.setRequesterConfirmed(true);
        }
        if (request.getTargetUserId().equals(userId)) {
            request.setTargetConfirmed(true);
        }
        request.setUpdatedAt(DefaultValuesPopulator.getCurrentTimestamp());

        if (!request.canComplete()) {
            exchangeRequestRepository.saveAndFlush(request);
            log.info("Exchange confirmation recorded: requestId={}, userId={}", requestId, userId);
            return confirmation("Confirmation recorded", request);
        }

        request.setStatus(ExchangeStatus.COMPLETED);
        exchangeRequestRepository.saveAndFlush(request);

        int incremented = userRepository.incrementTotalExchanges(
                List.of(request.getRequesterId(), request.getTargetUserId()),
                DefaultValuesPopulator.getCurrentTimestamp());
        if (incremented < 2) {
            log.warn("Exchange completed with a missing party record: requestId={}", requestId);
        }
        meterRegistry.counter("exchange_completed_total").increment();

        log.info("Exchange completed: requestId={}, trainNumber={}, travelDate={}",
                requestId, request.getTrainNumber(), request.getTravelDate());
        return confirmation("Exchange completed successfully", request);
    }

    private static ConfirmationResponse confirmation(String message, ExchangeRequest request) {
        return ConfirmationResponse.builder()
                .message(message)
                .status(request.getStatus())
                .requesterConfirmed(request.isRequesterConfirmed())
                .targetConfirmed(request.isTargetConfirmed())
                .build();
    }
}
