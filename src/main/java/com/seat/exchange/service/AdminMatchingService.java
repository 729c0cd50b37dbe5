package com.seat.exchange.service;

import com.seat.exchange.builder.BenefitGraphBuilder;
import com.seat.exchange.cache.SuggestionStore;
import com.seat.exchange.dto.AdminRunResponse;
import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.CycleOptimizationResult;
import com.seat.exchange.dto.ExchangeCycle;
import com.seat.exchange.dto.GlobalMatchingResponse;
import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.TripSummary;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.BadRequestException;
import com.seat.exchange.exceptions.ResourceNotFoundException;
import com.seat.exchange.matcher.strategies.AsyncCycleOptimizer;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.repo.TicketRepository;
import com.seat.exchange.repo.TripProjection;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;


/**
 * Batch recomputation of stored suggestions, per ticket or globally through the cycle optimizer.
 * Concurrent runs over the same trip are not excluded; the last write per ticket wins.
 */
@Slf4j
@Service
public class AdminMatchingService {
    private final TicketRepository ticketRepository;
    private final MatchingService matchingService;
    private final BenefitGraphBuilder benefitGraphBuilder;
    private final AsyncCycleOptimizer asyncCycleOptimizer;
    private final SuggestionStore suggestionStore;
    private final MeterRegistry meterRegistry;
    private final double defaultMinStoreScore;
    private final int maxLiveResults;
    private final long defaultTimeLimitSeconds;
    private final long maxTimeLimitSeconds;

    public AdminMatchingService(
            TicketRepository ticketRepository,
            MatchingService matchingService,
            BenefitGraphBuilder benefitGraphBuilder,
            AsyncCycleOptimizer asyncCycleOptimizer,
            SuggestionStore suggestionStore,
            MeterRegistry meterRegistry,
            @Value("${exchange.suggestions.min-store-score:50.0}") double defaultMinStoreScore,
            @Value("${exchange.matching.max-live-results:10}") int maxLiveResults,
            @Value("${exchange.optimizer.default-time-limit-seconds:30}") long defaultTimeLimitSeconds,
            @Value("${exchange.optimizer.max-time-limit-seconds:300}") long maxTimeLimitSeconds
    ) {
        this.ticketRepository = ticketRepository;
        this.matchingService = matchingService;
        this.benefitGraphBuilder = benefitGraphBuilder;
        this.asyncCycleOptimizer = asyncCycleOptimizer;
        this.suggestionStore = suggestionStore;
        this.meterRegistry = meterRegistry;
        this.defaultMinStoreScore = defaultMinStoreScore;
        this.maxLiveResults = maxLiveResults;
        this.defaultTimeLimitSeconds = defaultTimeLimitSeconds;
        this.maxTimeLimitSeconds = maxTimeLimitSeconds;
    }

    public AdminRunResponse runMatching(String trainNumber, LocalDate travelDate, Double minStoreScore, SuggestionSource source) {
        double minScore = minStoreScore != null ? minStoreScore : defaultMinStoreScore;
        List<Ticket> tickets = selectActiveTickets(trainNumber, travelDate);
        int stored = 0;
        int cleared = 0;

        for (Ticket ticket : tickets) {
            List<SuggestionEntry> qualifying = matchingService
                    .computeLiveMatches(ticket, MatchingPreferences.fromTicket(ticket)).stream()
                    .filter(m -> m.getMatchScore() >= minScore)
                    .limit(maxLiveResults)
                    .map(SuggestionEntry::pair)
                    .toList();
            if (qualifying.isEmpty()) {
                if (suggestionStore.delete(ticket.getId())) {
                    cleared++;
                }
                continue;
            }
            suggestionStore.put(ticket.getId(), ticket.getTrainNumber(), ticket.getTravelDate(), qualifying, source);
            stored++;
        }

        meterRegistry.counter("exchange_suggestions_stored_total", "source", source.name()).increment(stored);
        log.info("Suggestion run finished: trainNumber={}, travelDate={}, source={}, processed={}, stored={}, cleared={}",
                trainNumber, travelDate, source, tickets.size(), stored, cleared);
        return AdminRunResponse.builder()
                .processed(tickets.size())
                .stored(stored)
                .cleared(cleared)
                .minStoreScore(minScore)
                .build();
    }

    public CompletableFuture<GlobalMatchingResponse> runGlobalMatching(
            String trainNumber, LocalDate travelDate, Double minStoreScore, Long timeLimitSeconds) {
        double minScore = minStoreScore != null ? minStoreScore : defaultMinStoreScore;
        return optimizeTrip(trainNumber, travelDate, timeLimitSeconds)
                .thenApply(run -> persistCycles(run, minScore));
    }

    public CompletableFuture<GlobalMatchingResponse> previewGlobalMatching(
            String trainNumber, LocalDate travelDate, Long timeLimitSeconds) {
        return optimizeTrip(trainNumber, travelDate, timeLimitSeconds)
                .thenApply(run -> response(run, false, 0, 0));
    }

    public StoredSuggestions getStoredMatches(UUID ticketId) {
        return suggestionStore.get(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("No stored matches for ticket: " + ticketId));
    }

    public List<StoredSuggestions> getStoredMatchesForTrip(String trainNumber, LocalDate travelDate) {
        return suggestionStore.findByTrip(trainNumber, travelDate);
    }

    public List<TripSummary> availableTrips() {
        Map<String, List<LocalDate>> byTrain = new LinkedHashMap<>();
        for (TripProjection trip : ticketRepository.findDistinctTrips(TicketStatus.ACTIVE)) {
            byTrain.computeIfAbsent(trip.getTrainNumber(), k -> new ArrayList<>()).add(trip.getTravelDate());
        }
        return byTrain.entrySet().stream()
                .map(e -> new TripSummary(e.getKey(), e.getValue()))
                .toList();
    }

    Duration resolveTimeLimit(Long requestedSeconds) {
        if (requestedSeconds == null) {
            return Duration.ofSeconds(defaultTimeLimitSeconds);
        }
        if (requestedSeconds <= 0) {
            throw new BadRequestException("timeLimit must be positive");
        }
        if (requestedSeconds > maxTimeLimitSeconds) {
            log.warn("Requested time limit {}s exceeds maximum, using {}s", requestedSeconds, maxTimeLimitSeconds);
            return Duration.ofSeconds(maxTimeLimitSeconds);
        }
        return Duration.ofSeconds(requestedSeconds);
    }

    private CompletableFuture<TripRun> optimizeTrip(String trainNumber, LocalDate travelDate, Long timeLimitSeconds) {
        if (StringUtils.isBlank(trainNumber) || travelDate == null) {
            throw new BadRequestException("trainNumber and travelDate are required");
        }
        Duration timeLimit = resolveTimeLimit(timeLimitSeconds);
        List<Ticket> tickets = ticketRepository.findByTrainNumberAndTravelDateAndStatus(
                trainNumber, travelDate, TicketStatus.ACTIVE);
        BenefitGraph graph = benefitGraphBuilder.build(tickets);
        return asyncCycleOptimizer.optimizeAsync(graph, timeLimit)
                .thenApply(result -> new TripRun(trainNumber, travelDate, tickets, result));
    }

    private GlobalMatchingResponse persistCycles(TripRun run, double minScore) {
        Map<UUID, ExchangeCycle> cycleOf = new LinkedHashMap<>();
        for (ExchangeCycle cycle : run.result().getCycles()) {
            if (cycle.getTotalScore() < minScore) {
                continue;
            }
            cycle.getTicketIds().forEach(id -> cycleOf.put(UUID.fromString(id), cycle));
        }

        int stored = 0;
        int cleared = 0;
        for (Ticket ticket : run.tickets()) {
            ExchangeCycle cycle = cycleOf.get(ticket.getId());
            if (cycle == null) {
                if (suggestionStore.delete(ticket.getId())) {
                    cleared++;
                }
                continue;
            }
            suggestionStore.put(ticket.getId(), run.trainNumber(), run.travelDate(),
                    List.of(SuggestionEntry.cycle(cycle)), SuggestionSource.ADMIN_GLOBAL_ILP);
            stored++;
        }

        meterRegistry.counter("exchange_suggestions_stored_total", "source", SuggestionSource.ADMIN_GLOBAL_ILP.name())
                .increment(stored);
        log.info("Global matching stored: trainNumber={}, travelDate={}, stored={}, cleared={}",
                run.trainNumber(), run.travelDate(), stored, cleared);
        return response(run, true, stored, cleared);
    }

    private static GlobalMatchingResponse response(TripRun run, boolean persisted, int stored, int cleared) {
        List<ExchangeCycle> cycles = run.result().getCycles();
        return GlobalMatchingResponse.builder()
                .trainNumber(run.trainNumber())
                .travelDate(run.travelDate())
                .ticketsConsidered(run.tickets().size())
                .cycles(cycles)
                .totalCycles(cycles.size())
                .totalScore(cycles.stream().mapToDouble(ExchangeCycle::getTotalScore).sum())
                .backend(run.result().getBackend())
                .elapsedMillis(run.result().getElapsedMillis())
                .persisted(persisted)
                .stored(stored)
                .cleared(cleared)
                .build();
    }

    private List<Ticket> selectActiveTickets(String trainNumber, LocalDate travelDate) {
        boolean hasTrain = StringUtils.isNotBlank(trainNumber);
        if (hasTrain && travelDate != null) {
            return ticketRepository.findByTrainNumberAndTravelDateAndStatus(trainNumber, travelDate, TicketStatus.ACTIVE);
        }
        if (hasTrain) {
            return ticketRepository.findByTrainNumberAndStatus(trainNumber, TicketStatus.ACTIVE);
        }
        if (travelDate != null) {
            return ticketRepository.findByTravelDateAndStatus(travelDate, TicketStatus.ACTIVE);
        }
        return ticketRepository.findByStatus(TicketStatus.ACTIVE);
    }

    private record TripRun(String trainNumber, LocalDate travelDate, List<Ticket> tickets, CycleOptimizationResult result) {
    }
}
