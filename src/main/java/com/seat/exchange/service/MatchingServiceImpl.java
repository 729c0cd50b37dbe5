package com.seat.exchange.service;

import com.google.common.collect.Lists;
import com.seat.exchange.cache.SuggestionStore;
import com.seat.exchange.dto.FindMatchesResponse;
import com.seat.exchange.dto.MatchResult;
import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.ScoreResult;
import com.seat.exchange.dto.SeatInfo;
import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.TogethernessResponse;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.ResourceNotFoundException;
import com.seat.exchange.models.AppUser;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.repo.TicketRepository;
import com.seat.exchange.repo.UserRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class MatchingServiceImpl implements MatchingService {
    private final TicketRepository ticketRepository;
    private final UserRepository userRepository;
    private final BenefitScorer benefitScorer;
    private final SuggestionStore suggestionStore;
    private final Executor matchingExecutor;
    private final MeterRegistry meterRegistry;
    private final int maxLiveResults;
    private final int batchGroupSize;

    public MatchingServiceImpl(
            TicketRepository ticketRepository,
            UserRepository userRepository,
            BenefitScorer benefitScorer,
            SuggestionStore suggestionStore,
            @Qualifier("matchingExecutor") Executor matchingExecutor,
            MeterRegistry meterRegistry,
            @Value("${exchange.matching.max-live-results:10}") int maxLiveResults,
            @Value("${exchange.matching.batch-group-size:3}") int batchGroupSize
    ) {
        this.ticketRepository = ticketRepository;
        this.userRepository = userRepository;
        this.benefitScorer = benefitScorer;
        this.suggestionStore = suggestionStore;
        this.matchingExecutor = matchingExecutor;
        this.meterRegistry = meterRegistry;
        this.maxLiveResults = maxLiveResults;
        this.batchGroupSize = Math.max(1, batchGroupSize);
    }

    @Override
    public FindMatchesResponse findMatches(UUID ticketId, UUID userId, MatchingPreferences preferences, boolean forceLive) {
        Timer.Sample sample = Timer.start(meterRegistry);
        Ticket ticket = ownedTicket(ticketId, userId);

        boolean bypassCache = forceLive || (preferences != null && preferences.forcesLiveRecomputation());
        if (!bypassCache) {
            Optional<StoredSuggestions> cached = suggestionStore.get(ticketId);
            if (cached.isPresent()) {
                List<SuggestionEntry> entries = cached.get().getEntries();
                log.debug("Serving {} stored suggestions for ticketId={}", entries.size(), ticketId);
                sample.stop(meterRegistry.timer("exchange_find_matches_duration_seconds", "source", "store"));
                return FindMatchesResponse.builder()
                        .ticketId(ticketId)
                        .matches(entries)
                        .totalMatches(entries.size())
                        .prepopulated(true)
                        .build();
            }
        }

        MatchingPreferences effective = preferences != null ? preferences : MatchingPreferences.fromTicket(ticket);
        List<SuggestionEntry> matches = computeLiveMatches(ticket, effective).stream()
                .limit(maxLiveResults)
                .map(SuggestionEntry::pair)
                .toList();

        log.info("Live matching for ticketId={} trainNumber={} travelDate={} returned {} matches",
                ticketId, ticket.getTrainNumber(), ticket.getTravelDate(), matches.size());
        sample.stop(meterRegistry.timer("exchange_find_matches_duration_seconds", "source", "live"));
        return FindMatchesResponse.builder()
                .ticketId(ticketId)
                .matches(matches)
                .totalMatches(matches.size())
                .prepopulated(false)
                .build();
    }

    @Override
    public List<MatchResult> computeLiveMatches(Ticket ticket, MatchingPreferences preferences) {
        List<Ticket> candidates = ticketRepository.findByTrainNumberAndTravelDateAndStatusAndUserIdNot(
                ticket.getTrainNumber(), ticket.getTravelDate(), TicketStatus.ACTIVE, ticket.getUserId());
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        Set<UUID> ownerIds = candidates.stream().map(Ticket::getUserId).collect(Collectors.toSet());
        Map<UUID, AppUser> owners = userRepository.findAllById(ownerIds).stream()
                .collect(Collectors.toMap(AppUser::getId, Function.identity()));

        List<MatchResult> results = new ArrayList<>();
        for (Ticket candidate : candidates) {
            AppUser owner = owners.get(candidate.getUserId());
            if (owner == null) {
                log.warn("Skipping ticketId={} with missing owner userId={}", candidate.getId(), candidate.getUserId());
                continue;
            }
            ScoreResult score = benefitScorer.score(ticket, candidate, preferences);
            if (score.score() <= 0) {
                continue;
            }
            results.add(MatchResult.builder()
                    .userId(owner.getId())
                    .userName(owner.getName())
                    .userRating(owner.getRating())
                    .ticketId(candidate.getId())
                    .availableSeats(candidate.getPassengers().stream().map(SeatInfo::of).toList())
                    .matchScore(score.score())
                    .benefitDescription(score.description())
                    .build());
        }
        results.sort(Comparator.comparingDouble(MatchResult::getMatchScore).reversed());
        return results;
    }

    @Override
    public Map<UUID, List<SuggestionEntry>> batchFindMatches(List<UUID> ticketIds, UUID userId) {
        Map<UUID, List<SuggestionEntry>> results = new LinkedHashMap<>();
        List<UUID> distinct = ticketIds.stream().distinct().toList();

        for (List<UUID> group : Lists.partition(distinct, batchGroupSize)) {
            List<CompletableFuture<List<SuggestionEntry>>> futures = group.stream()
                    .map(id -> CompletableFuture.supplyAsync(() -> matchesOrEmpty(id, userId), matchingExecutor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            for (int i = 0; i < group.size(); i++) {
                results.put(group.get(i), futures.get(i).join());
            }
        }
        log.info("Batch matching processed {} tickets in groups of {}", distinct.size(), batchGroupSize);
        return results;
    }

    private List<SuggestionEntry> matchesOrEmpty(UUID ticketId, UUID userId) {
        try {
            return findMatches(ticketId, userId, null, false).getMatches();
        } catch (ResourceNotFoundException e) {
            log.debug("Batch lookup skipped ticketId={}: {}", ticketId, e.getMessage());
            return Collections.emptyList();
        }
    }

    @Override
    public TogethernessResponse togetherness(UUID ticketId, UUID userId) {
        Ticket ticket = ownedTicket(ticketId, userId);
        return TogethernessResponse.builder()
                .ticketId(ticketId)
                .scattered(ticket.isScattered())
                .score(benefitScorer.togethernessScore(ticket.getPassengers()))
                .coaches(ticket.getCoaches())
                .build();
    }

    private Ticket ownedTicket(UUID ticketId, UUID userId) {
        return ticketRepository.findById(ticketId)
                .filter(t -> t.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Ticket not found: " + ticketId));
    }
}
