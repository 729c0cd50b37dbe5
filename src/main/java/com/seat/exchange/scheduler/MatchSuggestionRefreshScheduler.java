package com.seat.exchange.scheduler;

import com.seat.exchange.dto.AdminRunResponse;
import com.seat.exchange.dto.RefreshSummary;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.repo.TicketRepository;
import com.seat.exchange.repo.TripProjection;
import com.seat.exchange.service.AdminMatchingService;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;


@Slf4j
@Component
public class MatchSuggestionRefreshScheduler {

    private final MeterRegistry metrics;
    private final AdminMatchingService adminMatchingService;
    private final TicketRepository ticketRepository;

    @Autowired
    @Lazy
    private MatchSuggestionRefreshScheduler self;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public MatchSuggestionRefreshScheduler(
            MeterRegistry metrics,
            AdminMatchingService adminMatchingService,
            TicketRepository ticketRepository) {
        this.metrics = metrics;
        this.adminMatchingService = adminMatchingService;
        this.ticketRepository = ticketRepository;
    }

    @Scheduled(cron = "${exchange.suggestions.refresh.cron:-}", zone = "${exchange.suggestions.refresh.zone:Asia/Kolkata}")
    public void refreshSuggestions() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Skipping suggestion refresh - previous run still in progress");
            return;
        }
        Timer.Sample sample = Timer.start(metrics);
        log.info("Starting suggestion refresh at {}", Instant.now());
        try {
            RefreshSummary summary = self.refreshAllTrips();
            log.info("Suggestion refresh finished: trips={}, stored={}, cleared={}, degraded={}",
                    summary.getTrips(), summary.getStored(), summary.getCleared(), summary.isDegraded());
        } finally {
            running.set(false);
            sample.stop(metrics.timer("exchange_suggestion_refresh_duration_seconds"));
        }
    }

    @CircuitBreaker(name = "suggestionRefresh", fallbackMethod = "refreshFallback")
    public RefreshSummary refreshAllTrips() {
        List<TripProjection> trips = ticketRepository.findDistinctTrips(TicketStatus.ACTIVE);
        int stored = 0;
        int cleared = 0;
        for (TripProjection trip : trips) {
            AdminRunResponse run = adminMatchingService.runMatching(
                    trip.getTrainNumber(), trip.getTravelDate(), null, SuggestionSource.AUTO);
            stored += run.getStored();
            cleared += run.getCleared();
        }
        return new RefreshSummary(trips.size(), stored, cleared, false);
    }

    private RefreshSummary refreshFallback(Throwable t) {
        log.error("Suggestion refresh fallback triggered", t);
        metrics.counter("exchange_suggestion_refresh_fallback_total",
                "reason", t.getClass().getSimpleName()).increment();
        return RefreshSummary.degraded();
    }
}
