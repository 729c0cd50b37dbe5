package com.seat.exchange.matcher.strategies;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.CycleOptimizationResult;
import com.seat.exchange.dto.ExchangeCycle;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;


/**
 * Runs the configured optimizer on the solver pool so request threads only wait on the future.
 * A failing solver, or a saturated solver pool, degrades to the small-cycle heuristic instead of failing the call.
 */
@Slf4j
@Component
public class AsyncCycleOptimizer {
    private static final String FALLBACK_COUNTER = "exchange_optimizer_fallback_total";
    private static final String DURATION_TIMER = "exchange_global_optimizer_duration_seconds";
    private static final String HEURISTIC = "heuristic";

    private final CycleOptimizer cycleOptimizer;
    private final SmallCycleHeuristic fallbackHeuristic;
    private final Executor executor;
    private final MeterRegistry meterRegistry;

    public AsyncCycleOptimizer(
            CycleOptimizer cycleOptimizer,
            SmallCycleHeuristic fallbackHeuristic,
            @Qualifier("solverExecutor") Executor executor,
            MeterRegistry meterRegistry
    ) {
        this.cycleOptimizer = cycleOptimizer;
        this.fallbackHeuristic = fallbackHeuristic;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    public CompletableFuture<CycleOptimizationResult> optimizeAsync(BenefitGraph graph, Duration timeLimit) {
        if (!graph.hasPositiveEdge()) {
            log.info("No positive benefit edge among {} tickets, nothing to optimize", graph.size());
            return CompletableFuture.completedFuture(CycleOptimizationResult.builder()
                    .cycles(List.of())
                    .backend(cycleOptimizer.backendName())
                    .fallbackUsed(false)
                    .elapsedMillis(0)
                    .build());
        }
        try {
            return CompletableFuture.supplyAsync(() -> solve(graph, timeLimit), executor);
        } catch (RejectedExecutionException e) {
            String backend = cycleOptimizer.backendName();
            log.warn("Solver pool saturated, answering {} tickets with small-cycle heuristic instead of {}",
                    graph.size(), backend);
            meterRegistry.counter(FALLBACK_COUNTER, "backend", backend, "reason", "rejected").increment();
            return CompletableFuture.completedFuture(heuristicResult(graph, Timer.start(meterRegistry), System.currentTimeMillis()));
        }
    }

    private CycleOptimizationResult solve(BenefitGraph graph, Duration timeLimit) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long start = System.currentTimeMillis();
        String backend = cycleOptimizer.backendName();
        List<ExchangeCycle> cycles;
        try {
            log.info("Starting {} cycle optimization over {} tickets, timeLimit={}", backend, graph.size(), timeLimit);
            cycles = cycleOptimizer.optimize(graph, timeLimit);
        } catch (RuntimeException | LinkageError e) {
            log.warn("{} cycle optimizer failed: {}. Falling back to small-cycle heuristic.", backend, e.getMessage(), e);
            meterRegistry.counter(FALLBACK_COUNTER, "backend", backend, "reason", "error").increment();
            return heuristicResult(graph, sample, start);
        }
        sample.stop(meterRegistry.timer(DURATION_TIMER, "backend", backend));
        return CycleOptimizationResult.builder()
                .cycles(cycles)
                .backend(backend)
                .fallbackUsed(false)
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
    }

    private CycleOptimizationResult heuristicResult(BenefitGraph graph, Timer.Sample sample, long start) {
        List<ExchangeCycle> cycles = fallbackHeuristic.findCycles(graph, 3);
        sample.stop(meterRegistry.timer(DURATION_TIMER, "backend", HEURISTIC));
        return CycleOptimizationResult.builder()
                .cycles(cycles)
                .backend(HEURISTIC)
                .fallbackUsed(true)
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
    }
}
