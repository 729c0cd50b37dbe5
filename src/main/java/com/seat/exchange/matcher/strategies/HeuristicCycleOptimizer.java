package com.seat.exchange.matcher.strategies;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.ExchangeCycle;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.List;


/**
 * Stand-in used when no solver backend is available: 2- and 3-cycles only, time limit ignored.
 */
@RequiredArgsConstructor
public class HeuristicCycleOptimizer implements CycleOptimizer {
    private final SmallCycleHeuristic heuristic;

    @Override
    public List<ExchangeCycle> optimize(BenefitGraph graph, Duration timeLimit) {
        return heuristic.findCycles(graph, 3);
    }

    @Override
    public String backendName() {
        return "heuristic";
    }
}
