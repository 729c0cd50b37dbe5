package com.seat.exchange.matcher.strategies;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.ExchangeCycle;

import java.time.Duration;
import java.util.List;

/**
 * Selects a set of vertex-disjoint exchange cycles over a benefit graph.
 */
public interface CycleOptimizer {
    List<ExchangeCycle> optimize(BenefitGraph graph, Duration timeLimit);

    String backendName();
}
