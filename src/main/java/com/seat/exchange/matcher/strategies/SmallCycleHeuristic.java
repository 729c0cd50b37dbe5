package com.seat.exchange.matcher.strategies;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.ExchangeCycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;


/**
 * Greedy packing of disjoint 2- and 3-party benefit cycles. Not optimal: a cycle accepted early is never displaced.
 */
@Slf4j
@Component
public class SmallCycleHeuristic {
    private final int maxPoolSize;

    public SmallCycleHeuristic(@Value("${exchange.heuristic.max-pool-size:200}") int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
    }

    public List<ExchangeCycle> findCycles(BenefitGraph graph) {
        return findCycles(graph, 3);
    }

    public List<ExchangeCycle> findCycles(BenefitGraph graph, int maxCycleLength) {
        BenefitGraph pool = graph;
        if (graph.size() > maxPoolSize) {
            log.warn("Ticket pool of {} exceeds heuristic bound {}, truncating", graph.size(), maxPoolSize);
            pool = graph.head(maxPoolSize);
        }

        List<Candidate> candidates = new ArrayList<>();
        collectPairs(pool, candidates);
        if (maxCycleLength >= 3) {
            collectTriangles(pool, candidates);
        }

        // List.sort is stable, equal totals keep discovery order
        candidates.sort(Comparator.comparingDouble(Candidate::total).reversed());

        boolean[] used = new boolean[pool.size()];
        List<ExchangeCycle> accepted = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (Arrays.stream(candidate.members()).anyMatch(m -> used[m])) {
                continue;
            }
            Arrays.stream(candidate.members()).forEach(m -> used[m] = true);
            accepted.add(ExchangeCycle.of(
                    Arrays.stream(candidate.members()).mapToObj(pool::ticketId).toList(),
                    candidate.total()));
        }

        log.info("Small-cycle heuristic: tickets={}, candidates={}, accepted={}",
                pool.size(), candidates.size(), accepted.size());
        return accepted;
    }

    private void collectPairs(BenefitGraph pool, List<Candidate> candidates) {
        int n = pool.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double forward = pool.weight(i, j);
                double backward = pool.weight(j, i);
                if (forward > 0 && backward > 0) {
                    candidates.add(new Candidate(new int[]{i, j}, forward + backward));
                }
            }
        }
    }

    /**
     * Only the i -> j -> k -> i rotation of each i < j < k triple is evaluated; the reverse rotation
     * i -> k -> j -> i is never considered. Kept as-is until product confirms whether both directions
     * should be searched.
     */
    private void collectTriangles(BenefitGraph pool, List<Candidate> candidates) {
        int n = pool.size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double ij = pool.weight(i, j);
                if (ij <= 0) {
                    continue;
                }
                for (int k = j + 1; k < n; k++) {
                    double jk = pool.weight(j, k);
                    double ki = pool.weight(k, i);
                    if (jk > 0 && ki > 0) {
                        candidates.add(new Candidate(new int[]{i, j, k}, ij + jk + ki));
                    }
                }
            }
        }
    }

    private record Candidate(int[] members, double total) {
    }
}
