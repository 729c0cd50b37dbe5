package com.seat.exchange.builder;

import com.seat.exchange.dto.BenefitGraph;
import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.service.BenefitScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;


@Slf4j
@Component
@RequiredArgsConstructor
public class BenefitGraphBuilder {
    private final BenefitScorer benefitScorer;

    /**
     * Scores every ordered pair, each beneficiary scored with its own stored preferences.
     */
    public BenefitGraph build(List<Ticket> tickets) {
        return build(tickets, MatchingPreferences::fromTicket);
    }

    public BenefitGraph build(List<Ticket> tickets, MatchingPreferences preferences) {
        return build(tickets, ticket -> preferences);
    }

    public BenefitGraph build(List<Ticket> tickets, Function<Ticket, MatchingPreferences> preferencesOf) {
        int n = tickets.size();
        double[][] weights = new double[n][n];
        int positiveEdges = 0;

        for (int i = 0; i < n; i++) {
            Ticket beneficiary = tickets.get(i);
            MatchingPreferences prefs = preferencesOf.apply(beneficiary);
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                weights[i][j] = benefitScorer.score(beneficiary, tickets.get(j), prefs).score();
                if (weights[i][j] > 0) {
                    positiveEdges++;
                }
            }
        }

        log.info("Built benefit graph: tickets={}, positiveEdges={}", n, positiveEdges);
        return new BenefitGraph(tickets.stream().map(t -> t.getId().toString()).toList(), weights);
    }
}
