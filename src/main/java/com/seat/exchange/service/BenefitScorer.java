package com.seat.exchange.service;

import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.ScoreResult;
import com.seat.exchange.models.Passenger;
import com.seat.exchange.models.Ticket;

import java.util.List;

/**
 * Directed benefit of one ticket holder taking the seats of another.
 */
public interface BenefitScorer {

    ScoreResult score(List<Passenger> beneficiary, List<Passenger> source, MatchingPreferences preferences);

    default ScoreResult score(Ticket beneficiary, Ticket source, MatchingPreferences preferences) {
        return score(beneficiary.getPassengers(), source.getPassengers(), preferences);
    }

    double togethernessScore(List<Passenger> passengers);
}
