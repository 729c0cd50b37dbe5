package com.seat.exchange.processors;

import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.ScoreResult;
import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.models.Passenger;
import com.seat.exchange.service.BenefitScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;


@Slf4j
@Component
public class SeatBenefitScorer implements BenefitScorer {
    static final double SHARED_COACH_BONUS = 30;
    static final double SAME_BAY_BONUS = 20;
    static final double ADJACENT_BONUS = 15;
    static final double BETTER_BERTH_BONUS = 10;
    static final double PREFERRED_BERTH_BONUS = 8;
    static final double MAX_SCORE = 100;

    private static final String SEPARATOR = " • ";
    private static final String FALLBACK_DESCRIPTION = "Potential exchange available";
    private static final String NO_COMMON_COACH = "No matching coaches";

    @Override
    public ScoreResult score(List<Passenger> beneficiary, List<Passenger> source, MatchingPreferences preferences) {
        MatchingPreferences prefs = preferences != null ? preferences : MatchingPreferences.defaults();
        double score = 0;
        List<String> benefits = new ArrayList<>();

        Set<String> commonCoaches = coachesOf(beneficiary);
        commonCoaches.retainAll(coachesOf(source));
        if (!commonCoaches.isEmpty()) {
            score += SHARED_COACH_BONUS;
            benefits.add("Same coach (" + String.join(", ", commonCoaches) + ")");
        }

        for (Passenger mine : beneficiary) {
            for (Passenger other : source) {
                if (!mine.getCoach().equals(other.getCoach())) {
                    continue;
                }
                if (mine.bay() == other.bay()) {
                    score += SAME_BAY_BONUS;
                    benefits.add("Same bay as seat " + other.getSeatNumber());
                }
                if (Math.abs(mine.getSeatNumber() - other.getSeatNumber()) <= 1) {
                    score += ADJACENT_BONUS;
                    benefits.add("Adjacent to seat " + other.getSeatNumber());
                }
            }
        }

        for (Passenger other : source) {
            for (Passenger mine : beneficiary) {
                if (rank(other.getBerthType()) > rank(mine.getBerthType())) {
                    score += BETTER_BERTH_BONUS;
                    benefits.add("Better berth: " + other.getBerthType());
                    if (prefs.prefers(other.getBerthType())) {
                        score += PREFERRED_BERTH_BONUS;
                        benefits.add("Preferred berth: " + other.getBerthType());
                    }
                }
            }
        }

        // hard veto, applied after every bonus
        if (prefs.isSameCoachOnly() && commonCoaches.isEmpty()) {
            return ScoreResult.zero(NO_COMMON_COACH);
        }

        score = Math.max(0, Math.min(score, MAX_SCORE));
        String description = benefits.isEmpty() ? FALLBACK_DESCRIPTION : String.join(SEPARATOR, benefits);
        log.debug("Scored pair: score={}, benefits={}", score, benefits.size());
        return new ScoreResult(score, description);
    }

    /**
     * 100 for a group sitting together, minus 30 per extra coach and 10 per extra bay inside a coach.
     */
    @Override
    public double togethernessScore(List<Passenger> passengers) {
        if (passengers == null || passengers.size() <= 1) {
            return 100.0;
        }
        Map<String, Set<Integer>> baysByCoach = new HashMap<>();
        for (Passenger p : passengers) {
            baysByCoach.computeIfAbsent(p.getCoach(), k -> new HashSet<>()).add(p.bay());
        }

        double score = 100.0;
        if (baysByCoach.size() > 1) {
            score -= 30.0 * (baysByCoach.size() - 1);
        }
        for (Set<Integer> bays : baysByCoach.values()) {
            if (bays.size() > 1) {
                score -= 10.0 * (bays.size() - 1);
            }
        }
        return Math.max(score, 0);
    }

    private static Set<String> coachesOf(List<Passenger> passengers) {
        Set<String> coaches = new TreeSet<>();
        passengers.forEach(p -> coaches.add(p.getCoach()));
        return coaches;
    }

    private static int rank(BerthType berthType) {
        return berthType == null ? 0 : berthType.getRank();
    }
}
