package com.seat.exchange.service;

import com.seat.exchange.dto.FindMatchesResponse;
import com.seat.exchange.dto.MatchResult;
import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.TogethernessResponse;
import com.seat.exchange.models.Ticket;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface MatchingService {
    FindMatchesResponse findMatches(UUID ticketId, UUID userId, MatchingPreferences preferences, boolean forceLive);

    Map<UUID, List<SuggestionEntry>> batchFindMatches(List<UUID> ticketIds, UUID userId);

    /**
     * Every positive-scoring partner for the ticket, best first, without the live result cap.
     */
    List<MatchResult> computeLiveMatches(Ticket ticket, MatchingPreferences preferences);

    TogethernessResponse togetherness(UUID ticketId, UUID userId);
}
