package com.seat.exchange.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.seat.exchange.dto.enums.SuggestionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * One cached suggestion for a ticket: either a pairwise match or a membership in an exchange cycle.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionEntry {
    private SuggestionType type;

    private UUID ticketId;
    private UUID userId;
    private String userName;
    private Double userRating;
    private List<SeatInfo> availableSeats;

    private List<UUID> cycleTicketIds;

    private double score;
    private String description;

    public static SuggestionEntry pair(MatchResult match) {
        return SuggestionEntry.builder()
                .type(SuggestionType.PAIR)
                .ticketId(match.getTicketId())
                .userId(match.getUserId())
                .userName(match.getUserName())
                .userRating(match.getUserRating())
                .availableSeats(match.getAvailableSeats())
                .score(match.getMatchScore())
                .description(match.getBenefitDescription())
                .build();
    }

    public static SuggestionEntry cycle(ExchangeCycle cycle) {
        return SuggestionEntry.builder()
                .type(SuggestionType.CYCLE)
                .cycleTicketIds(cycle.getTicketIds().stream().map(UUID::fromString).toList())
                .score(cycle.getTotalScore())
                .description(cycle.getDescription())
                .build();
    }
}
