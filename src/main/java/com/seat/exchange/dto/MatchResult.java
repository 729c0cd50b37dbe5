package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

@Builder
@AllArgsConstructor
@Data
public class MatchResult {
    private UUID userId;
    private String userName;
    private double userRating;
    private UUID ticketId;
    private List<SeatInfo> availableSeats;
    private double matchScore;
    private String benefitDescription;
}
