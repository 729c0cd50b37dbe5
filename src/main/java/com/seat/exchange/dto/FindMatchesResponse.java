package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class FindMatchesResponse {
    private UUID ticketId;
    private List<SuggestionEntry> matches;
    private int totalMatches;
    private boolean prepopulated;
}
