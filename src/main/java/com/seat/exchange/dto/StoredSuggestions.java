package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.SuggestionSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class StoredSuggestions {
    private UUID ticketId;
    private String trainNumber;
    private LocalDate travelDate;
    private List<SuggestionEntry> entries;
    private SuggestionSource source;
    private LocalDateTime createdAt;
}
