package com.seat.exchange.dto;

import jakarta.validation.constraints.NotEmpty;
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
public class BatchFindMatchesRequest {
    @NotEmpty
    private List<UUID> ticketIds;
    // accepted for compatibility, re-ranking is not applied
    private boolean useAiEnhancement;
}
