package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder
@AllArgsConstructor
@Data
public class AdminRunResponse {
    private int processed;
    private int stored;
    private int cleared;
    private double minStoreScore;
}
