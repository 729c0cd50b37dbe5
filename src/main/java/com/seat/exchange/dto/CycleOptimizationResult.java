package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Builder
@AllArgsConstructor
@Data
public class CycleOptimizationResult {
    private List<ExchangeCycle> cycles;
    private String backend;
    private boolean fallbackUsed;
    private long elapsedMillis;
}
