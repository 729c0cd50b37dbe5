package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Builder
@AllArgsConstructor
@Data
public class GlobalMatchingResponse {
    private String trainNumber;
    private LocalDate travelDate;
    private int ticketsConsidered;
    private List<ExchangeCycle> cycles;
    private int totalCycles;
    private double totalScore;
    private String backend;
    private long elapsedMillis;
    private boolean persisted;
    private int stored;
    private int cleared;
}
