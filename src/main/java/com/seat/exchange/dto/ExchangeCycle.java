package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Closed chain of tickets in exchange order: each member takes the seats of the next one.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class ExchangeCycle {
    private List<String> ticketIds;
    private double totalScore;
    private String description;

    public static ExchangeCycle of(List<String> ticketIds, double totalScore) {
        String description = ticketIds.size() == 2
                ? "Mutual seat swap between 2 tickets"
                : ticketIds.size() + "-way exchange cycle: " + String.join(" -> ", ticketIds) + " -> " + ticketIds.get(0);
        return new ExchangeCycle(List.copyOf(ticketIds), totalScore, description);
    }

    public int size() {
        return ticketIds.size();
    }
}
