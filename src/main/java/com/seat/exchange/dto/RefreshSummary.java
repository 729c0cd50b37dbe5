package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@AllArgsConstructor
@Data
public class RefreshSummary {
    private int trips;
    private int stored;
    private int cleared;
    private boolean degraded;

    public static RefreshSummary degraded() {
        return new RefreshSummary(0, 0, 0, true);
    }
}
