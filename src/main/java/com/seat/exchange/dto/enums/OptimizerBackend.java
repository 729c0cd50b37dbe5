package com.seat.exchange.dto.enums;

import java.util.Locale;

public enum OptimizerBackend {
    AUTO,
    ILP,
    HEURISTIC;

    public static OptimizerBackend from(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown exchange.optimizer.backend: " + value, e);
        }
    }
}
