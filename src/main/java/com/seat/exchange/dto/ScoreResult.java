package com.seat.exchange.dto;

public record ScoreResult(double score, String description) {

    public static ScoreResult zero(String description) {
        return new ScoreResult(0.0, description);
    }
}
