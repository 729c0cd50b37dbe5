package com.seat.exchange.dto.enums;

public enum ExchangeStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    COMPLETED,
    // no transition leads here yet, see expiresAt on ExchangeRequest
    EXPIRED;

    public String label() {
        return name().toLowerCase();
    }
}
