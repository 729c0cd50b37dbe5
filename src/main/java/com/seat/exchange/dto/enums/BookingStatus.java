package com.seat.exchange.dto.enums;

public enum BookingStatus {
    CNF,
    RAC,
    WL,
    RLWL,
    PQWL
}
