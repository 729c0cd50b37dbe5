package com.seat.exchange.dto.enums;

public enum TicketStatus {
    ACTIVE,
    COMPLETED,
    CANCELLED
}
