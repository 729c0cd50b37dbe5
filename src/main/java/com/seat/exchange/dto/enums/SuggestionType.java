package com.seat.exchange.dto.enums;

public enum SuggestionType {
    PAIR,
    CYCLE
}
