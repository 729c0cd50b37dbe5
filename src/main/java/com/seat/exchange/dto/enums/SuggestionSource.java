package com.seat.exchange.dto.enums;

public enum SuggestionSource {
    AUTO,
    ADMIN_RUN,
    ADMIN_GLOBAL_ILP
}
