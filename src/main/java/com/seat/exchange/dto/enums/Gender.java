package com.seat.exchange.dto.enums;

public enum Gender {
    M,
    F,
    O
}
