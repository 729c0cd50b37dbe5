package com.seat.exchange.dto.enums;

/**
 * Berth categories with their desirability rank, higher is better.
 */
public enum BerthType {
    LB(5),
    SL(4),
    MB(3),
    SU(2),
    UB(1);

    private final int rank;

    BerthType(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean outranks(BerthType other) {
        return other == null || rank > other.rank;
    }
}
