package com.seat.exchange.repo;

import java.time.LocalDate;

public interface TripProjection {
    String getTrainNumber();
    LocalDate getTravelDate();
}
