package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@AllArgsConstructor
@Data
public class TripSummary {
    private String trainNumber;
    private List<LocalDate> travelDates;
}
