package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.models.Passenger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time copy of a passenger seat, detached from the live ticket.
 */
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class SeatInfo {
    private String passengerId;
    private String passengerName;
    private String coach;
    private int seatNumber;
    private BerthType berthType;

    public static SeatInfo of(Passenger passenger) {
        return SeatInfo.builder()
                .passengerId(passenger.getPassengerId())
                .passengerName(passenger.getName())
                .coach(passenger.getCoach())
                .seatNumber(passenger.getSeatNumber())
                .berthType(passenger.getBerthType())
                .build();
    }
}
