package com.seat.exchange.models;

import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.dto.enums.BookingStatus;
import com.seat.exchange.dto.enums.Gender;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Passenger {

    @Column(name = "passenger_id", nullable = false)
    private String passengerId;

    @Column(name = "name", nullable = false)
    private String name;

    private int age;

    @Enumerated(EnumType.STRING)
    private Gender gender;

    @Column(name = "coach", nullable = false)
    private String coach;

    @Column(name = "seat_number", nullable = false)
    private int seatNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "berth_type", nullable = false)
    private BerthType berthType;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private BookingStatus bookingStatus = BookingStatus.CNF;

    @Enumerated(EnumType.STRING)
    @Builder.Default
    private BookingStatus currentStatus = BookingStatus.CNF;

    /**
     * Bay index inside the coach, eight berths per bay.
     */
    public int bay() {
        return (seatNumber - 1) / 8;
    }
}
