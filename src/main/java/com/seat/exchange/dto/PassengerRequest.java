package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.dto.enums.BookingStatus;
import com.seat.exchange.dto.enums.Gender;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class PassengerRequest {
    @NotBlank
    private String name;
    @Min(0)
    private int age;
    private Gender gender;
    @NotBlank
    private String coach;
    @Positive
    private int seatNumber;
    @NotNull
    private BerthType berthType;
    private BookingStatus bookingStatus;
    private BookingStatus currentStatus;
}
