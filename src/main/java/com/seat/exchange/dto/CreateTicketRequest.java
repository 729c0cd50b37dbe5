package com.seat.exchange.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class CreateTicketRequest {
    @NotBlank
    private String pnr;
    @NotBlank
    private String trainNumber;
    private String trainName;
    @NotNull
    private LocalDate travelDate;
    private String boardingStation;
    private String destinationStation;
    private String classType;
    @NotEmpty
    @Valid
    private List<PassengerRequest> passengers;
    /**
     * Optional; defaults apply when absent.
     */
    @Valid
    private TicketPreferencesRequest preferences;
}
