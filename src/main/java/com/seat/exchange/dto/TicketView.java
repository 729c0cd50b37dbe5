package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.models.Passenger;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.models.TicketPreferences;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Builder
@AllArgsConstructor
@Data
public class TicketView {
    private UUID id;
    private String pnr;
    private String trainNumber;
    private String trainName;
    private LocalDate travelDate;
    private String boardingStation;
    private String destinationStation;
    private String classType;
    private List<Passenger> passengers;
    private TicketStatus status;
    private boolean scattered;
    private TicketPreferences preferences;

    public static TicketView of(Ticket ticket) {
        return TicketView.builder()
                .id(ticket.getId())
                .pnr(ticket.getPnr())
                .trainNumber(ticket.getTrainNumber())
                .trainName(ticket.getTrainName())
                .travelDate(ticket.getTravelDate())
                .boardingStation(ticket.getBoardingStation())
                .destinationStation(ticket.getDestinationStation())
                .classType(ticket.getClassType())
                .passengers(List.copyOf(ticket.getPassengers()))
                .status(ticket.getStatus())
                .scattered(ticket.isScattered())
                .preferences(ticket.getPreferences())
                .build();
    }
}
