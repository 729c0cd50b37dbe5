package com.seat.exchange.models;

import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.BadRequestException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

@Entity
@Table(name = "tickets", indexes = {
        @Index(name = "idx_ticket_user_id", columnList = "user_id"),
        @Index(name = "idx_ticket_pnr", columnList = "pnr"),
        @Index(name = "idx_ticket_trip", columnList = "train_number,travel_date,status")
})
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class Ticket {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(nullable = false)
    private String pnr;

    @Column(name = "train_number", nullable = false)
    private String trainNumber;

    @Column(name = "train_name")
    private String trainName;

    @Column(name = "travel_date", nullable = false)
    private LocalDate travelDate;

    @Column(name = "boarding_station")
    private String boardingStation;

    @Column(name = "destination_station")
    private String destinationStation;

    @Column(name = "class_type")
    private String classType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ticket_passengers", joinColumns = @JoinColumn(name = "ticket_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<Passenger> passengers = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private TicketStatus status = TicketStatus.ACTIVE;

    @Embedded
    @Builder.Default
    private TicketPreferences preferences = new TicketPreferences();

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isScattered() {
        return getCoaches().size() > 1;
    }

    public Set<String> getCoaches() {
        Set<String> coaches = new TreeSet<>();
        passengers.forEach(p -> coaches.add(p.getCoach()));
        return coaches;
    }

    /**
     * Rejects a passenger list holding the same coach and seat twice.
     */
    public void validateSeats() {
        Set<String> seen = new HashSet<>();
        for (Passenger p : passengers) {
            if (!seen.add(p.getCoach() + ":" + p.getSeatNumber())) {
                throw new BadRequestException(
                        "Duplicate seat " + p.getCoach() + "/" + p.getSeatNumber() + " on ticket " + pnr);
            }
        }
    }

    @PrePersist
    @PreUpdate
    void touch() {
        validateSeats();
        LocalDateTime now = LocalDateTime.now();
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }
}
