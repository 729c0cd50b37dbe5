package com.seat.exchange.repo;

import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.models.Ticket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TicketRepository extends JpaRepository<Ticket, UUID> {

    List<Ticket> findByTrainNumberAndTravelDateAndStatusAndUserIdNot(
            String trainNumber, LocalDate travelDate, TicketStatus status, UUID excludedUserId);

    List<Ticket> findByTrainNumberAndTravelDateAndStatus(String trainNumber, LocalDate travelDate, TicketStatus status);

    List<Ticket> findByTrainNumberAndStatus(String trainNumber, TicketStatus status);

    List<Ticket> findByTravelDateAndStatus(LocalDate travelDate, TicketStatus status);

    List<Ticket> findByStatus(TicketStatus status);

    List<Ticket> findByUserIdOrderByTravelDateAsc(UUID userId);

    boolean existsByUserIdAndPnr(UUID userId, String pnr);

    Optional<Ticket> findFirstByUserIdAndTrainNumberAndTravelDateAndStatus(
            UUID userId, String trainNumber, LocalDate travelDate, TicketStatus status);

    @Query("SELECT DISTINCT t.trainNumber AS trainNumber, t.travelDate AS travelDate FROM Ticket t " +
            "WHERE t.status = :status ORDER BY t.trainNumber ASC, t.travelDate ASC")
    List<TripProjection> findDistinctTrips(TicketStatus status);
}
