package com.seat.exchange.repo;

import com.seat.exchange.models.MatchSuggestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface MatchSuggestionRepository extends JpaRepository<MatchSuggestion, UUID> {
    Optional<MatchSuggestion> findByTicketId(UUID ticketId);

    List<MatchSuggestion> findByTrainNumberAndTravelDate(String trainNumber, LocalDate travelDate);

    /**
     * Inserts or replaces the row for a ticket in one statement; {@code id} is only used on insert.
     */
    @Modifying
    @Transactional
    @Query(value = "INSERT INTO match_suggestions (id, ticket_id, train_number, travel_date, suggestions, source, created_at) \n" +
            "VALUES (:id, :ticketId, :trainNumber, :travelDate, :suggestions, :source, :createdAt) \n" +
            "ON CONFLICT (ticket_id) DO UPDATE SET \n" +
            "train_number = EXCLUDED.train_number, travel_date = EXCLUDED.travel_date, \n" +
            "suggestions = EXCLUDED.suggestions, source = EXCLUDED.source, created_at = EXCLUDED.created_at",
            nativeQuery = true)
    int upsert(@Param("id") UUID id,
               @Param("ticketId") UUID ticketId,
               @Param("trainNumber") String trainNumber,
               @Param("travelDate") LocalDate travelDate,
               @Param("suggestions") String suggestions,
               @Param("source") String source,
               @Param("createdAt") LocalDateTime createdAt);

    @Modifying
    @Transactional
    @Query("DELETE FROM MatchSuggestion s WHERE s.ticketId = :ticketId")
    int deleteByTicketId(UUID ticketId);
}
