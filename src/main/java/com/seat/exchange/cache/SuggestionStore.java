package com.seat.exchange.cache;

import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.SuggestionSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Precomputed suggestions keyed by ticket. Writes replace the whole entry; concurrent writers race and the last one wins.
 */
public interface SuggestionStore {

    Optional<StoredSuggestions> get(UUID ticketId);

    StoredSuggestions put(UUID ticketId, String trainNumber, LocalDate travelDate,
                          List<SuggestionEntry> entries, SuggestionSource source);

    boolean delete(UUID ticketId);

    List<StoredSuggestions> findByTrip(String trainNumber, LocalDate travelDate);
}
