package com.seat.exchange.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.utils.basic.DefaultValuesPopulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;


/**
 * Caffeine-backed store for deployments without a suggestions table. Entries expire after the configured TTL.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "exchange.suggestions.store", havingValue = "memory")
public class InMemorySuggestionStore implements SuggestionStore {
    private final Cache<UUID, StoredSuggestions> cache;

    public InMemorySuggestionStore(@Qualifier("suggestionCache") Cache<UUID, StoredSuggestions> cache) {
        this.cache = cache;
    }

    @Override
    public Optional<StoredSuggestions> get(UUID ticketId) {
        return Optional.ofNullable(cache.getIfPresent(ticketId));
    }

    @Override
    public StoredSuggestions put(UUID ticketId, String trainNumber, LocalDate travelDate,
                                 List<SuggestionEntry> entries, SuggestionSource source) {
        StoredSuggestions stored = StoredSuggestions.builder()
                .ticketId(ticketId)
                .trainNumber(trainNumber)
                .travelDate(travelDate)
                .entries(List.copyOf(entries))
                .source(source)
                .createdAt(DefaultValuesPopulator.getCurrentTimestamp())
                .build();
        cache.put(ticketId, stored);
        return stored;
    }

    @Override
    public boolean delete(UUID ticketId) {
        return cache.asMap().remove(ticketId) != null;
    }

    @Override
    public List<StoredSuggestions> findByTrip(String trainNumber, LocalDate travelDate) {
        return cache.asMap().values().stream()
                .filter(s -> Objects.equals(s.getTrainNumber(), trainNumber) && Objects.equals(s.getTravelDate(), travelDate))
                .toList();
    }
}
