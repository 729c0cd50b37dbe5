package com.seat.exchange.cache;

import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.models.MatchSuggestion;
import com.seat.exchange.models.converters.SuggestionEntriesConverter;
import com.seat.exchange.repo.MatchSuggestionRepository;
import com.seat.exchange.utils.basic.DefaultValuesPopulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;


@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "exchange.suggestions.store", havingValue = "jpa", matchIfMissing = true)
public class JpaSuggestionStore implements SuggestionStore {
    private static final SuggestionEntriesConverter ENTRIES_CONVERTER = new SuggestionEntriesConverter();

    private final MatchSuggestionRepository matchSuggestionRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredSuggestions> get(UUID ticketId) {
        return matchSuggestionRepository.findByTicketId(ticketId).map(JpaSuggestionStore::toStored);
    }

    /**
     * Single-statement upsert, so concurrent first writes for a ticket settle on the last one instead of
     * colliding on the unique ticket index.
     */
    @Override
    public StoredSuggestions put(UUID ticketId, String trainNumber, LocalDate travelDate,
                                 List<SuggestionEntry> entries, SuggestionSource source) {
        LocalDateTime createdAt = DefaultValuesPopulator.getCurrentTimestamp();
        matchSuggestionRepository.upsert(UUID.randomUUID(), ticketId, trainNumber, travelDate,
                ENTRIES_CONVERTER.convertToDatabaseColumn(entries), source.name(), createdAt);
        log.debug("Stored {} suggestions for ticketId={} source={}", entries.size(), ticketId, source);
        return StoredSuggestions.builder()
                .ticketId(ticketId)
                .trainNumber(trainNumber)
                .travelDate(travelDate)
                .entries(List.copyOf(entries))
                .source(source)
                .createdAt(createdAt)
                .build();
    }

    @Override
    public boolean delete(UUID ticketId) {
        return matchSuggestionRepository.deleteByTicketId(ticketId) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredSuggestions> findByTrip(String trainNumber, LocalDate travelDate) {
        return matchSuggestionRepository.findByTrainNumberAndTravelDate(trainNumber, travelDate).stream()
                .map(JpaSuggestionStore::toStored)
                .toList();
    }

    private static StoredSuggestions toStored(MatchSuggestion suggestion) {
        return StoredSuggestions.builder()
                .ticketId(suggestion.getTicketId())
                .trainNumber(suggestion.getTrainNumber())
                .travelDate(suggestion.getTravelDate())
                .entries(List.copyOf(suggestion.getSuggestions()))
                .source(suggestion.getSource())
                .createdAt(suggestion.getCreatedAt())
                .build();
    }
}
