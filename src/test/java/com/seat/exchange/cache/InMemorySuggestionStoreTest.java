package com.seat.exchange.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.dto.enums.SuggestionType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static com.seat.exchange.TestFixtures.DATE;
import static com.seat.exchange.TestFixtures.TRAIN;
import static org.assertj.core.api.Assertions.assertThat;

class InMemorySuggestionStoreTest {

    private final InMemorySuggestionStore store = new InMemorySuggestionStore(
            Caffeine.newBuilder().maximumSize(100).<UUID, StoredSuggestions>build());

    private static SuggestionEntry entry(double score) {
        return SuggestionEntry.builder()
                .type(SuggestionType.PAIR)
                .ticketId(UUID.randomUUID())
                .score(score)
                .description("Same coach (B2)")
                .build();
    }

    @Test
    void putThenGetReturnsEntries() {
        UUID ticketId = UUID.randomUUID();
        List<SuggestionEntry> entries = List.of(entry(80), entry(60));

        store.put(ticketId, TRAIN, DATE, entries, SuggestionSource.ADMIN_RUN);

        assertThat(store.get(ticketId)).hasValueSatisfying(s -> {
            assertThat(s.getEntries()).isEqualTo(entries);
            assertThat(s.getSource()).isEqualTo(SuggestionSource.ADMIN_RUN);
            assertThat(s.getCreatedAt()).isNotNull();
        });
    }

    @Test
    void lastWriteWins() {
        UUID ticketId = UUID.randomUUID();
        store.put(ticketId, TRAIN, DATE, List.of(entry(90)), SuggestionSource.AUTO);
        List<SuggestionEntry> latest = List.of(entry(55));

        store.put(ticketId, TRAIN, DATE, latest, SuggestionSource.ADMIN_GLOBAL_ILP);

        assertThat(store.get(ticketId)).hasValueSatisfying(s -> {
            assertThat(s.getEntries()).isEqualTo(latest);
            assertThat(s.getSource()).isEqualTo(SuggestionSource.ADMIN_GLOBAL_ILP);
        });
    }

    @Test
    void deleteReportsWhetherSomethingWasRemoved() {
        UUID ticketId = UUID.randomUUID();
        store.put(ticketId, TRAIN, DATE, List.of(entry(70)), SuggestionSource.AUTO);

        assertThat(store.delete(ticketId)).isTrue();
        assertThat(store.delete(ticketId)).isFalse();
        assertThat(store.get(ticketId)).isEmpty();
    }

    @Test
    void findByTripFiltersOnTrainAndDate() {
        store.put(UUID.randomUUID(), TRAIN, DATE, List.of(entry(70)), SuggestionSource.AUTO);
        store.put(UUID.randomUUID(), "22222", DATE, List.of(entry(70)), SuggestionSource.AUTO);
        store.put(UUID.randomUUID(), TRAIN, DATE.plusDays(1), List.of(entry(70)), SuggestionSource.AUTO);

        assertThat(store.findByTrip(TRAIN, DATE)).hasSize(1);
    }
}
