package com.seat.exchange.models;

import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.models.converters.SuggestionEntriesConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "match_suggestions", indexes = {
        @Index(name = "idx_match_suggestion_ticket_id", columnList = "ticket_id", unique = true),
        @Index(name = "idx_match_suggestion_trip", columnList = "train_number,travel_date")
})
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MatchSuggestion {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "ticket_id", nullable = false)
    private UUID ticketId;

    @Column(name = "train_number")
    private String trainNumber;

    @Column(name = "travel_date")
    private LocalDate travelDate;

    @Convert(converter = SuggestionEntriesConverter.class)
    @Column(columnDefinition = "text", nullable = false)
    @Builder.Default
    private List<SuggestionEntry> suggestions = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private SuggestionSource source = SuggestionSource.AUTO;

    private LocalDateTime createdAt;
}
