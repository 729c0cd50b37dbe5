package com.seat.exchange.models.converters;

import com.seat.exchange.dto.ExchangeProposal;
import com.seat.exchange.dto.SeatInfo;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.dto.enums.SuggestionType;
import com.seat.exchange.exceptions.InternalServerErrorException;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonColumnConverterTest {

    @Test
    void suggestionEntriesKeepTheirType() {
        SuggestionEntriesConverter converter = new SuggestionEntriesConverter();
        List<SuggestionEntry> entries = List.of(SuggestionEntry.builder()
                .type(SuggestionType.CYCLE)
                .cycleTicketIds(List.of(UUID.randomUUID(), UUID.randomUUID()))
                .score(120.0)
                .description("Mutual seat swap between 2 tickets")
                .build());

        String json = converter.convertToDatabaseColumn(entries);

        assertThat(json).doesNotContain("userName");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(entries);
    }

    @Test
    void proposalIsReadBack() {
        ExchangeProposalConverter converter = new ExchangeProposalConverter();
        ExchangeProposal proposal = new ExchangeProposal(
                List.of(SeatInfo.builder().coach("B2").seatNumber(10).berthType(BerthType.UB).build()),
                List.of(SeatInfo.builder().coach("B2").seatNumber(11).berthType(BerthType.LB).build()),
                42.0);

        assertThat(converter.convertToEntityAttribute(converter.convertToDatabaseColumn(proposal))).isEqualTo(proposal);
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }

    @Test
    void corruptColumnFailsLoudly() {
        assertThatThrownBy(() -> new ExchangeProposalConverter().convertToEntityAttribute("{not json"))
                .isInstanceOf(InternalServerErrorException.class);
    }

    @Test
    void berthSetIsStoredSorted() {
        BerthTypeSetConverter converter = new BerthTypeSetConverter();

        assertThat(converter.convertToDatabaseColumn(EnumSet.of(BerthType.UB, BerthType.LB))).isEqualTo("LB,UB");
        assertThat(converter.convertToEntityAttribute(" LB , SL ")).containsExactlyInAnyOrder(BerthType.LB, BerthType.SL);
        assertThat(converter.convertToEntityAttribute(null)).isEmpty();
    }
}
