package com.seat.exchange.models.converters;

import com.fasterxml.jackson.core.type.TypeReference;
import com.seat.exchange.dto.SuggestionEntry;
import jakarta.persistence.Converter;

import java.util.List;

@Converter
public class SuggestionEntriesConverter extends JsonColumnConverter<List<SuggestionEntry>> {
    public SuggestionEntriesConverter() {
        super(new TypeReference<>() {});
    }
}
