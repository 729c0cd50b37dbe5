package com.seat.exchange.models.converters;

import com.fasterxml.jackson.core.type.TypeReference;
import com.seat.exchange.dto.ExchangeProposal;
import jakarta.persistence.Converter;

@Converter
public class ExchangeProposalConverter extends JsonColumnConverter<ExchangeProposal> {
    public ExchangeProposalConverter() {
        super(new TypeReference<>() {});
    }
}
