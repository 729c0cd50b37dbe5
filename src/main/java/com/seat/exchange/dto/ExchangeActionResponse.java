package com.seat.exchange.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.seat.exchange.dto.enums.ExchangeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Builder
@AllArgsConstructor
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExchangeActionResponse {
    private String message;
    private UUID requestId;
    private ExchangeStatus status;
}
