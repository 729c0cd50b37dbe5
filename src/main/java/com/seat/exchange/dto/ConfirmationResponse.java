package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.ExchangeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Builder
@AllArgsConstructor
@Data
public class ConfirmationResponse {
    private String message;
    private ExchangeStatus status;
    private boolean requesterConfirmed;
    private boolean targetConfirmed;
}
