package com.seat.exchange.service;

import com.seat.exchange.dto.ConfirmationResponse;
import com.seat.exchange.dto.ExchangeActionResponse;
import com.seat.exchange.dto.RequestsResponse;
import com.seat.exchange.dto.SendExchangeRequest;

import java.util.UUID;

/**
 * Exchange request lifecycle: pending, then accepted or declined, then completed once both parties confirm.
 */
public interface ExchangeService {
    ExchangeActionResponse create(UUID requesterId, SendExchangeRequest request);

    RequestsResponse list(UUID userId);

    ExchangeActionResponse accept(UUID requestId, UUID userId);

    ExchangeActionResponse decline(UUID requestId, UUID userId);

    ConfirmationResponse confirm(UUID requestId, UUID userId);
}
