package com.seat.exchange.service;

import com.seat.exchange.dto.CreateTicketRequest;
import com.seat.exchange.dto.TicketPreferencesRequest;
import com.seat.exchange.dto.TicketView;

import java.util.List;
import java.util.UUID;

public interface TicketService {
    TicketView create(UUID userId, CreateTicketRequest request);

    List<TicketView> list(UUID userId);

    TicketView get(UUID ticketId, UUID userId);

    /**
     * Replaces the ticket's matching preferences and drops suggestions stored under the old ones.
     */
    TicketView updatePreferences(UUID ticketId, UUID userId, TicketPreferencesRequest preferences);

    /**
     * Removes the ticket unless a pending or accepted exchange request still references it.
     */
    void delete(UUID ticketId, UUID userId);
}
