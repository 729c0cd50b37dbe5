package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.Set;
import java.util.UUID;

@Builder
@AllArgsConstructor
@Data
public class TogethernessResponse {
    private UUID ticketId;
    private boolean scattered;
    private double score;
    private Set<String> coaches;
}
