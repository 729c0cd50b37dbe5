package com.seat.exchange.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class SendExchangeRequest {
    @NotNull
    private UUID targetUserId;
    @NotNull
    private UUID targetTicketId;
    /**
     * Optional; when absent the requester's active ticket on the same train and date is used.
     */
    private UUID requesterTicketId;
    @NotNull
    private List<SeatInfo> give;
    @NotNull
    private List<SeatInfo> receive;
    private double improvementScore;
    @Size(max = 1000)
    private String message;
}
