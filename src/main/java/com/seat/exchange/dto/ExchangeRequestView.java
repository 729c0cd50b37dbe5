package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.ExchangeStatus;
import com.seat.exchange.models.ExchangeRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Builder
@AllArgsConstructor
@Data
public class ExchangeRequestView {
    private UUID id;
    private UUID requesterTicketId;
    private UUID targetTicketId;
    private String trainNumber;
    private LocalDate travelDate;
    private ExchangeProposal proposal;
    private ExchangeStatus status;
    private String message;
    private boolean requesterConfirmed;
    private boolean targetConfirmed;
    private LocalDateTime createdAt;
    // null when the other user's record no longer exists
    private PartySummary otherParty;

    public static ExchangeRequestView of(ExchangeRequest request, PartySummary otherParty) {
        return ExchangeRequestView.builder()
                .id(request.getId())
                .requesterTicketId(request.getRequesterTicketId())
                .targetTicketId(request.getTargetTicketId())
                .trainNumber(request.getTrainNumber())
                .travelDate(request.getTravelDate())
                .proposal(request.getProposal())
                .status(request.getStatus())
                .message(request.getMessage())
                .requesterConfirmed(request.isRequesterConfirmed())
                .targetConfirmed(request.isTargetConfirmed())
                .createdAt(request.getCreatedAt())
                .otherParty(otherParty)
                .build();
    }
}
