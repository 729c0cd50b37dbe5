package com.seat.exchange.models;

import com.seat.exchange.dto.ExchangeProposal;
import com.seat.exchange.dto.enums.ExchangeStatus;
import com.seat.exchange.models.converters.ExchangeProposalConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "exchange_requests", indexes = {
        @Index(name = "idx_exchange_requester_id", columnList = "requester_id"),
        @Index(name = "idx_exchange_target_user_id", columnList = "target_user_id"),
        @Index(name = "idx_exchange_trip", columnList = "train_number,travel_date"),
        @Index(name = "idx_exchange_status", columnList = "status")
})
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class ExchangeRequest {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "requester_id", nullable = false)
    private UUID requesterId;

    @Column(name = "requester_ticket_id", nullable = false)
    private UUID requesterTicketId;

    @Column(name = "target_user_id", nullable = false)
    private UUID targetUserId;

    @Column(name = "target_ticket_id", nullable = false)
    private UUID targetTicketId;

    @Column(name = "train_number", nullable = false)
    private String trainNumber;

    @Column(name = "travel_date", nullable = false)
    private LocalDate travelDate;

    @Convert(converter = ExchangeProposalConverter.class)
    @Column(columnDefinition = "text", nullable = false)
    private ExchangeProposal proposal;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private ExchangeStatus status = ExchangeStatus.PENDING;

    @Column(length = 1000)
    private String message;

    private boolean requesterConfirmed;

    private boolean targetConfirmed;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    // reserved, nothing sets or enforces it yet
    private LocalDateTime expiresAt;

    @Version
    private Long version;

    public boolean isParty(UUID userId) {
        return requesterId.equals(userId) || targetUserId.equals(userId);
    }

    public boolean canComplete() {
        return requesterConfirmed && targetConfirmed;
    }
}
