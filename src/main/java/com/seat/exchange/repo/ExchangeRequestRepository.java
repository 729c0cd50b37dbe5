package com.seat.exchange.repo;

import com.seat.exchange.dto.enums.ExchangeStatus;
import com.seat.exchange.models.ExchangeRequest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ExchangeRequestRepository extends JpaRepository<ExchangeRequest, UUID> {
    List<ExchangeRequest> findByTargetUserIdOrderByCreatedAtDesc(UUID targetUserId);

    List<ExchangeRequest> findByRequesterIdOrderByCreatedAtDesc(UUID requesterId);

    @Query("SELECT COUNT(r) > 0 FROM ExchangeRequest r " +
            "WHERE (r.requesterTicketId = :ticketId OR r.targetTicketId = :ticketId) AND r.status IN :statuses")
    boolean existsForTicketWithStatusIn(@Param("ticketId") UUID ticketId,
                                        @Param("statuses") Collection<ExchangeStatus> statuses);
}
