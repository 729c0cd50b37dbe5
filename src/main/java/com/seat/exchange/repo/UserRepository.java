package com.seat.exchange.repo;

import com.seat.exchange.models.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<AppUser, UUID> {

    /**
     * Single-statement increment, safe against concurrent completions sharing a user.
     */
    @Modifying
    @Query("UPDATE AppUser u SET u.totalExchanges = u.totalExchanges + 1, u.updatedAt = :now WHERE u.id IN :ids")
    int incrementTotalExchanges(@Param("ids") Collection<UUID> ids, @Param("now") LocalDateTime now);
}
