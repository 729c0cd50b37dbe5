package com.seat.exchange.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.models.TicketPreferences;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class MatchingPreferences {
    private boolean sameCoachOnly;
    private boolean sameBayOnly;
    @Builder.Default
    private Set<BerthType> preferredBerth = EnumSet.noneOf(BerthType.class);
    private boolean allowCyclic;
    private Double minStoreScore;

    public static MatchingPreferences defaults() {
        return MatchingPreferences.builder().build();
    }

    public static MatchingPreferences fromTicket(Ticket ticket) {
        TicketPreferences stored = ticket.getPreferences();
        if (stored == null) {
            return defaults();
        }
        return MatchingPreferences.builder()
                .sameCoachOnly(stored.isSameCoachOnly())
                .sameBayOnly(stored.isSameBayOnly())
                .preferredBerth(stored.getPreferredBerth() == null || stored.getPreferredBerth().isEmpty()
                        ? EnumSet.noneOf(BerthType.class)
                        : EnumSet.copyOf(stored.getPreferredBerth()))
                .allowCyclic(stored.isAllowCyclic())
                .minStoreScore(stored.getMinMatchScore())
                .build();
    }

    public boolean prefers(BerthType berthType) {
        return preferredBerth != null && preferredBerth.contains(berthType);
    }

    /**
     * Preferences that change scoring make a cached suggestion list unusable.
     */
    @JsonIgnore
    public boolean forcesLiveRecomputation() {
        return sameCoachOnly || (preferredBerth != null && !preferredBerth.isEmpty());
    }
}
