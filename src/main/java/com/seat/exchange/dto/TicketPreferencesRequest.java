package com.seat.exchange.dto;

import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.models.TicketPreferences;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
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
public class TicketPreferencesRequest {
    private Set<BerthType> preferredBerth;
    private boolean allowCyclic;
    private boolean sameCoachOnly;
    private boolean sameBayOnly;
    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double minMatchScore;

    public TicketPreferences toPreferences() {
        TicketPreferences preferences = new TicketPreferences();
        preferences.setPreferredBerth(preferredBerth == null || preferredBerth.isEmpty()
                ? EnumSet.noneOf(BerthType.class)
                : EnumSet.copyOf(preferredBerth));
        preferences.setAllowCyclic(allowCyclic);
        preferences.setSameCoachOnly(sameCoachOnly);
        preferences.setSameBayOnly(sameBayOnly);
        if (minMatchScore != null) {
            preferences.setMinMatchScore(minMatchScore);
        }
        return preferences;
    }
}
