package com.seat.exchange.models;

import com.seat.exchange.dto.enums.BerthType;
import com.seat.exchange.models.converters.BerthTypeSetConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Embeddable
@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class TicketPreferences {

    @Convert(converter = BerthTypeSetConverter.class)
    @Column(name = "preferred_berth")
    @Builder.Default
    private Set<BerthType> preferredBerth = EnumSet.noneOf(BerthType.class);

    @Column(name = "allow_cyclic")
    private boolean allowCyclic;

    @Column(name = "same_coach_only")
    private boolean sameCoachOnly;

    @Column(name = "same_bay_only")
    private boolean sameBayOnly;

    @Column(name = "min_match_score")
    @Builder.Default
    private double minMatchScore = 60.0;
}
