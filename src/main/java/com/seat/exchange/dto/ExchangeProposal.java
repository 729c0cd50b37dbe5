package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Builder
@AllArgsConstructor
@NoArgsConstructor
@Data
public class ExchangeProposal {
    @Builder.Default
    private List<SeatInfo> give = new ArrayList<>();
    @Builder.Default
    private List<SeatInfo> receive = new ArrayList<>();
    private double improvementScore;
}
