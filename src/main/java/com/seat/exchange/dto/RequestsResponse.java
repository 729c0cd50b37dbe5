package com.seat.exchange.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@AllArgsConstructor
@Data
public class RequestsResponse {
    private List<ExchangeRequestView> received;
    private List<ExchangeRequestView> sent;
}
