package com.seat.exchange.controller;

import com.seat.exchange.dto.BatchFindMatchesRequest;
import com.seat.exchange.dto.ConfirmationResponse;
import com.seat.exchange.dto.ExchangeActionResponse;
import com.seat.exchange.dto.FindMatchesResponse;
import com.seat.exchange.dto.MatchingPreferences;
import com.seat.exchange.dto.RequestsResponse;
import com.seat.exchange.dto.SendExchangeRequest;
import com.seat.exchange.dto.SuggestionEntry;
import com.seat.exchange.service.ExchangeService;
import com.seat.exchange.service.MatchingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/exchange")
@RequiredArgsConstructor
public class ExchangeController {
    static final String HEADER_USER_ID = "X-User-Id";

    private final MatchingService matchingService;
    private final ExchangeService exchangeService;

    /**
     * Matches for one of the caller's tickets, from the suggestion store when possible.
     * {@code useAiEnhancement} is accepted and has no effect.
     */
    @PostMapping("/find-matches/{ticketId}")
    public ResponseEntity<FindMatchesResponse> findMatches(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(HEADER_USER_ID) UUID userId,
            @RequestParam(value = "forceLive", defaultValue = "false") boolean forceLive,
            @RequestParam(value = "useAiEnhancement", defaultValue = "false") boolean useAiEnhancement,
            @RequestBody(required = false) MatchingPreferences preferences) {
        return ResponseEntity.ok(matchingService.findMatches(ticketId, userId, preferences, forceLive));
    }

    @PostMapping("/batch-find-matches")
    public ResponseEntity<Map<UUID, List<SuggestionEntry>>> batchFindMatches(
            @RequestHeader(HEADER_USER_ID) UUID userId,
            @Valid @RequestBody BatchFindMatchesRequest request) {
        return ResponseEntity.ok(matchingService.batchFindMatches(request.getTicketIds(), userId));
    }

    @PostMapping("/request")
    public ResponseEntity<ExchangeActionResponse> sendRequest(
            @RequestHeader(HEADER_USER_ID) UUID userId,
            @Valid @RequestBody SendExchangeRequest request) {
        return ResponseEntity.ok(exchangeService.create(userId, request));
    }

    @GetMapping("/requests")
    public ResponseEntity<RequestsResponse> listRequests(@RequestHeader(HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(exchangeService.list(userId));
    }

    @PostMapping("/requests/{requestId}/accept")
    public ResponseEntity<ExchangeActionResponse> accept(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(exchangeService.accept(requestId, userId));
    }

    @PostMapping("/requests/{requestId}/decline")
    public ResponseEntity<ExchangeActionResponse> decline(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(exchangeService.decline(requestId, userId));
    }

    @PostMapping("/requests/{requestId}/confirm")
    public ResponseEntity<ConfirmationResponse> confirm(
            @PathVariable("requestId") UUID requestId,
            @RequestHeader(HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(exchangeService.confirm(requestId, userId));
    }
}
