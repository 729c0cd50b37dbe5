package com.seat.exchange.controller;

import com.seat.exchange.dto.CreateTicketRequest;
import com.seat.exchange.dto.NoContent;
import com.seat.exchange.dto.TicketPreferencesRequest;
import com.seat.exchange.dto.TicketView;
import com.seat.exchange.dto.TogethernessResponse;
import com.seat.exchange.service.MatchingService;
import com.seat.exchange.service.TicketService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {
    private final TicketService ticketService;
    private final MatchingService matchingService;

    @PostMapping
    public ResponseEntity<TicketView> create(
            @RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId,
            @Valid @RequestBody CreateTicketRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ticketService.create(userId, request));
    }

    @GetMapping
    public ResponseEntity<List<TicketView>> list(@RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(ticketService.list(userId));
    }

    @GetMapping("/{ticketId}")
    public ResponseEntity<TicketView> get(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(ticketService.get(ticketId, userId));
    }

    @PutMapping("/{ticketId}/preferences")
    public ResponseEntity<TicketView> updatePreferences(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId,
            @Valid @RequestBody TicketPreferencesRequest preferences) {
        return ResponseEntity.ok(ticketService.updatePreferences(ticketId, userId, preferences));
    }

    @DeleteMapping("/{ticketId}")
    public ResponseEntity<NoContent> delete(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId) {
        ticketService.delete(ticketId, userId);
        return ResponseEntity.ok(new NoContent(HttpStatus.OK, "Ticket deleted successfully"));
    }

    @GetMapping("/{ticketId}/togetherness")
    public ResponseEntity<TogethernessResponse> togetherness(
            @PathVariable("ticketId") UUID ticketId,
            @RequestHeader(ExchangeController.HEADER_USER_ID) UUID userId) {
        return ResponseEntity.ok(matchingService.togetherness(ticketId, userId));
    }
}
