package com.seat.exchange.controller;

import com.seat.exchange.dto.AdminRunResponse;
import com.seat.exchange.dto.GlobalMatchingResponse;
import com.seat.exchange.dto.StoredSuggestions;
import com.seat.exchange.dto.TripSummary;
import com.seat.exchange.dto.enums.SuggestionSource;
import com.seat.exchange.service.AdminMatchingService;
import com.seat.exchange.validation.AdminKeyValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminMatchingController {
    private static final String HEADER_ADMIN_KEY = "X-Admin-Key";

    private final AdminMatchingService adminMatchingService;
    private final AdminKeyValidator adminKeyValidator;

    @PostMapping("/run-matching")
    public ResponseEntity<AdminRunResponse> runMatching(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey,
            @RequestParam(value = "trainNumber", required = false) String trainNumber,
            @RequestParam(value = "travelDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate travelDate,
            @RequestParam(value = "minStoreScore", required = false) Double minStoreScore) {
        adminKeyValidator.verify(adminKey);
        return ResponseEntity.ok(adminMatchingService.runMatching(
                trainNumber, travelDate, minStoreScore, SuggestionSource.ADMIN_RUN));
    }

    @PostMapping("/run-global-matching")
    public CompletableFuture<ResponseEntity<GlobalMatchingResponse>> runGlobalMatching(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey,
            @RequestParam("trainNumber") String trainNumber,
            @RequestParam("travelDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate travelDate,
            @RequestParam(value = "minStoreScore", required = false) Double minStoreScore,
            @RequestParam(value = "timeLimit", required = false) Long timeLimit) {
        adminKeyValidator.verify(adminKey);
        return adminMatchingService
                .runGlobalMatching(trainNumber, travelDate, minStoreScore, timeLimit)
                .thenApply(ResponseEntity::ok);
    }

    @PostMapping("/preview-global-matching")
    public CompletableFuture<ResponseEntity<GlobalMatchingResponse>> previewGlobalMatching(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey,
            @RequestParam("trainNumber") String trainNumber,
            @RequestParam("travelDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate travelDate,
            @RequestParam(value = "timeLimit", required = false) Long timeLimit) {
        adminKeyValidator.verify(adminKey);
        return adminMatchingService
                .previewGlobalMatching(trainNumber, travelDate, timeLimit)
                .thenApply(ResponseEntity::ok);
    }

    @GetMapping("/matches/{ticketId}")
    public ResponseEntity<StoredSuggestions> storedMatches(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey,
            @PathVariable("ticketId") UUID ticketId) {
        adminKeyValidator.verify(adminKey);
        return ResponseEntity.ok(adminMatchingService.getStoredMatches(ticketId));
    }

    @GetMapping("/trips/{trainNumber}/{travelDate}/matches")
    public ResponseEntity<List<StoredSuggestions>> storedMatchesForTrip(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey,
            @PathVariable("trainNumber") String trainNumber,
            @PathVariable("travelDate") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate travelDate) {
        adminKeyValidator.verify(adminKey);
        return ResponseEntity.ok(adminMatchingService.getStoredMatchesForTrip(trainNumber, travelDate));
    }

    @GetMapping("/available-trips")
    public ResponseEntity<List<TripSummary>> availableTrips(
            @RequestHeader(value = HEADER_ADMIN_KEY, required = false) String adminKey) {
        adminKeyValidator.verify(adminKey);
        return ResponseEntity.ok(adminMatchingService.availableTrips());
    }
}
