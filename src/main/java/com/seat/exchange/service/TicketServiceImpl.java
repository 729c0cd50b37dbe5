package com.seat.exchange.service;

import com.seat.exchange.cache.SuggestionStore;
import com.seat.exchange.dto.CreateTicketRequest;
import com.seat.exchange.dto.PassengerRequest;
import com.seat.exchange.dto.TicketPreferencesRequest;
import com.seat.exchange.dto.TicketView;
import com.seat.exchange.dto.enums.BookingStatus;
import com.seat.exchange.dto.enums.ExchangeStatus;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.BadRequestException;
import com.seat.exchange.exceptions.ResourceNotFoundException;
import com.seat.exchange.models.Passenger;
import com.seat.exchange.models.Ticket;
import com.seat.exchange.models.TicketPreferences;
import com.seat.exchange.repo.ExchangeRequestRepository;
import com.seat.exchange.repo.TicketRepository;
import com.seat.exchange.utils.basic.DefaultValuesPopulator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class TicketServiceImpl implements TicketService {
    private static final Set<ExchangeStatus> OPEN_EXCHANGE = EnumSet.of(ExchangeStatus.PENDING, ExchangeStatus.ACCEPTED);

    private final TicketRepository ticketRepository;
    private final ExchangeRequestRepository exchangeRequestRepository;
    private final SuggestionStore suggestionStore;

    public TicketServiceImpl(
            TicketRepository ticketRepository,
            ExchangeRequestRepository exchangeRequestRepository,
            SuggestionStore suggestionStore
    ) {
        this.ticketRepository = ticketRepository;
        this.exchangeRequestRepository = exchangeRequestRepository;
        this.suggestionStore = suggestionStore;
    }

    @Override
    @Transactional
    public TicketView create(UUID userId, CreateTicketRequest request) {
        if (ticketRepository.existsByUserIdAndPnr(userId, request.getPnr())) {
            throw new BadRequestException("Ticket with this PNR already exists");
        }

        List<Passenger> passengers = new ArrayList<>();
        for (PassengerRequest p : request.getPassengers()) {
            passengers.add(Passenger.builder()
                    .passengerId(UUID.randomUUID().toString())
                    .name(p.getName())
                    .age(p.getAge())
                    .gender(p.getGender())
                    .coach(p.getCoach())
                    .seatNumber(p.getSeatNumber())
                    .berthType(p.getBerthType())
                    .bookingStatus(p.getBookingStatus() == null ? BookingStatus.CNF : p.getBookingStatus())
                    .currentStatus(p.getCurrentStatus() == null ? BookingStatus.CNF : p.getCurrentStatus())
                    .build());
        }

        Ticket ticket = Ticket.builder()
                .userId(userId)
                .pnr(request.getPnr())
                .trainNumber(request.getTrainNumber())
                .trainName(request.getTrainName())
                .travelDate(request.getTravelDate())
                .boardingStation(request.getBoardingStation())
                .destinationStation(request.getDestinationStation())
                .classType(request.getClassType())
                .passengers(passengers)
                .status(TicketStatus.ACTIVE)
                .preferences(request.getPreferences() == null
                        ? new TicketPreferences()
                        : request.getPreferences().toPreferences())
                .build();
        ticket.validateSeats();

        Ticket saved = ticketRepository.save(ticket);
        log.info("Ticket created: ticketId={}, userId={}, trainNumber={}, travelDate={}, passengers={}",
                saved.getId(), userId, saved.getTrainNumber(), saved.getTravelDate(), passengers.size());
        return TicketView.of(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<TicketView> list(UUID userId) {
        return ticketRepository.findByUserIdOrderByTravelDateAsc(userId).stream()
                .map(TicketView::of)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public TicketView get(UUID ticketId, UUID userId) {
        return TicketView.of(ownedTicket(ticketId, userId));
    }

    @Override
    @Transactional
    public TicketView updatePreferences(UUID ticketId, UUID userId, TicketPreferencesRequest preferences) {
        Ticket ticket = ownedTicket(ticketId, userId);
        ticket.setPreferences(preferences.toPreferences());
        ticket.setUpdatedAt(DefaultValuesPopulator.getCurrentTimestamp());
        Ticket saved = ticketRepository.save(ticket);

        if (suggestionStore.delete(ticketId)) {
            log.info("Dropped stored suggestions after preference change: ticketId={}", ticketId);
        }
        return TicketView.of(saved);
    }

    @Override
    @Transactional
    public void delete(UUID ticketId, UUID userId) {
        Ticket ticket = ownedTicket(ticketId, userId);
        if (exchangeRequestRepository.existsForTicketWithStatusIn(ticketId, OPEN_EXCHANGE)) {
            throw new BadRequestException("Ticket has an open exchange request");
        }
        ticketRepository.delete(ticket);
        suggestionStore.delete(ticketId);
        log.info("Ticket deleted: ticketId={}, userId={}", ticketId, userId);
    }

    private Ticket ownedTicket(UUID ticketId, UUID userId) {
        return ticketRepository.findById(ticketId)
                .filter(t -> t.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Ticket not found: " + ticketId));
    }
}
