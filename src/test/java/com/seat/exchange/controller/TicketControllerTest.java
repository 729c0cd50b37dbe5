package com.seat.exchange.controller;

import com.seat.exchange.dto.TicketView;
import com.seat.exchange.dto.TogethernessResponse;
import com.seat.exchange.dto.enums.TicketStatus;
import com.seat.exchange.exceptions.BadRequestException;
import com.seat.exchange.exceptions.ResourceNotFoundException;
import com.seat.exchange.models.TicketPreferences;
import com.seat.exchange.service.MatchingService;
import com.seat.exchange.service.TicketService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TicketController.class)
class TicketControllerTest {

    private static final UUID USER = UUID.fromString("6f1c0c8e-2b9a-4f59-9a57-3d7c1e0f4a11");
    private static final UUID TICKET = UUID.fromString("0d3e8a4b-7c21-4c55-8f0e-5b2a9c6d1e22");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MatchingService matchingService;

    @MockBean
    private TicketService ticketService;

    private static final String BOOKING = "{\"pnr\": \"4521789630\", \"trainNumber\": \"12951\", "
            + "\"travelDate\": \"2025-03-14\", \"passengers\": [{\"name\": \"Asha\", \"age\": 31, "
            + "\"coach\": \"B2\", \"seatNumber\": 45, \"berthType\": \"UB\"}]}";

    private static TicketView view() {
        return TicketView.builder()
                .id(TICKET)
                .pnr("4521789630")
                .trainNumber("12951")
                .travelDate(LocalDate.of(2025, 3, 14))
                .passengers(List.of())
                .status(TicketStatus.ACTIVE)
                .preferences(new TicketPreferences())
                .build();
    }

    @Test
    void createAnswersCreatedWithTicket() throws Exception {
        when(ticketService.create(eq(USER), any())).thenReturn(view());

        mockMvc.perform(post("/api/tickets")
                        .header(ExchangeController.HEADER_USER_ID, USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(TICKET.toString()))
                .andExpect(jsonPath("$.pnr").value("4521789630"));
    }

    @Test
    void createWithoutPassengersIsRejected() throws Exception {
        mockMvc.perform(post("/api/tickets")
                        .header(ExchangeController.HEADER_USER_ID, USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pnr\": \"4521789630\", \"trainNumber\": \"12951\", "
                                + "\"travelDate\": \"2025-03-14\", \"passengers\": []}"))
                .andExpect(status().isBadRequest());
        verify(ticketService, never()).create(any(), any());
    }

    @Test
    void duplicatePnrIsBadRequest() throws Exception {
        when(ticketService.create(eq(USER), any()))
                .thenThrow(new BadRequestException("Ticket with this PNR already exists"));

        mockMvc.perform(post("/api/tickets")
                        .header(ExchangeController.HEADER_USER_ID, USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOOKING))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listReturnsCallerTickets() throws Exception {
        when(ticketService.list(USER)).thenReturn(List.of(view()));

        mockMvc.perform(get("/api/tickets").header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(TICKET.toString()));
    }

    @Test
    void getReturnsOneTicket() throws Exception {
        when(ticketService.get(TICKET, USER)).thenReturn(view());

        mockMvc.perform(get("/api/tickets/{ticketId}", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"));
    }

    @Test
    void preferencesUpdateReturnsTicket() throws Exception {
        when(ticketService.updatePreferences(eq(TICKET), eq(USER), any())).thenReturn(view());

        mockMvc.perform(put("/api/tickets/{ticketId}/preferences", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sameCoachOnly\": true, \"minMatchScore\": 75}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(TICKET.toString()));
    }

    @Test
    void preferencesOutOfRangeAreRejected() throws Exception {
        mockMvc.perform(put("/api/tickets/{ticketId}/preferences", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"minMatchScore\": 150}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void deleteConfirmsRemoval() throws Exception {
        mockMvc.perform(delete("/api/tickets/{ticketId}", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.msg").value("Ticket deleted successfully"));
        verify(ticketService).delete(TICKET, USER);
    }

    @Test
    void deleteWithOpenExchangeIsBadRequest() throws Exception {
        doThrow(new BadRequestException("Ticket has an open exchange request"))
                .when(ticketService).delete(TICKET, USER);

        mockMvc.perform(delete("/api/tickets/{ticketId}", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isBadRequest());
    }

    @Test
    void togethernessReportsScatteredGroup() throws Exception {
        when(matchingService.togetherness(TICKET, USER)).thenReturn(TogethernessResponse.builder()
                .ticketId(TICKET)
                .scattered(true)
                .score(70.0)
                .coaches(Set.of("B2", "B3"))
                .build());

        mockMvc.perform(get("/api/tickets/{ticketId}/togetherness", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scattered").value(true))
                .andExpect(jsonPath("$.score").value(70.0));
    }

    @Test
    void foreignTicketIsNotFound() throws Exception {
        when(matchingService.togetherness(TICKET, USER))
                .thenThrow(new ResourceNotFoundException("Ticket not found: " + TICKET));

        mockMvc.perform(get("/api/tickets/{ticketId}/togetherness", TICKET)
                        .header(ExchangeController.HEADER_USER_ID, USER.toString()))
                .andExpect(status().isNotFound());
    }

    @Test
    void missingUserHeaderIsRejected() throws Exception {
        mockMvc.perform(get("/api/tickets/{ticketId}/togetherness", TICKET))
                .andExpect(status().isBadRequest());
    }
}
