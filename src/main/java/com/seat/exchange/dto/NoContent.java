package com.seat.exchange.dto;

import lombok.*;
import org.springframework.http.HttpStatus;

/**
 * Acknowledgement body for operations that return no resource.
 */
@Getter
@Setter
@ToString
@AllArgsConstructor
@NoArgsConstructor
public class NoContent {
    private HttpStatus status;
    private String msg;
}
