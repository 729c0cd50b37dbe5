package com.seat.exchange.exceptions;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Custom exception thrown when a bad request is made (HTTP 400).
 * <p>
 * Signals invalid data or a transition the current state does not allow.
 * </p>
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class BadRequestException extends RuntimeException {

    /**
     * Constructs a new BadRequestException with the specified detail message.
     *
     * @param message the detail message which explains the cause of the exception.
     */
    public BadRequestException(String message) {
        super(message);
    }
}
