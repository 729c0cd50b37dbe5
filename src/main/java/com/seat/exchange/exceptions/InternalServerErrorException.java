package com.seat.exchange.exceptions;

/**
 * Exception thrown when an internal server error occurs.
 * <p>
 * Used for unexpected conditions that are not related to the client's request.
 * </p>
 */
public class InternalServerErrorException extends RuntimeException {

    /**
     * Constructs a new {@link InternalServerErrorException} with the specified error message.
     *
     * @param m the detail message explaining the error.
     */
    public InternalServerErrorException(String m) {
        super(m);
    }
}
