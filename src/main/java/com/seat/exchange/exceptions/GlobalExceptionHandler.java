package com.seat.exchange.exceptions;

import com.seat.exchange.models.Error;
import com.seat.exchange.utils.basic.ErrorUtility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.concurrent.CompletionException;


/**
 * Global exception handler for handling various exceptions in the application.
 * <p>
 * Each exception type is mapped to a specific HTTP status code and an {@link Error} body.
 * </p>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Handles {@link BadRequestException} and returns a HTTP 400 Bad Request response with the error details.
     *
     * @param e the {@link BadRequestException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 400 status.
     */
    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> handleBadRequestException(BadRequestException e) {
        return respond(e.getMessage(), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles {@link ResourceNotFoundException} and returns a HTTP 404 Not Found response.
     *
     * @param e the {@link ResourceNotFoundException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 404 status.
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Error> handleNotFoundException(ResourceNotFoundException e) {
        return respond(e.getMessage(), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles {@link ForbiddenException} and returns a HTTP 403 Forbidden response.
     *
     * @param e the {@link ForbiddenException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 403 status.
     */
    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<Error> handleForbiddenException(ForbiddenException e) {
        return respond(e.getMessage(), HttpStatus.FORBIDDEN);
    }

    /**
     * Handles {@link MethodArgumentNotValidException} and returns a HTTP 400 Bad Request response with validation errors.
     *
     * @param ex the {@link MethodArgumentNotValidException} to be handled.
     * @return a {@link ResponseEntity} containing the validation errors and a HTTP 400 status.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> handleValidationException(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        StringBuilder errorMessage = new StringBuilder("Invalid request parameters:");

        for (FieldError fieldError : bindingResult.getFieldErrors()) {
            errorMessage.append(" Field '").append(fieldError.getField())
                    .append("' ").append(fieldError.getDefaultMessage()).append("; ");
        }
        return respond(errorMessage.toString(), HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Error> handleMalformedRequest(Exception e) {
        return respond(e.getMessage(), HttpStatus.BAD_REQUEST);
    }

    /**
     * Unwraps failures surfaced from async pipelines so the domain exception decides the status.
     *
     * @param e the {@link CompletionException} to be handled.
     * @return the response of the handler matching the cause, or HTTP 500.
     */
    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<Error> handleCompletionException(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof BadRequestException bre) {
            return handleBadRequestException(bre);
        }
        if (cause instanceof ResourceNotFoundException nfe) {
            return handleNotFoundException(nfe);
        }
        if (cause instanceof ForbiddenException fe) {
            return handleForbiddenException(fe);
        }
        log.error("Async operation failed", e);
        return respond(cause != null ? cause.getMessage() : e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    /**
     * Handles {@link InternalServerErrorException} and returns a HTTP 500 Internal Server Error response with the error details.
     *
     * @param e the {@link InternalServerErrorException} to be handled.
     * @return a {@link ResponseEntity} containing the error details and a HTTP 500 status.
     */
    @ExceptionHandler(InternalServerErrorException.class)
    public ResponseEntity<Error> handleInternalServerErrorException(InternalServerErrorException e) {
        return respond(e.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Error> respond(String message, HttpStatus status) {
        return new ResponseEntity<>(ErrorUtility.getError(message, status), status);
    }
}
