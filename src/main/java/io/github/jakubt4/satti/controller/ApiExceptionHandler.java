package io.github.jakubt4.satti.controller;

import io.github.jakubt4.satti.dto.ErrorResponse;
import io.github.jakubt4.satti.exception.CommandConflictException;
import io.github.jakubt4.satti.exception.ImageSynthesisException;
import io.github.jakubt4.satti.exception.InvalidRequestException;
import io.github.jakubt4.satti.exception.ResourceNotFoundException;
import io.github.jakubt4.satti.exception.SimulatorException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps simulator exceptions to {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(final ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(CommandConflictException.class)
    public ResponseEntity<ErrorResponse> conflict(final CommandConflictException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> invalid(final InvalidRequestException e) {
        log.debug("[API] Rejected request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> unreadable(final Exception e) {
        log.debug("[API] Malformed request: {}", e.getMessage());
        final var message = e instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : e.getMessage();
        return error(HttpStatus.BAD_REQUEST, message);
    }

    // raised only by the preview endpoint
    @ExceptionHandler(ImageSynthesisException.class)
    public ResponseEntity<ErrorResponse> synthesisFailed(final ImageSynthesisException e) {
        log.error("[API] External map preview failed: {}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "External map preview failed: " + e.getMessage());
    }

    @ExceptionHandler(SimulatorException.class)
    public ResponseEntity<ErrorResponse> simulatorFailure(final SimulatorException e) {
        log.error("[API] Request failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> error(final HttpStatus status, final String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(status.name(), message));
    }
}
