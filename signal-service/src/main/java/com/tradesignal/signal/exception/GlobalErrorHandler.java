package com.tradesignal.signal.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;

@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    public record ErrorResponse(
        @JsonProperty("status") int status,
        @JsonProperty("error") String error,
        @JsonProperty("symbol") String symbol,
        @JsonProperty("timestamp") Instant timestamp
    ) {}

    @ExceptionHandler(SignalException.class)
    public ResponseEntity<ErrorResponse> handleSignal(SignalException ex) {
        log.warn("Rejected signal request symbol={} reason={}", ex.getSymbol(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getSymbol());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        log.warn("Unreadable signal request: {}", ex.getReason());
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", null);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String message, String symbol) {
        return ResponseEntity.status(status)
            .body(new ErrorResponse(status.value(), message, symbol, Instant.now()));
    }
}
