package com.auctionflow.settlement.controller;

import com.auctionflow.settlement.exception.CalculationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates engine failures into HTTP responses.
 * Bad input maps to 400; a failed verification is an engine or configuration
 * defect and maps to 500.
 */
@Slf4j
@RestControllerAdvice
public class CalculationExceptionHandler {

    @ExceptionHandler(CalculationException.class)
    public ResponseEntity<ErrorResponse> handleCalculationException(CalculationException ex) {
        if (ex.getKind().isClientError()) {
            log.warn("Calculation rejected: {} - {}", ex.getKind(), ex.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(new ErrorResponse("Calculation error", ex.getKind().name(), ex.getMessage()));
        }
        log.error("Calculation failed verification: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error", ex.getKind().name(), ex.getMessage()));
    }

    @ExceptionHandler({NumberFormatException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex) {
        log.warn("Unreadable calculation request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("Invalid request", "MALFORMED_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("Internal server error", "INTERNAL_ERROR", "An unexpected error occurred"));
    }

    public record ErrorResponse(String error, String kind, String details) {}
}
