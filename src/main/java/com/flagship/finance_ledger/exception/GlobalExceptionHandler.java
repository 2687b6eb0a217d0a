package com.flagship.finance_ledger.exception;

import com.flagship.finance_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps failures to the JSON error body returned by every endpoint:
 * {"error": message, "code": ..., "timestamp": ...}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(FinanceException.class)
    public ResponseEntity<ErrorResponse> handleFinanceException(FinanceException e) {
        log.warn("Request rejected: code={}, message={}", e.getCode(), e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getMessage())
            .code(e.getCode().name())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(e.getCode().getStatus()).body(error);
    }

    @ExceptionHandler(CommandPayloadException.class)
    public ResponseEntity<ErrorResponse> handlePayloadException(CommandPayloadException e) {
        log.warn("Invalid command payload: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error(e.getMessage())
            .code(ErrorCode.VALIDATION_FAILED.name())
            .details(e.getDetails())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());

        ErrorResponse error = ErrorResponse.builder()
            .error("Request body is not valid JSON")
            .code(ErrorCode.VALIDATION_FAILED.name())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error (correlationId={})", CorrelationContext.getCorrelationId(), e);

        ErrorResponse error = ErrorResponse.builder()
            .error("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        Map<String, String> details;
        Instant timestamp;
    }
}
