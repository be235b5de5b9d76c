package com.flagship.pharmacy_pos.exception;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pharmacy_pos.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the error taxonomy onto HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PosException.class)
    public ResponseEntity<ErrorResponse> handlePosException(PosException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.FAULT) {
            log.error("Operation failed: {}", e.getMessage(), e);
        } else {
            log.warn("Operation rejected: kind={}, detail={}", kind, e.getMessage());
        }

        // validation details are safe to echo back, store details are not
        Map<String, String> details = kind == ErrorKind.VALIDATION
            ? Map.of("reason", e.getMessage())
            : null;

        return ResponseEntity.status(kind.getHttpStatus()).body(ErrorResponse.of(kind, details));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.of(ErrorKind.VALIDATION, errors));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("Malformed request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ErrorResponse.of(ErrorKind.VALIDATION, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of(ErrorKind.FAULT, null));
    }

    /**
     * Body of every error. {@code correlation_id} is what a cashier reads out
     * to support.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        boolean retryable;
        Map<String, String> details;
        @JsonProperty("correlation_id")
        String correlationId;
        Instant timestamp;

        static ErrorResponse of(ErrorKind kind, Map<String, String> details) {
            return ErrorResponse.builder()
                .error(kind.getHttpStatus().getReasonPhrase())
                .code(kind.name())
                .message(kind.getUserMessage())
                .retryable(kind.isRetryable())
                .details(details)
                .correlationId(CorrelationContext.current())
                .timestamp(Instant.now())
                .build();
        }
    }
}
