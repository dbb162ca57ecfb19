package com.flagship.mobile_payments.payment.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", "Request validation failed", errors);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", "Request body is missing or malformed", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing request parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest",
                "Parameter " + e.getParameterName() + " is required", null);
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException e) {
        log.warn("Invalid payment request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InvalidRequest", e.getMessage(), null);
    }

    @ExceptionHandler(DuplicateRequestException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateRequestException e) {
        log.info("Duplicate payment request: existing checkoutId={}", e.getExistingCheckoutId());
        return respond(HttpStatus.CONFLICT, "DuplicateRequest", e.getMessage(),
                Map.of("checkout_id", e.getExistingCheckoutId()));
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(TransactionNotFoundException e) {
        log.info("Transaction not found: {}", e.getCheckoutId());
        return respond(HttpStatus.NOT_FOUND, "NotFound", e.getMessage(), null);
    }

    @ExceptionHandler(TransactionAlreadyTerminalException.class)
    public ResponseEntity<ApiError> handleAlreadyTerminal(TransactionAlreadyTerminalException e) {
        log.info("Rejected change to terminal transaction {}: {}", e.getCheckoutId(), e.getStatus());
        return respond(HttpStatus.CONFLICT, "AlreadyTerminal", e.getMessage(),
                Map.of("checkout_id", e.getCheckoutId(), "status", e.getStatus().wireName()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiError> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "InvalidState", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", "An unexpected error occurred", null);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                                    Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
