package com.flagship.transaction_engine.exception;

import com.flagship.transaction_engine.account.DuplicateAccountException;
import com.flagship.transaction_engine.queue.PublishException;
import com.flagship.transaction_engine.transaction.AccountNotFoundException;
import com.flagship.transaction_engine.transaction.InsufficientBalanceException;
import com.flagship.transaction_engine.transaction.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API.
 *
 * Maps the error taxonomy onto HTTP statuses:
 * - validation: 400
 * - unknown account: 404
 * - duplicate account: 409
 * - insufficient balance: 422
 * - queue or store unavailable: 503
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

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

        return respond(HttpStatus.BAD_REQUEST, ErrorResponse.builder()
            .error("Validation Failed")
            .message("Request validation failed")
            .details(errors)
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, error("Invalid Request", "Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, error("Invalid Request", e.getMessage()));
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAccountNotFound(AccountNotFoundException e) {
        log.warn("Account not found: {}", e.getAccountId());
        return respond(HttpStatus.NOT_FOUND, error("Account Not Found", e.getMessage()));
    }

    @ExceptionHandler(DuplicateAccountException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateAccount(DuplicateAccountException e) {
        log.warn("Duplicate account: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, error("Duplicate Account", e.getMessage()));
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Insufficient balance: accountId={}, balance={}, requested={}",
            e.getAccountId(), e.getBalance(), e.getRequested());

        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.builder()
            .error("Insufficient Balance")
            .message("Insufficient balance")
            .details(Map.of(
                "account_id", e.getAccountId(),
                "balance", e.getBalance().toString(),
                "requested", e.getRequested().toString()
            ))
            .timestamp(Instant.now())
            .build());
    }

    @ExceptionHandler({PublishException.class, StoreUnavailableException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        log.error("Dependency unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, error("Service Unavailable", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            error("Internal Server Error", "An unexpected error occurred"));
    }

    private static ErrorResponse error(String error, String message) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, ErrorResponse body) {
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Error response DTO.
     */
    @lombok.Value
    @lombok.Builder
    public static class ErrorResponse {
        String error;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
