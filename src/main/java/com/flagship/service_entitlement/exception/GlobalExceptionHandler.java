package com.flagship.service_entitlement.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the REST API.
 *
 * Business failures carry their own {@link ErrorCode}; this class only decides
 * the HTTP status. Lock timeouts get a Retry-After header since the same
 * request is expected to succeed once the competing writer commits.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(EntitlementLedgerException.class)
    public ResponseEntity<ApiError> handleLedgerException(EntitlementLedgerException e) {
        HttpStatus status = statusFor(e.getErrorCode());

        if (status.is5xxServerError()) {
            log.warn("Retryable ledger failure: code={}, message={}", e.getErrorCode(), e.getMessage());
        } else {
            log.warn("Rejected request: code={}, message={}", e.getErrorCode(), e.getMessage());
        }

        ApiError error = ApiError.builder()
            .error(status.getReasonPhrase())
            .code(e.getErrorCode())
            .message(e.getMessage())
            .retryable(e.isRetryable())
            .timestamp(Instant.now())
            .build();

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (e.isRetryable()) {
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return response.body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for parameter {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return badRequest("Request body is malformed", null);
    }

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

        return badRequest("Request validation failed", errors);
    }

    /**
     * Lock waits or deadlocks detected outside the entitlement lock step, for
     * example at flush time.
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleLockFailure(PessimisticLockingFailureException e) {
        log.warn("Lock failure: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error(HttpStatus.SERVICE_UNAVAILABLE.getReasonPhrase())
            .code(ErrorCode.LOCK_TIMEOUT)
            .message("The resource is busy, retry the request")
            .retryable(true)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(error);
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());

        ApiError error = ApiError.builder()
            .error(HttpStatus.CONFLICT.getReasonPhrase())
            .code(ErrorCode.CONFLICT)
            .message("Request conflicts with the current state of the resource")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error(HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase())
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case VALIDATION_ERROR, INVALID_QUANTITY -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INSUFFICIENT_BALANCE, EXCEEDS_CONSUMED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_STATE_TRANSITION, CONTRACT_NOT_DRAFT, CONTRACT_NOT_ACTIVE,
                 HOLD_NOT_ACTIVE, HOLD_CANNOT_EXPIRE, CONFLICT -> HttpStatus.CONFLICT;
            case LOCK_TIMEOUT -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ApiError> badRequest(String message, Map<String, String> details) {
        ApiError error = ApiError.builder()
            .error(HttpStatus.BAD_REQUEST.getReasonPhrase())
            .code(ErrorCode.VALIDATION_ERROR)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
