package com.example.annotation.common.exception;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import com.example.annotation.common.util.StringSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Maps the domain failure taxonomy to HTTP responses with a consistent body
 * while preventing sensitive information leakage in error messages.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    /**
     * Handles policy denials. The body never says whether the record exists.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ForbiddenException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleForbidden(@NonNull ForbiddenException ex) {
        LOG.warn("Access denied: caller={}, policy={}, reason={}",
                sanitizeForLog(ex.getCallerId()), ex.getPolicyId(), sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.FORBIDDEN, "forbidden", "Access denied");
    }

    /**
     * Handles missing records visible to the caller.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(NotFoundException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleNotFound(@NonNull NotFoundException ex) {
        LOG.debug("Not found: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.NOT_FOUND, "not_found", sanitizeResponseMessage(ex.getMessage()));
    }

    /**
     * Handles profile re-registration.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(AlreadyExistsException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleAlreadyExists(@NonNull AlreadyExistsException ex) {
        LOG.info("Already exists: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.CONFLICT, "already_exists", sanitizeResponseMessage(ex.getMessage()));
    }

    /**
     * Handles uniqueness violations such as duplicate sessions.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ConflictException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConflict(@NonNull ConflictException ex) {
        LOG.info("Conflict: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.CONFLICT, "conflict", sanitizeResponseMessage(ex.getMessage()));
    }

    /**
     * Handles writes against a session in the wrong lifecycle state.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(InvalidStateException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInvalidState(@NonNull InvalidStateException ex) {
        LOG.info("Invalid state: session={}, status={}", sanitizeForLog(ex.getSessionId()), ex.getCurrentStatus());
        Map<String, Object> body = new HashMap<>();
        body.put("error", "invalid_state");
        body.put("message", sanitizeResponseMessage(ex.getMessage()));
        body.put("status", ex.getCurrentStatus() != null ? ex.getCurrentStatus() : "unknown");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    /**
     * Handles domain validation failures (ranges, PIN format, role names).
     *
     * @param ex the exception
     * @return error response with the offending field
     */
    @ExceptionHandler(InvalidArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInvalidArgument(@NonNull InvalidArgumentException ex) {
        LOG.warn("Invalid argument: field={}, message={}",
                sanitizeFieldName(ex.getField()), sanitizeForLog(ex.getMessage()));
        Map<String, Object> body = new HashMap<>();
        body.put("error", "invalid_argument");
        body.put("field", sanitizeFieldName(ex.getField()));
        body.put("message", sanitizeResponseMessage(ex.getMessage()));
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     *
     * @param ex the exception
     * @return error response with field-level details
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", error.getDefaultMessage() != null
                                ? sanitizeResponseMessage(error.getDefaultMessage())
                                : "Invalid value"
                ))
                .toList();
        return validationError(fieldErrors);
    }

    /**
     * Handles constraint violations from @Validated service methods.
     *
     * @param ex the exception
     * @return error response with violation details
     */
    @ExceptionHandler(ConstraintViolationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(@NonNull ConstraintViolationException ex) {
        LOG.warn("Constraint violation: {} violations", ex.getConstraintViolations().size());

        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(violation -> Map.of(
                        "field", sanitizeFieldName(extractFieldName(violation)),
                        "message", sanitizeResponseMessage(violation.getMessage())
                ))
                .toList();
        return validationError(violations);
    }

    /**
     * Handles malformed request body or type conversion errors.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", sanitizeForLog(ex.getMessage()));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format");
    }

    /**
     * Handles all unhandled exceptions.
     *
     * @param ex the exception
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", sanitizeForLog(ex.getMessage()), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred");
    }

    @NonNull
    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", error,
                        "message", message,
                        "timestamp", Instant.now().toString()
                ));
    }

    @NonNull
    private ResponseEntity<Map<String, Object>> validationError(List<Map<String, String>> details) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", "validation_error");
        body.put("message", "Request validation failed");
        body.put("details", details);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.badRequest().body(body);
    }

    @NonNull
    private String extractFieldName(@NonNull ConstraintViolation<?> violation) {
        String path = violation.getPropertyPath().toString();
        // "createCase.request.label" -> "label"
        int lastDot = path.lastIndexOf('.');
        return lastDot >= 0 ? path.substring(lastDot + 1) : path;
    }

    @NonNull
    private static String sanitizeForLog(@Nullable String value) {
        return StringSanitizer.forLog(value, MAX_LOG_MESSAGE_LENGTH);
    }

    @NonNull
    private String sanitizeFieldName(@Nullable String fieldName) {
        if (fieldName == null || fieldName.isBlank()) {
            return "unknown";
        }
        String cleaned = fieldName.replaceAll("[^a-zA-Z0-9._]", "");
        return cleaned.substring(0, Math.min(cleaned.length(), 50));
    }

    @NonNull
    private String sanitizeResponseMessage(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message
                .replace("\n", " ")
                .replace("\r", " ")
                .replace("\t", " ");

        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
