package com.example.villages.common.exception;

import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.common.dto.ErrorResponse;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.common.web.RequestHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MissingRequestValueException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Denials always surface as 403 and never reveal which rule failed beyond the
 * required and actual levels.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // Limits for log sanitization
    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;

    /**
     * Handles rule-table and visibility denials on a specific resource type.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ResourceAccessDeniedException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleResourceAccessDenied(@NonNull ResourceAccessDeniedException ex) {
        LOG.warn("Resource access denied: user={}, resourceType={}, operation={}, required={}, actual={}",
                StringSanitizer.forLog(ex.getUserId()), ex.getResourceType(), ex.getOperation(),
                ex.getRequiredLevel(), ex.getActualLevel());

        Map<String, Object> details = new HashMap<>();
        if (ex.getResourceType() != null) {
            details.put("resourceType", ex.getResourceType().name());
        }
        if (ex.getOperation() != null) {
            details.put("operation", ex.getOperation().name());
        }
        if (ex.getRequiredLevel() != null) {
            details.put("requiredLevel", ex.getRequiredLevel().name());
        }

        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.ACCESS_DENIED,
                        ErrorResponse.Codes.RESOURCE_ACCESS_DENIED,
                        "Access denied",
                        details));
    }

    /**
     * Handles other access denied exceptions (role guards).
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(AccessDeniedException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleAccessDenied(@NonNull AccessDeniedException ex) {
        LOG.warn("Access denied: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.ACCESS_DENIED,
                        ErrorResponse.Codes.FORBIDDEN,
                        "Access denied"));
    }

    /**
     * Handles a caller ID that does not resolve to a user.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(UnknownUserException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleUnknownUser(@NonNull UnknownUserException ex) {
        LOG.warn("Unknown user: {}", StringSanitizer.forLog(ex.getUserId()));
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                        ErrorResponse.Codes.UNKNOWN_USER,
                        "User could not be identified"));
    }

    /**
     * Handles missing or invisible resources with the same response.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ResourceNotFoundException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleNotFound(@NonNull ResourceNotFoundException ex) {
        LOG.debug("Resource not found: {}", StringSanitizer.forLog(ex.getResourceId()));
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.NOT_FOUND,
                        ErrorResponse.Codes.RESOURCE_NOT_FOUND,
                        "Resource not found"));
    }

    /**
     * Handles validation errors from @Valid annotated request bodies in WebFlux.
     *
     * @param ex the exception
     * @return error response with field-level details
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", sanitizeFieldName(error.getField()),
                        "message", error.getDefaultMessage() != null
                                ? sanitizeResponseMessage(error.getDefaultMessage())
                                : "Invalid value"
                ))
                .collect(Collectors.toList());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST,
                        "Request validation failed",
                        Map.of("fields", fieldErrors)));
    }

    /**
     * Handles malformed requests. A missing caller ID header is an authentication failure.
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInputException(@NonNull ServerWebInputException ex) {
        if (ex instanceof MissingRequestValueException missing
                && RequestHeaders.USER_ID.equalsIgnoreCase(missing.getName())) {
            LOG.warn("Request without {} header", RequestHeaders.USER_ID);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.of(
                            ErrorResponse.Categories.AUTHENTICATION_REQUIRED,
                            ErrorResponse.Codes.MISSING_USER_ID,
                            "User could not be identified"));
        }

        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.VALIDATION_ERROR,
                        ErrorResponse.Codes.INVALID_REQUEST,
                        "Invalid request format"));
    }

    /**
     * Handles illegal argument exceptions (often from invalid enum values or parameters).
     *
     * @param ex the exception
     * @return error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.INVALID_ARGUMENT,
                        ErrorResponse.Codes.INVALID_REQUEST,
                        "Invalid request parameter"));
    }

    /**
     * Handles all unhandled exceptions.
     *
     * @param ex the exception
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(
                        ErrorResponse.Categories.INTERNAL_ERROR,
                        "INTERNAL_ERROR",
                        "An unexpected error occurred"));
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
