package com.example.villages.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Standardized error response format for all API errors.
 *
 * <pre>{@code
 * {
 *   "error": "access_denied",
 *   "code": "RESOURCE_ACCESS_DENIED",
 *   "message": "Access denied",
 *   "timestamp": "2024-12-19T10:30:00.000Z",
 *   "details": {
 *     "resourceType": "DOCUMENT",
 *     "operation": "DELETE"
 *   }
 * }
 * }</pre>
 *
 * @param error     Stable error category for client error handling
 * @param code      Specific error code for debugging/logging
 * @param message   Human-readable message for UI display
 * @param timestamp When the error occurred
 * @param details   Additional context (validation errors, required level, etc.)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String code,
        String message,
        Instant timestamp,
        Map<String, Object> details
) {
    public static ErrorResponse of(String error, String code, String message) {
        return new ErrorResponse(error, code, message, Instant.now(), null);
    }

    public static ErrorResponse of(String error, String code, String message, Map<String, Object> details) {
        return new ErrorResponse(error, code, message, Instant.now(), details);
    }

    public static final class Categories {
        public static final String ACCESS_DENIED = "access_denied";
        public static final String AUTHENTICATION_REQUIRED = "authentication_required";
        public static final String VALIDATION_ERROR = "validation_error";
        public static final String NOT_FOUND = "not_found";
        public static final String INVALID_ARGUMENT = "invalid_argument";
        public static final String INTERNAL_ERROR = "internal_error";

        private Categories() {
        }
    }

    public static final class Codes {
        public static final String RESOURCE_ACCESS_DENIED = "RESOURCE_ACCESS_DENIED";
        public static final String FORBIDDEN = "FORBIDDEN";
        public static final String UNKNOWN_USER = "UNKNOWN_USER";
        public static final String MISSING_USER_ID = "MISSING_USER_ID";
        public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
        public static final String INVALID_REQUEST = "INVALID_REQUEST";

        private Codes() {
        }
    }
}
