package com.example.villages.common.exception;

import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.common.dto.ErrorResponse;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.MissingRequestValueException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("should map a rule denial to 403 with the required level only")
    void shouldMapRuleDenial() {
        ResponseEntity<ErrorResponse> response = handler.handleResourceAccessDenied(
                new ResourceAccessDeniedException("u1", ResourceType.FAMILY, Operation.UPDATE,
                        AccessLevel.WRITE, AccessLevel.READ));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().code()).isEqualTo(ErrorResponse.Codes.RESOURCE_ACCESS_DENIED);
        assertThat(response.getBody().details())
                .containsEntry("resourceType", "FAMILY")
                .containsEntry("operation", "UPDATE")
                .containsEntry("requiredLevel", "WRITE")
                .doesNotContainKey("actualLevel");
    }

    @Test
    @DisplayName("should map an unknown user to 401")
    void shouldMapUnknownUser() {
        ResponseEntity<ErrorResponse> response = handler.handleUnknownUser(new UnknownUserException("ghost"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(response.getBody().code()).isEqualTo(ErrorResponse.Codes.UNKNOWN_USER);
    }

    @Test
    @DisplayName("should map a hidden or missing resource to 404")
    void shouldMapNotFound() {
        ResponseEntity<ErrorResponse> response = handler.handleNotFound(new ResourceNotFoundException("r1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().code()).isEqualTo(ErrorResponse.Codes.RESOURCE_NOT_FOUND);
    }

    @Test
    @DisplayName("should map a missing user header to 401 and other input errors to 400")
    void shouldMapInputErrors() {
        ResponseEntity<ErrorResponse> missingHeader = handler.handleInputException(
                new MissingRequestValueException("X-User-Id", String.class, "header", null));
        ResponseEntity<ErrorResponse> badInput = handler.handleInputException(
                new ServerWebInputException("bad page"));

        assertThat(missingHeader.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(missingHeader.getBody().code()).isEqualTo(ErrorResponse.Codes.MISSING_USER_ID);
        assertThat(badInput.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("should map request body validation errors to 400 with field details")
    void shouldMapBodyValidationErrors() throws NoSuchMethodException {
        MethodParameter parameter = new MethodParameter(
                ValidatedEndpoint.class.getDeclaredMethod("check", Object.class), 0);
        BeanPropertyBindingResult bindingResult = new BeanPropertyBindingResult(new Object(), "request");
        bindingResult.addError(new FieldError("request", "resourceType", "must not be null"));

        ResponseEntity<ErrorResponse> response = handler.handleValidationErrors(
                new WebExchangeBindException(parameter, bindingResult));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().code()).isEqualTo(ErrorResponse.Codes.INVALID_REQUEST);
        assertThat(response.getBody().details().get("fields"))
                .asInstanceOf(InstanceOfAssertFactories.list(Map.class))
                .singleElement()
                .satisfies(field -> {
                    assertThat(field).containsEntry("field", "resourceType");
                    assertThat(field).containsEntry("message", "must not be null");
                });
    }

    @Test
    @DisplayName("should log control characters in messages without failing")
    void shouldHandleControlCharactersInMessages() {
        ResponseEntity<ErrorResponse> response = handler.handleIllegalArgument(
                new IllegalArgumentException("bad\nvalue\r\tforged log line"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().message()).isEqualTo("Invalid request parameter");
    }

    @Test
    @DisplayName("should hide internal error details")
    void shouldHideInternalErrors() {
        ResponseEntity<ErrorResponse> response = handler.handleGeneral(new IllegalStateException("db password=x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).doesNotContain("password");
    }

    private static class ValidatedEndpoint {

        @SuppressWarnings("unused")
        void check(Object request) {
        }
    }
}
