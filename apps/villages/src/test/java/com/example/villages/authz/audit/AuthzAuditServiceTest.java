package com.example.villages.authz.audit;

import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.model.UserRole;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;

import java.util.List;
import java.util.Map;

import static com.example.villages.util.AccessContextTestBuilder.aFamilyMemberOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("AuthzAuditService")
class AuthzAuditServiceTest {

    private final AuthzAuditService auditService = new AuthzAuditService(new ObjectMapper());

    @Nested
    @DisplayName("Request context")
    class RequestContextExtraction {

        @Test
        @DisplayName("should keep a well-formed correlation ID and the forwarded client IP")
        void shouldKeepWellFormedHeaders() {
            MockServerHttpRequest request = MockServerHttpRequest.get("/api/v1/resources/r1")
                    .header("X-Correlation-Id", "abc-123")
                    .header("X-Forwarded-For", "203.0.113.7, 10.0.0.1")
                    .header("User-Agent", "test-agent")
                    .build();

            AuthzAuditEvent.RequestContext ctx = auditService.extractRequestContext(request);

            assertThat(ctx.correlationId()).isEqualTo("abc-123");
            assertThat(ctx.clientIp()).isEqualTo("203.0.113.7");
            assertThat(ctx.path()).isEqualTo("/api/v1/resources/r1");
            assertThat(ctx.method()).isEqualTo("GET");
            assertThat(ctx.userAgent()).isEqualTo("test-agent");
        }

        @Test
        @DisplayName("should replace a malformed correlation ID")
        void shouldReplaceMalformedCorrelationId() {
            MockServerHttpRequest request = MockServerHttpRequest.get("/api/v1/access/check")
                    .header("X-Correlation-Id", "bad id; drop table")
                    .build();

            AuthzAuditEvent.RequestContext ctx = auditService.extractRequestContext(request);

            assertThat(ctx.correlationId()).isNotEqualTo("bad id; drop table").isNotBlank();
        }

        @Test
        @DisplayName("should return an empty context without a request")
        void shouldReturnEmptyContextWithoutRequest() {
            assertThat(auditService.extractRequestContext(null)).isEqualTo(AuthzAuditEvent.RequestContext.empty());
        }
    }

    @Test
    @DisplayName("rule decision events should carry levels and matched rules")
    void ruleDecisionEventShouldCarryLevels() {
        AccessContext ctx = aFamilyMemberOf("F1").withUserId("u1").withResourceFamilyId("F1").build();

        AuthzAuditEvent event = AuthzAuditEvent.ruleDecision(
                ctx, ResourceType.DOCUMENT, Operation.UPDATE, AccessLevel.READ,
                List.of("Family members can view documents within their family"), false,
                AuthzAuditEvent.RequestContext.empty());
        Map<String, Object> log = event.toStructuredLog();

        assertThat(event.outcome()).isEqualTo(AuthzAuditEvent.Outcome.DENY);
        assertThat(log).containsEntry("required_level", "WRITE")
                .containsEntry("access_level", "READ")
                .containsEntry("user_id", "u1")
                .containsEntry("family_id", "F1")
                .containsEntry("source", AuthzAuditEvent.SOURCE_RULES);
    }

    @Test
    @DisplayName("should not propagate serialization failures")
    void shouldNotPropagateSerializationFailures() throws JsonProcessingException {
        ObjectMapper failing = mock(ObjectMapper.class);
        when(failing.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") {});
        AuthzAuditService service = new AuthzAuditService(failing);

        assertThatCode(() -> service.logVisibilityDecision(
                "u1", UserRole.MEMBER, "r1", Operation.READ, false, "hidden by visibility", null))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should log rule decisions from engine details")
    void shouldLogRuleDecisions() {
        AccessContext ctx = aFamilyMemberOf("F1").build();

        assertThatCode(() -> auditService.logRuleDecision(
                ctx, ResourceType.FAMILY, Operation.READ, AccessDetails.none(), false, null))
                .doesNotThrowAnyException();
    }
}
