package com.example.villages.authz.audit;

import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessLevel;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.model.UserRole;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for authorization decisions.
 * Designed for security logging, compliance, and debugging.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String source,
        String reason,
        AccessLevel requiredLevel,
        AccessLevel accessLevel,
        List<String> matchedRules,

        // Subject
        String userId,
        UserRole userRole,
        String familyId,

        // Resource
        ResourceType resourceType,
        String resourceId,
        Operation operation,

        // Request context
        String path,
        String method,
        String clientIp,
        String userAgent
) {
    public enum Outcome {
        ALLOW, DENY
    }

    /**
     * Where the decision was made.
     */
    public static final String SOURCE_RULES = "rules";
    public static final String SOURCE_VISIBILITY = "visibility";

    /**
     * Creates an audit event for a rule-engine decision.
     */
    public static AuthzAuditEvent ruleDecision(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            AccessLevel accessLevel,
            List<String> matchedRules,
            boolean allowed,
            RequestContext requestContext) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                requestContext.correlationId(),
                allowed ? Outcome.ALLOW : Outcome.DENY,
                SOURCE_RULES,
                allowed ? "Access level sufficient" : "Access level insufficient",
                operation.requiredLevel(),
                accessLevel,
                matchedRules,
                context.userId(),
                context.userRole(),
                context.familyId(),
                resourceType,
                null,
                operation,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    /**
     * Creates an audit event for a visibility-gate decision on a concrete resource.
     */
    public static AuthzAuditEvent visibilityDecision(
            String userId,
            UserRole userRole,
            String resourceId,
            Operation operation,
            boolean allowed,
            String reason,
            RequestContext requestContext) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                requestContext.correlationId(),
                allowed ? Outcome.ALLOW : Outcome.DENY,
                SOURCE_VISIBILITY,
                reason,
                null,
                null,
                List.of(),
                userId,
                userRole,
                null,
                ResourceType.RESOURCE,
                resourceId,
                operation,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", correlationId != null ? correlationId : ""),
                Map.entry("outcome", outcome.name()),
                Map.entry("source", source != null ? source : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("required_level", requiredLevel != null ? requiredLevel.name() : ""),
                Map.entry("access_level", accessLevel != null ? accessLevel.name() : ""),
                Map.entry("matched_rules", matchedRules != null ? matchedRules : List.of()),
                Map.entry("user_id", userId != null ? userId : ""),
                Map.entry("user_role", userRole != null ? userRole.name() : ""),
                Map.entry("family_id", familyId != null ? familyId : ""),
                Map.entry("resource_type", resourceType != null ? resourceType.name() : ""),
                Map.entry("resource_id", resourceId != null ? resourceId : ""),
                Map.entry("operation", operation != null ? operation.name() : ""),
                Map.entry("path", path != null ? path : ""),
                Map.entry("method", method != null ? method : ""),
                Map.entry("client_ip", clientIp != null ? clientIp : ""),
                Map.entry("user_agent", userAgent != null ? userAgent : "")
        );
    }

    /**
     * Request context for audit events.
     */
    public record RequestContext(
            String correlationId,
            String path,
            String method,
            String clientIp,
            String userAgent
    ) {
        public static RequestContext empty() {
            return new RequestContext(null, null, null, null, null);
        }
    }
}
