package com.example.villages.authz.audit;

import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.model.UserRole;
import com.example.villages.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Publishes authorization decisions as structured JSON on the {@code AUTHZ_AUDIT} logger.
 * Where the lines end up is a logging-configuration concern.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.authz.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private static final String HEADER_CORRELATION_ID = "X-Correlation-Id";
    private static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    private static final String HEADER_USER_AGENT = "User-Agent";

    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private static final int MAX_CORRELATION_ID_LENGTH = 64;
    private static final int MAX_USER_AGENT_LENGTH = 500;
    private static final int MAX_PATH_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public void logRuleDecision(
            @NonNull AccessContext context,
            @NonNull ResourceType resourceType,
            @NonNull Operation operation,
            @NonNull AccessDetails details,
            boolean allowed,
            @Nullable ServerHttpRequest request) {

        AuthzAuditEvent event = AuthzAuditEvent.ruleDecision(
                context,
                resourceType,
                operation,
                details.accessLevel(),
                details.matchedRuleDescriptions(),
                allowed,
                extractRequestContext(request));

        logEvent(event);
    }

    public void logVisibilityDecision(
            @NonNull String userId,
            @NonNull UserRole userRole,
            @NonNull String resourceId,
            @NonNull Operation operation,
            boolean allowed,
            @NonNull String reason,
            @Nullable ServerHttpRequest request) {

        AuthzAuditEvent event = AuthzAuditEvent.visibilityDecision(
                userId, userRole, resourceId, operation, allowed, reason, extractRequestContext(request));

        logEvent(event);
    }

    void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            if (event.outcome() == AuthzAuditEvent.Outcome.ALLOW) {
                AUDIT_LOG.info(json);
            } else {
                AUDIT_LOG.warn(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logFallback(@NonNull AuthzAuditEvent event) {
        AUDIT_LOG.warn("AuthZ {} - user={}, resource={}/{}, operation={}, source={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.userId()),
                event.resourceType(),
                StringSanitizer.forLog(event.resourceId()),
                event.operation(),
                event.source(),
                StringSanitizer.forLog(event.reason()));
    }

    @NonNull
    AuthzAuditEvent.RequestContext extractRequestContext(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return AuthzAuditEvent.RequestContext.empty();
        }

        String method = request.getMethod() != null ? request.getMethod().name() : "UNKNOWN";

        return new AuthzAuditEvent.RequestContext(
                extractCorrelationId(request),
                sanitizePath(request.getPath().value()),
                method,
                extractClientIp(request),
                extractUserAgent(request)
        );
    }

    /**
     * Uses the caller's correlation ID when well-formed, otherwise generates one.
     */
    @NonNull
    private String extractCorrelationId(@NonNull ServerHttpRequest request) {
        String correlationId = request.getHeaders().getFirst(HEADER_CORRELATION_ID);

        if (correlationId == null || correlationId.isBlank()) {
            return UUID.randomUUID().toString();
        }

        String trimmed = correlationId.trim();
        if (trimmed.length() > MAX_CORRELATION_ID_LENGTH || !CORRELATION_ID_PATTERN.matcher(trimmed).matches()) {
            AUDIT_LOG.debug("Invalid correlation ID, generating new one");
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }

    @Nullable
    private String extractClientIp(@NonNull ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst(HEADER_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String firstIp = forwardedFor.split(",")[0].trim();
            if (IP_ADDRESS_PATTERN.matcher(firstIp).matches()) {
                return firstIp;
            }
            AUDIT_LOG.debug("Invalid IP in X-Forwarded-For header, falling back to remote address");
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return null;
    }

    @Nullable
    private String extractUserAgent(@NonNull ServerHttpRequest request) {
        String userAgent = request.getHeaders().getFirst(HEADER_USER_AGENT);
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }
        return StringSanitizer.forLog(userAgent, MAX_USER_AGENT_LENGTH);
    }

    @NonNull
    private String sanitizePath(@Nullable String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        return StringSanitizer.forLog(path, MAX_PATH_LENGTH);
    }
}
