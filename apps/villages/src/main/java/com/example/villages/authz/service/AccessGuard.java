package com.example.villages.authz.service;

import com.example.villages.authz.audit.AuthzAuditEvent;
import com.example.villages.authz.audit.AuthzAuditService;
import com.example.villages.authz.engine.AccessDecisionEngine;
import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.authz.metrics.AuthzMetrics;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Wraps handlers with an access check: build context, check the operation's required
 * level, and reject before the handler is ever invoked.
 */
@Slf4j
@Service
public class AccessGuard {

    private final AccessDecisionEngine engine;

    @Nullable
    private final AuthzAuditService auditService;

    @Nullable
    private final AuthzMetrics metrics;

    public AccessGuard(
            AccessDecisionEngine engine,
            @Nullable AuthzAuditService auditService,
            @Nullable AuthzMetrics metrics) {
        this.engine = engine;
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Throw {@link ResourceAccessDeniedException} unless the context may perform the operation.
     */
    public void check(AccessContext context, ResourceType resourceType, Operation operation) {
        check(context, resourceType, operation, ctx -> true);
    }

    /**
     * As {@link #check(AccessContext, ResourceType, Operation)}, with an additional
     * predicate that must also hold.
     */
    public void check(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            Predicate<AccessContext> customCheck) {

        AccessDetails details = engine.getAccessDetails(context, resourceType);
        boolean allowed = engine.canPerformOperation(context, resourceType, operation);

        record(context, resourceType, operation, details, allowed);

        if (!allowed) {
            log.warn("Access DENIED: user={}, role={}, resource={}, operation={}, required={}, have={}, matched={}",
                    context.userId(), context.userRole(), resourceType, operation,
                    operation.requiredLevel(), details.accessLevel(), details.matchedRuleDescriptions());
            throw new ResourceAccessDeniedException(
                    context.userId(), resourceType, operation, operation.requiredLevel(), details.accessLevel());
        }

        if (!customCheck.test(context)) {
            log.warn("Access DENIED by custom check: user={}, resource={}, operation={}",
                    context.userId(), resourceType, operation);
            throw new ResourceAccessDeniedException(
                    "Access denied: custom check failed", context.userId(), resourceType, operation);
        }
    }

    /**
     * Run the handler only if access is granted; otherwise the returned Mono errors
     * without subscribing to the handler.
     */
    public <T> Mono<T> guard(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            Supplier<Mono<T>> handler) {
        return guard(context, resourceType, operation, ctx -> true, handler);
    }

    public <T> Mono<T> guard(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            Predicate<AccessContext> customCheck,
            Supplier<Mono<T>> handler) {
        return Mono.defer(() -> {
            check(context, resourceType, operation, customCheck);
            return handler.get();
        });
    }

    public <T> Flux<T> guardMany(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            Supplier<Flux<T>> handler) {
        return Flux.defer(() -> {
            check(context, resourceType, operation);
            return handler.get();
        });
    }

    private void record(
            AccessContext context,
            ResourceType resourceType,
            Operation operation,
            AccessDetails details,
            boolean allowed) {
        if (metrics != null) {
            metrics.recordDecision(AuthzAuditEvent.SOURCE_RULES, resourceType, allowed);
        }
        if (auditService != null) {
            auditService.logRuleDecision(context, resourceType, operation, details, allowed, null);
        }
    }
}
