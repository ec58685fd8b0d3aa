package com.example.villages.authz.controller;

import com.example.villages.authz.audit.AuthzAuditService;
import com.example.villages.authz.dto.AccessCheckRequest;
import com.example.villages.authz.dto.AccessCheckResponse;
import com.example.villages.authz.dto.AccessDetailsRequest;
import com.example.villages.authz.dto.AccessDetailsResponse;
import com.example.villages.authz.engine.AccessDecisionEngine;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.AccessDetails;
import com.example.villages.authz.service.AccessContextFactory;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.common.web.RequestHeaders;
import com.example.villages.user.service.UserDirectory;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Diagnostic endpoints: what can the caller do with a resource of a given type and shape.
 * They report decisions and never deny the request itself.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/access")
public class AccessController {

    private final AccessDecisionEngine engine;
    private final UserDirectory userDirectory;
    private final AccessContextFactory contextFactory;

    @Nullable
    private final AuthzAuditService auditService;

    public AccessController(
            AccessDecisionEngine engine,
            UserDirectory userDirectory,
            AccessContextFactory contextFactory,
            @Nullable AuthzAuditService auditService) {
        this.engine = engine;
        this.userDirectory = userDirectory;
        this.contextFactory = contextFactory;
        this.auditService = auditService;
    }

    @PostMapping("/details")
    public Mono<AccessDetailsResponse> getAccessDetails(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody AccessDetailsRequest request) {

        log.debug("POST /access/details - user: {}, resourceType: {}",
                StringSanitizer.forLog(userId), request.resourceType());
        return userDirectory.findViewer(userId)
                .map(viewer -> contextFactory.forEntity(viewer, request.toEntityFacts()))
                .map(context -> AccessDetailsResponse.from(
                        request.resourceType(), engine.getAccessDetails(context, request.resourceType())));
    }

    @PostMapping("/check")
    public Mono<AccessCheckResponse> checkAccess(
            @RequestHeader(RequestHeaders.USER_ID) String userId,
            @Valid @RequestBody AccessCheckRequest request,
            ServerHttpRequest httpRequest) {

        log.debug("POST /access/check - user: {}, resourceType: {}, operation: {}",
                StringSanitizer.forLog(userId), request.resourceType(), request.operation());
        return userDirectory.findViewer(userId)
                .map(viewer -> contextFactory.forEntity(viewer, request.toEntityFacts()))
                .map(context -> check(context, request, httpRequest));
    }

    private AccessCheckResponse check(AccessContext context, AccessCheckRequest request, ServerHttpRequest httpRequest) {
        AccessDetails details = engine.getAccessDetails(context, request.resourceType());
        boolean allowed = engine.canPerformOperation(context, request.resourceType(), request.operation());

        if (auditService != null) {
            auditService.logRuleDecision(
                    context, request.resourceType(), request.operation(), details, allowed, httpRequest);
        }

        return new AccessCheckResponse(
                request.resourceType(),
                request.operation(),
                allowed,
                request.operation().requiredLevel(),
                details.accessLevel());
    }
}
