package com.example.villages.resource.service;

import com.example.villages.authz.audit.AuthzAuditEvent;
import com.example.villages.authz.metrics.AuthzMetrics;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.model.UserRole;
import com.example.villages.authz.model.Viewer;
import com.example.villages.authz.service.RoleGuards;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.resource.document.ResourceShareDoc;
import com.example.villages.resource.document.TemplateAssignmentDoc;
import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.model.Visibility;
import com.example.villages.resource.repository.ResourceShareRepository;
import com.example.villages.resource.repository.TemplateAssignmentRepository;
import com.example.villages.resource.visibility.VisibilityGrants;
import com.example.villages.resource.visibility.VisibilityPolicy;
import com.example.villages.user.service.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a user may see a concrete resource instance. Independent of the
 * role-based rule tables: a resource the rules would allow can still be hidden here.
 */
@Slf4j
@Component
public class ResourceVisibilityGate {

    private final VisibilityPolicy policy;
    private final TemplateAssignmentRepository assignmentRepository;
    private final ResourceShareRepository shareRepository;
    private final UserDirectory userDirectory;
    private final RoleGuards roleGuards;

    @Nullable
    private final AuthzMetrics metrics;

    public ResourceVisibilityGate(
            VisibilityPolicy policy,
            TemplateAssignmentRepository assignmentRepository,
            ResourceShareRepository shareRepository,
            UserDirectory userDirectory,
            RoleGuards roleGuards,
            @Nullable AuthzMetrics metrics) {
        this.policy = policy;
        this.assignmentRepository = assignmentRepository;
        this.shareRepository = shareRepository;
        this.userDirectory = userDirectory;
        this.roleGuards = roleGuards;
        this.metrics = metrics;
    }

    /**
     * Visibility check for a user known only by ID and role. The user's family is looked
     * up only when the resource's tier depends on it.
     */
    @NonNull
    public Mono<Boolean> checkResourceAccess(ResourceView resource, String userId, UserRole userRole) {
        return Mono.defer(() -> {
            if (!needsFamily(resource, userId, userRole)) {
                return checkResourceAccess(resource, new Viewer(userId, userRole, null, null));
            }
            return userDirectory.findFamilyId(userId)
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .flatMap(familyId -> checkResourceAccess(
                            resource, new Viewer(userId, userRole, familyId.orElse(null), null)));
        });
    }

    @NonNull
    public Mono<Boolean> checkResourceAccess(ResourceView resource, Viewer viewer) {
        return Mono.defer(() -> grantsFor(viewer, resource)
                .map(grants -> policy.predicateFor(viewer, grants).test(resource))
                .doOnNext(allowed -> record(resource, viewer, allowed)));
    }

    /**
     * Deletion is reserved to admins and the resource's creator.
     */
    public boolean canDelete(ResourceView resource, String userId, UserRole userRole) {
        return roleGuards.ownsResource(AccessContext.forUser(userId, userRole, null, null), resource.createdBy());
    }

    /**
     * All grants of the viewer, for compiling list filters. Admins need none.
     */
    @NonNull
    public Mono<VisibilityGrants> grantsFor(Viewer viewer) {
        if (viewer.isAdmin()) {
            return Mono.just(VisibilityGrants.none());
        }
        Mono<Set<String>> assigned = viewer.isMember()
                ? assignmentRepository.findByAssigneeId(viewer.userId())
                        .map(TemplateAssignmentDoc::getResourceId)
                        .collect(Collectors.toSet())
                : Mono.just(Set.of());
        Mono<Set<String>> shared = shareRepository.findByUserId(viewer.userId())
                .map(ResourceShareDoc::getResourceId)
                .collect(Collectors.toSet());
        return Mono.zip(assigned, shared, VisibilityGrants::new);
    }

    private Mono<VisibilityGrants> grantsFor(Viewer viewer, ResourceView resource) {
        Set<VisibilityPolicy.Lookup> lookups = policy.lookupsFor(viewer, resource);
        Mono<VisibilityGrants> grants = Mono.just(VisibilityGrants.none());

        if (lookups.contains(VisibilityPolicy.Lookup.ASSIGNMENT)) {
            grants = grants.flatMap(current -> assignmentRepository
                    .existsByResourceIdAndAssigneeId(resource.id(), viewer.userId())
                    .map(assigned -> assigned ? current.withAssigned(resource.id()) : current));
        }
        if (lookups.contains(VisibilityPolicy.Lookup.SHARE)) {
            grants = grants.flatMap(current -> shareRepository
                    .existsByResourceIdAndUserId(resource.id(), viewer.userId())
                    .map(shared -> shared ? current.withShared(resource.id()) : current));
        }
        return grants;
    }

    private static boolean needsFamily(ResourceView resource, String userId, UserRole userRole) {
        if (userRole == UserRole.ADMIN || resource.isCreatedBy(userId)) {
            return false;
        }
        if (userRole == UserRole.MEMBER && resource.systemGenerated()) {
            return false;
        }
        return resource.visibility() == Visibility.FAMILY;
    }

    private void record(ResourceView resource, Viewer viewer, boolean allowed) {
        if (metrics != null) {
            metrics.recordDecision(AuthzAuditEvent.SOURCE_VISIBILITY, ResourceType.RESOURCE, allowed);
        }
        if (allowed) {
            log.debug("Resource visible: resourceId={}, userId={}, role={}",
                    StringSanitizer.forLog(resource.id()), StringSanitizer.forLog(viewer.userId()), viewer.role());
        } else {
            log.debug("Resource hidden: resourceId={}, userId={}, role={}, visibility={}, systemGenerated={}",
                    StringSanitizer.forLog(resource.id()), StringSanitizer.forLog(viewer.userId()), viewer.role(),
                    resource.visibility(), resource.systemGenerated());
        }
    }
}
