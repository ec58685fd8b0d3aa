package com.example.villages.resource.service;

import com.example.villages.authz.audit.AuthzAuditService;
import com.example.villages.authz.exception.ResourceAccessDeniedException;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.authz.model.Viewer;
import com.example.villages.authz.service.AccessContextFactory;
import com.example.villages.common.exception.ResourceNotFoundException;
import com.example.villages.resource.document.ResourceDoc;
import com.example.villages.resource.dto.ResourcePageResponse;
import com.example.villages.resource.dto.ResourceResponse;
import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.model.ResourceView;
import com.example.villages.resource.repository.ResourceRepository;
import com.example.villages.resource.visibility.MongoVisibilityCriteria;
import com.example.villages.resource.visibility.VisibilityPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read and delete paths for resources, filtered through the visibility gate.
 * Soft-deleted resources are invisible to everyone, including admins.
 */
@Slf4j
@Service
public class ResourceQueryService {

    static final int MAX_PAGE_SIZE = 100;
    private static final String FIELD_STATUS = "status";
    private static final String FIELD_CREATED_AT = "createdAt";

    private final ResourceRepository resourceRepository;
    private final ReactiveMongoTemplate mongoTemplate;
    private final ResourceVisibilityGate visibilityGate;
    private final VisibilityPolicy visibilityPolicy;
    private final ResourceCommandService commandService;
    private final AccessContextFactory contextFactory;

    @Nullable
    private final AuthzAuditService auditService;

    public ResourceQueryService(
            ResourceRepository resourceRepository,
            ReactiveMongoTemplate mongoTemplate,
            ResourceVisibilityGate visibilityGate,
            VisibilityPolicy visibilityPolicy,
            ResourceCommandService commandService,
            AccessContextFactory contextFactory,
            @Nullable AuthzAuditService auditService) {
        this.resourceRepository = resourceRepository;
        this.mongoTemplate = mongoTemplate;
        this.visibilityGate = visibilityGate;
        this.visibilityPolicy = visibilityPolicy;
        this.commandService = commandService;
        this.contextFactory = contextFactory;
        this.auditService = auditService;
    }

    /**
     * The resource if it exists and the viewer may see it, otherwise empty.
     */
    @NonNull
    public Mono<ResourceResponse> findVisibleById(
            String resourceId, Viewer viewer, @Nullable ServerHttpRequest request) {
        return findVisibleDoc(resourceId, viewer, Operation.READ, request)
                .map(ResourceResponse::from);
    }

    @NonNull
    public Mono<ResourcePageResponse> listVisible(
            Viewer viewer, @Nullable ResourceStatus status, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);

        return visibilityGate.grantsFor(viewer)
                .map(grants -> listCriteria(
                        MongoVisibilityCriteria.toCriteria(visibilityPolicy.predicateFor(viewer, grants)),
                        status))
                .flatMap(criteria -> {
                    Query pageQuery = new Query(criteria)
                            .with(PageRequest.of(safePage, safeSize, Sort.by(Sort.Direction.DESC, FIELD_CREATED_AT)));
                    Mono<List<ResourceResponse>> items = mongoTemplate.find(pageQuery, ResourceDoc.class)
                            .map(ResourceResponse::from)
                            .collectList();
                    Mono<Long> total = mongoTemplate.count(new Query(criteria), ResourceDoc.class);
                    return Mono.zip(items, total,
                            (resources, count) -> ResourcePageResponse.of(resources, safePage, safeSize, count));
                })
                .doOnNext(result -> log.debug("Listed visible resources: userId={}, role={}, returned={}, total={}",
                        viewer.userId(), viewer.role(), result.resources().size(), result.total()));
    }

    /**
     * Soft-deletes a resource. Errors with {@link ResourceNotFoundException} when the viewer
     * cannot see it, and {@link ResourceAccessDeniedException} when they see it but are
     * neither an admin nor its creator.
     */
    @NonNull
    public Mono<Void> delete(String resourceId, Viewer viewer, @Nullable ServerHttpRequest request) {
        return findVisibleDoc(resourceId, viewer, Operation.DELETE, request)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(resourceId)))
                .flatMap(doc -> {
                    ResourceView view = ResourceView.from(doc);
                    if (!visibilityGate.canDelete(view, viewer.userId(), viewer.role())) {
                        audit(viewer, resourceId, Operation.DELETE, false, "not admin or creator", request);
                        return Mono.error(new ResourceAccessDeniedException(
                                "Only an admin or the creator may delete a resource",
                                viewer.userId(), ResourceType.RESOURCE, Operation.DELETE));
                    }
                    return commandService.markDeleted(contextFactory.forResource(viewer, view), doc);
                })
                .then();
    }

    private Mono<ResourceDoc> findVisibleDoc(
            String resourceId, Viewer viewer, Operation operation, @Nullable ServerHttpRequest request) {
        return resourceRepository.findById(resourceId)
                .filter(doc -> doc.getStatus() != ResourceStatus.DELETED)
                .filterWhen(doc -> visibilityGate.checkResourceAccess(ResourceView.from(doc), viewer)
                        .doOnNext(visible -> audit(viewer, resourceId, operation, visible,
                                visible ? "visible" : "hidden by visibility", request)));
    }

    private static Criteria listCriteria(Criteria visibility, @Nullable ResourceStatus status) {
        Criteria notDeleted = Criteria.where(FIELD_STATUS).ne(ResourceStatus.DELETED.name());
        if (status == null) {
            return new Criteria().andOperator(visibility, notDeleted);
        }
        // a separate $and entry, since one Criteria cannot hold two conditions on the same key
        return new Criteria().andOperator(visibility, notDeleted, Criteria.where(FIELD_STATUS).is(status.name()));
    }

    private void audit(Viewer viewer, String resourceId, Operation operation, boolean allowed,
            String reason, @Nullable ServerHttpRequest request) {
        if (auditService != null) {
            auditService.logVisibilityDecision(
                    viewer.userId(), viewer.role(), resourceId, operation, allowed, reason, request);
        }
    }
}
