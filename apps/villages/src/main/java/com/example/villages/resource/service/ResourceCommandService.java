package com.example.villages.resource.service;

import com.example.villages.authz.annotation.RequiresAccess;
import com.example.villages.authz.model.AccessContext;
import com.example.villages.authz.model.Operation;
import com.example.villages.authz.model.ResourceType;
import com.example.villages.common.util.StringSanitizer;
import com.example.villages.resource.document.ResourceDoc;
import com.example.villages.resource.model.ResourceStatus;
import com.example.villages.resource.repository.ResourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * State changes on resources. Each method is guarded by the RESOURCE rule table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResourceCommandService {

    private final ResourceRepository resourceRepository;

    @RequiresAccess(resource = ResourceType.RESOURCE, operation = Operation.DELETE)
    public Mono<ResourceDoc> markDeleted(AccessContext context, ResourceDoc resource) {
        resource.setStatus(ResourceStatus.DELETED);
        resource.setDeletedAt(Instant.now());
        return resourceRepository.save(resource)
                .doOnNext(saved -> log.info("Resource deleted: resourceId={}, by={}",
                        StringSanitizer.forLog(saved.getId()), StringSanitizer.forLog(context.userId())));
    }
}
