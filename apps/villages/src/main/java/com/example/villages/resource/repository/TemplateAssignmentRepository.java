package com.example.villages.resource.repository;

import com.example.villages.resource.document.TemplateAssignmentDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TemplateAssignmentRepository extends ReactiveMongoRepository<TemplateAssignmentDoc, String> {

    Mono<Boolean> existsByResourceIdAndAssigneeId(String resourceId, String assigneeId);

    /**
     * All assignments of a member, for list filtering.
     */
    Flux<TemplateAssignmentDoc> findByAssigneeId(String assigneeId);
}
