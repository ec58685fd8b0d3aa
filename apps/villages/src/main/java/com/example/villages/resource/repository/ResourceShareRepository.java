package com.example.villages.resource.repository;

import com.example.villages.resource.document.ResourceShareDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface ResourceShareRepository extends ReactiveMongoRepository<ResourceShareDoc, String> {

    Mono<Boolean> existsByResourceIdAndUserId(String resourceId, String userId);

    /**
     * All shares held by a user, for list filtering.
     */
    Flux<ResourceShareDoc> findByUserId(String userId);
}
