package com.example.villages.resource.repository;

import com.example.villages.resource.document.ResourceDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ResourceRepository extends ReactiveMongoRepository<ResourceDoc, String> {
}
