package com.example.villages.user.repository;

import com.example.villages.user.document.UserDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends ReactiveMongoRepository<UserDoc, String> {
}
