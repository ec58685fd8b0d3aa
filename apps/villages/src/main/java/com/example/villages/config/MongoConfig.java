package com.example.villages.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;

@Configuration
@EnableReactiveMongoRepositories(basePackages = {
        "com.example.villages.resource.repository",
        "com.example.villages.user.repository"
})
@EnableReactiveMongoAuditing
public class MongoConfig {
    // Indexes are created by Spring Data MongoDB from @Indexed and @CompoundIndex when auto-index-creation is on
}
