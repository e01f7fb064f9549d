package com.deepansh.learnermemory.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Repositories live next to the document they serve.
 * Index creation (including the unique natural-key index on learner_memories)
 * is enabled through spring.data.mongodb.auto-index-creation.
 */
@Configuration
@EnableMongoRepositories(basePackages = "com.deepansh.learnermemory.memory")
public class MongoConfig {
}
