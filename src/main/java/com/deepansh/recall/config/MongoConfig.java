package com.deepansh.recall.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * Enable MongoDB auditing so @CreatedDate is populated on episodes and traces.
 * Index creation for the annotated documents is switched on in application.yml
 * (spring.data.mongodb.auto-index-creation).
 */
@Configuration
@EnableMongoAuditing
@EnableMongoRepositories(basePackages = "com.deepansh.recall.observability")
public class MongoConfig {
}
