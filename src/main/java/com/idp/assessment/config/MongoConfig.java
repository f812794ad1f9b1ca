package com.idp.assessment.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.core.SimpleMongoClientDatabaseFactory;

/**
 * Points MongoDB at the task-result cache database from {@code assessment.cache.mongo-uri}.
 */
@Configuration
@ConditionalOnProperty(prefix = "assessment.cache", name = "enabled", havingValue = "true")
public class MongoConfig {

    @Bean
    public MongoDatabaseFactory mongoDatabaseFactory(AssessmentProperties properties) {
        return new SimpleMongoClientDatabaseFactory(properties.cache().mongoUri());
    }
}
