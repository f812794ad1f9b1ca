package com.idp.assessment.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Successful task response kept so a retried run only re-dispatches the tasks that failed.
 * Stored in MongoDB (collection assessment_task_cache).
 */
@Document(collection = "assessment_task_cache")
public record CachedTaskResult(
        @Id String id,
        @Indexed String cacheKey,
        String taskId,
        String responseText,
        long inputTokens,
        long outputTokens,
        Instant createdAt,
        Instant expiresAt
) {}
