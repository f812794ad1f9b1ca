package com.idp.assessment.config;

import com.idp.assessment.model.AssessmentSettings;
import com.idp.assessment.model.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration properties for the assessment engine.
 * Map keys containing dots or brackets must be escaped in YAML, e.g. {@code "[Items.Price]": 0.95}.
 */
@ConfigurationProperties(prefix = "assessment")
public record AssessmentProperties(
        Boolean enabled,
        Boolean granular,
        Integer simpleBatchSize,
        Integer listBatchSize,
        Integer maxWorkers,
        Double globalThreshold,
        Map<String, Double> perAttributeThresholds,
        Duration deadline,
        Retry retry,
        Cache cache,
        Prompt prompt
) {

    /**
     * Backoff for throttled inference calls.
     *
     * @param maxAttempts    attempts including the first one
     * @param initialBackoff first wait
     * @param maxBackoff     cap for a single wait
     */
    public record Retry(Integer maxAttempts, Duration initialBackoff, Duration maxBackoff) {}

    /**
     * Task-result cache used to resume runs after partial failure.
     *
     * @param enabled  store successful task results in MongoDB
     * @param mongoUri connection string including the database name
     */
    public record Cache(boolean enabled, String mongoUri) {}

    /**
     * Prompt configuration.
     *
     * @param system system prompt sent with every task
     * @param task   task prompt template with exactly one {@code <<CACHEPOINT>>} marker
     */
    public record Prompt(String system, String task) {}

    /** Effective run settings; unset values fall back to the engine defaults. */
    public AssessmentSettings toSettings() {
        RetryPolicy retryPolicy = retry == null ? RetryPolicy.DEFAULT : new RetryPolicy(
                retry.maxAttempts() != null ? retry.maxAttempts() : RetryPolicy.DEFAULT.maxAttempts(),
                retry.initialBackoff(),
                retry.maxBackoff());
        return new AssessmentSettings(
                enabled == null || enabled,
                granular == null || granular,
                simpleBatchSize != null ? simpleBatchSize : 3,
                listBatchSize != null ? listBatchSize : 1,
                maxWorkers != null ? maxWorkers : 20,
                globalThreshold,
                perAttributeThresholds,
                deadline,
                retryPolicy,
                prompt != null ? prompt.task() : null
        );
    }

    public String systemPrompt() {
        return prompt != null && prompt.system() != null ? prompt.system() : "";
    }

    public boolean cacheEnabled() {
        return cache != null && cache.enabled();
    }
}
