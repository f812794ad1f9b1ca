package com.idp.assessment.service;

import com.idp.assessment.model.CachedTaskResult;
import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.TaskExecution;
import com.idp.assessment.model.TokenUsage;
import com.idp.assessment.repository.CachedTaskResultRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * MongoDB-backed {@link TaskResultCache}. Entries expire one day after they were written.
 */
@Service
@ConditionalOnProperty(prefix = "assessment.cache", name = "enabled", havingValue = "true")
public class MongoTaskResultCache implements TaskResultCache {

    private static final Logger log = LoggerFactory.getLogger(MongoTaskResultCache.class);

    static final Duration TTL = Duration.ofDays(1);

    private final CachedTaskResultRepository repository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final AtomicBoolean ttlIndexEnsured = new AtomicBoolean();

    public MongoTaskResultCache(CachedTaskResultRepository repository, MongoTemplate mongoTemplate) {
        this(repository, mongoTemplate, Clock.systemUTC());
    }

    MongoTaskResultCache(CachedTaskResultRepository repository, MongoTemplate mongoTemplate, Clock clock) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public Map<String, RawResponse> load(String documentId, String sectionId) {
        if (documentId == null || sectionId == null) {
            return Map.of();
        }
        String key = TaskResultCache.cacheKey(documentId, sectionId);
        try {
            Instant now = clock.instant();
            Map<String, RawResponse> cached = new LinkedHashMap<>();
            for (CachedTaskResult entry : repository.findByCacheKey(key)) {
                if (entry.expiresAt() != null && entry.expiresAt().isAfter(now)) {
                    cached.put(entry.taskId(), new RawResponse(entry.responseText(),
                            new TokenUsage(entry.inputTokens(), entry.outputTokens())));
                }
            }
            log.info("MongoTaskResultCache: {} cached task results for {}", cached.size(), key);
            return cached;
        } catch (DataAccessException e) {
            log.warn("MongoTaskResultCache: could not load {}: {}", key, e.getMessage());
            return Map.of();
        }
    }

    @Override
    public void store(String documentId, String sectionId, List<TaskExecution> successful) {
        if (documentId == null || sectionId == null || successful.isEmpty()) {
            return;
        }
        String key = TaskResultCache.cacheKey(documentId, sectionId);
        Instant now = clock.instant();
        List<CachedTaskResult> entries = successful.stream()
                .filter(execution -> execution.response() != null)
                .map(execution -> new CachedTaskResult(
                        key + "#" + execution.task().id(),
                        key,
                        execution.task().id(),
                        execution.response().text(),
                        execution.response().usage().inputTokens(),
                        execution.response().usage().outputTokens(),
                        now,
                        now.plus(TTL)))
                .toList();
        try {
            ensureTtlIndex();
            repository.saveAll(entries);
            log.info("MongoTaskResultCache: stored {} task results for {}", entries.size(), key);
        } catch (DataAccessException e) {
            log.warn("MongoTaskResultCache: could not store {}: {}", key, e.getMessage());
        }
    }

    @Override
    public void evict(String documentId, String sectionId) {
        if (documentId == null || sectionId == null) {
            return;
        }
        String key = TaskResultCache.cacheKey(documentId, sectionId);
        try {
            repository.deleteByCacheKey(key);
        } catch (DataAccessException e) {
            log.warn("MongoTaskResultCache: could not evict {}: {}", key, e.getMessage());
        }
    }

    private void ensureTtlIndex() {
        if (ttlIndexEnsured.compareAndSet(false, true)) {
            mongoTemplate.indexOps(CachedTaskResult.class)
                    .ensureIndex(new Index().on("expiresAt", Sort.Direction.ASC).expire(Duration.ZERO));
        }
    }
}
