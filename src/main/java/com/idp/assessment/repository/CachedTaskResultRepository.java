package com.idp.assessment.repository;

import com.idp.assessment.model.CachedTaskResult;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Repository for cached task responses (collection assessment_task_cache).
 */
public interface CachedTaskResultRepository extends MongoRepository<CachedTaskResult, String> {

    List<CachedTaskResult> findByCacheKey(String cacheKey);

    void deleteByCacheKey(String cacheKey);
}
