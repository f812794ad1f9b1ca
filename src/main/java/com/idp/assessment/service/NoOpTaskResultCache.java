package com.idp.assessment.service;

import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.TaskExecution;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Cache used when {@code assessment.cache.enabled} is off: nothing is kept.
 */
@Service
@ConditionalOnProperty(prefix = "assessment.cache", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoOpTaskResultCache implements TaskResultCache {

    @Override
    public Map<String, RawResponse> load(String documentId, String sectionId) {
        return Map.of();
    }

    @Override
    public void store(String documentId, String sectionId, List<TaskExecution> successful) {
    }

    @Override
    public void evict(String documentId, String sectionId) {
    }
}
