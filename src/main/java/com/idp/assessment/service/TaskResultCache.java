package com.idp.assessment.service;

import com.idp.assessment.model.RawResponse;
import com.idp.assessment.model.TaskExecution;

import java.util.List;
import java.util.Map;

/**
 * Keeps successful task responses of a document section between runs, so that a run retried after
 * partial failure only dispatches the tasks that failed. Failures of the cache itself are logged
 * and never fail a run.
 */
public interface TaskResultCache {

    /**
     * Cached responses keyed by task id; empty when nothing is cached or the ids are missing.
     */
    Map<String, RawResponse> load(String documentId, String sectionId);

    /**
     * Stores the successful executions of a run.
     */
    void store(String documentId, String sectionId, List<TaskExecution> successful);

    /**
     * Drops everything cached for the section.
     */
    void evict(String documentId, String sectionId);

    static String cacheKey(String documentId, String sectionId) {
        return "assesscache#" + documentId + "#" + sectionId;
    }
}
