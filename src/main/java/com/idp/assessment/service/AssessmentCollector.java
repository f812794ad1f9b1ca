package com.idp.assessment.service;

import com.idp.assessment.model.AssessmentTask;
import com.idp.assessment.model.AssessmentTree;
import com.idp.assessment.model.ConfidenceEntry;
import com.idp.assessment.model.LeafPath;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Path-keyed sink for per-leaf results, written concurrently by worker threads.
 * Each leaf is written exactly once; tasks never share leaves, so a second write is a bug.
 */
public final class AssessmentCollector {

    private final ConcurrentHashMap<LeafPath, AssessmentTree> leaves = new ConcurrentHashMap<>();

    /**
     * Stores the parsed entries of one task.
     *
     * @throws IllegalStateException if a leaf was already written
     */
    public void record(String taskId, Map<LeafPath, ConfidenceEntry> entries) {
        entries.forEach((path, entry) -> put(taskId, path, new AssessmentTree.Assessed(entry)));
    }

    /**
     * Marks every leaf of a failed task as unavailable.
     *
     * @throws IllegalStateException if a leaf was already written
     */
    public void markUnavailable(AssessmentTask task, String reason) {
        AssessmentTree.Unavailable marker = new AssessmentTree.Unavailable(task.id(), reason);
        for (LeafPath path : task.leafPaths()) {
            put(task.id(), path, marker);
        }
    }

    /** Result for the leaf, or {@code null} if nothing was written. */
    public AssessmentTree get(LeafPath path) {
        return leaves.get(path);
    }

    public int size() {
        return leaves.size();
    }

    private void put(String taskId, LeafPath path, AssessmentTree value) {
        AssessmentTree previous = leaves.putIfAbsent(path, value);
        if (previous != null) {
            throw new IllegalStateException("Leaf " + path + " written twice (second write by task " + taskId + ")");
        }
    }
}
