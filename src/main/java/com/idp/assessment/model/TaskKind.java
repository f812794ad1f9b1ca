package com.idp.assessment.model;

/**
 * Kind of an assessment task. {@link #DOCUMENT} is only produced by the single-task fallback.
 */
public enum TaskKind {
    SIMPLE_BATCH,
    GROUP,
    LIST_ITEM,
    DOCUMENT
}
