package com.idp.assessment.model;

public enum TaskStatus {
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
