package com.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate status of a project's task group, derived from member task statuses.
 */
public enum ProjectStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireName;

    ProjectStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
