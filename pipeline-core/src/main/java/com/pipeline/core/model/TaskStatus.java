package com.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states for a pipeline task.
 */
public enum TaskStatus {
    /**
     * Task is waiting for its predecessor and a budget slot.
     * Transitions: -> PROCESSING, CANCELLED
     */
    PENDING("pending"),

    /**
     * Task holds a budget slot and its stage executor is running.
     * Transitions: -> COMPLETED, FAILED, CANCELLED
     */
    PROCESSING("processing"),

    /**
     * Stage executor finished successfully. Terminal state.
     */
    COMPLETED("completed"),

    /**
     * Stage executor failed or timed out.
     * Transitions: -> PENDING (explicit retry only)
     */
    FAILED("failed"),

    /**
     * Cancelled by an operator or by a predecessor that did not complete. Terminal state.
     */
    CANCELLED("cancelled");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Check if no further transition happens without operator action.
     * FAILED counts as terminal here; only an explicit retry leaves it.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if a predecessor in this state can never unblock its dependents.
     */
    public boolean blocksDependents() {
        return this == FAILED || this == CANCELLED;
    }

    /**
     * Check if transition to the target state is valid.
     */
    public boolean canTransitionTo(TaskStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == CANCELLED;
            case PROCESSING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case FAILED -> target == PENDING;
            case COMPLETED, CANCELLED -> false;
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
