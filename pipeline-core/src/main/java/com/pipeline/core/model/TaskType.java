package com.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.pipeline.core.exception.StageValidationException;

/**
 * Generation stages a project can request.
 * Each stage carries its fixed weight in the project-level overall progress.
 */
public enum TaskType {
    /**
     * Prompt synthesis from the project script.
     * Produces the prompt list consumed by IMAGES.
     */
    PROMPTS("prompts", 0.20),

    /**
     * Image synthesis, one image per prompt, fanned out inside the task.
     */
    IMAGES("images", 0.40),

    /**
     * Audio narration of the script.
     */
    AUDIO("audio", 0.30),

    /**
     * Subtitle extraction from the narration audio.
     */
    SUBTITLES("subtitles", 0.10);

    private final String wireName;
    private final double progressWeight;

    TaskType(String wireName, double progressWeight) {
        this.wireName = wireName;
        this.progressWeight = progressWeight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Weight of this stage in the overall project progress. Weights sum to 1.0.
     */
    public double progressWeight() {
        return progressWeight;
    }

    /**
     * Resolve a stage from its wire name, case-insensitively.
     *
     * @throws StageValidationException if the name is not a known stage
     */
    @JsonCreator
    public static TaskType fromWireName(String name) {
        if (name != null) {
            for (TaskType type : values()) {
                if (type.wireName.equalsIgnoreCase(name.trim())) {
                    return type;
                }
            }
        }
        throw new StageValidationException("taskType", "unknown stage '" + name + "'");
    }

    @Override
    public String toString() {
        return wireName;
    }
}
