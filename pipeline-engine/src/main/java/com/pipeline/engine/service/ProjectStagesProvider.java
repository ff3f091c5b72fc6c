package com.pipeline.engine.service;

import com.pipeline.core.model.TaskType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Supplies the stages a project has enabled, consulted when generation is requested
 * without an explicit stage list.
 */
@FunctionalInterface
public interface ProjectStagesProvider {

    Set<TaskType> enabledStages(String projectId);

    /**
     * Every project gets all four stages.
     */
    static ProjectStagesProvider allStages() {
        return projectId -> EnumSet.allOf(TaskType.class);
    }
}
