package com.pipeline.engine.event;

import com.pipeline.core.model.ProjectStatus;

/**
 * Every task of a project reached completed, failed or cancelled.
 */
public record ProjectFinishedEvent(String projectId, ProjectStatus status) {
}
