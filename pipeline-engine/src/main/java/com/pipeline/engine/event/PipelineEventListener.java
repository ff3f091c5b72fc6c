package com.pipeline.engine.event;

/**
 * Receives scheduler events. Override the callbacks of interest.
 * Callbacks run on the subscriber's own delivery thread, in publication order.
 */
public interface PipelineEventListener {

    default void onProgress(TaskProgressEvent event) {
    }

    default void onStatusChange(TaskStatusEvent event) {
    }

    /**
     * The processing set went from non-empty to empty.
     */
    default void onPipelineComplete() {
    }

    default void onProjectFinished(ProjectFinishedEvent event) {
    }
}
