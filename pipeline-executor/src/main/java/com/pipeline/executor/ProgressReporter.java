package com.pipeline.executor;

import com.pipeline.core.model.ProgressDetails;

/**
 * Callback receiving sub-progress from a running stage.
 */
@FunctionalInterface
public interface ProgressReporter {
    void report(ProgressDetails details);
}
