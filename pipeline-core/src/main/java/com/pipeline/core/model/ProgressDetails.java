package com.pipeline.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Stage-specific sub-progress reported by a stage executor.
 *
 * Stages that produce countable sub-units (prompts, images) report
 * {@code completed}/{@code total}; stages without sub-units (audio) report a direct
 * {@code percentage}. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressDetails(
    Integer completed,
    Integer total,
    Integer failed,
    Integer currentBatch,
    Integer batchCount,
    Integer activeWorkers,
    Integer maxWorkers,
    Integer percentage,
    String message
) {
    public static final ProgressDetails EMPTY =
        new ProgressDetails(null, null, null, null, null, null, null, null, null);

    /**
     * Sub-unit counts: {@code completed} of {@code total} done.
     */
    public static ProgressDetails ofCounts(int completed, int total) {
        return new ProgressDetails(completed, total, null, null, null, null, null, null, null);
    }

    /**
     * A direct percentage, for stages without countable sub-units.
     */
    public static ProgressDetails ofPercentage(int percentage) {
        return new ProgressDetails(null, null, null, null, null, null, null, percentage, null);
    }

    public boolean hasCounts() {
        return total != null && completed != null;
    }

    public ProgressDetails withFailed(int failedCount) {
        return new ProgressDetails(completed, total, failedCount, currentBatch, batchCount,
            activeWorkers, maxWorkers, percentage, message);
    }

    public ProgressDetails withBatch(int current, int count) {
        return new ProgressDetails(completed, total, failed, current, count,
            activeWorkers, maxWorkers, percentage, message);
    }

    public ProgressDetails withWorkers(int active, int max) {
        return new ProgressDetails(completed, total, failed, currentBatch, batchCount,
            active, max, percentage, message);
    }

    public ProgressDetails withMessage(String text) {
        return new ProgressDetails(completed, total, failed, currentBatch, batchCount,
            activeWorkers, maxWorkers, percentage, text);
    }
}
