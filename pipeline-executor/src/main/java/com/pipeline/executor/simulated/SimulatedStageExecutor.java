package com.pipeline.executor.simulated;

import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskType;
import com.pipeline.executor.FanOutWorkerPool;
import com.pipeline.executor.StageContext;
import com.pipeline.executor.StageExecutionException;
import com.pipeline.executor.StageExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Stand-in executor that sleeps instead of calling a generation service.
 * Registered when no real executor is configured for a stage, so the scheduler can be
 * run and observed end to end.
 *
 * Prompts are produced in batches and images one per prompt, both fanned out over the
 * stage's worker ceiling. Audio and subtitles report a direct percentage.
 */
public class SimulatedStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedStageExecutor.class);

    private static final int PROMPT_BATCH_SIZE = 4;

    private final TaskType type;
    private final int units;
    private final Duration unitDelay;

    public SimulatedStageExecutor(TaskType type, int units, Duration unitDelay) {
        if (units < 1) {
            throw new IllegalArgumentException("units must be at least 1: " + units);
        }
        this.type = type;
        this.units = units;
        this.unitDelay = unitDelay;
    }

    /**
     * One simulated executor per stage with default sizes.
     */
    public static List<SimulatedStageExecutor> forAllStages(Duration unitDelay) {
        return List.of(
            new SimulatedStageExecutor(TaskType.PROMPTS, 12, unitDelay),
            new SimulatedStageExecutor(TaskType.IMAGES, 12, unitDelay),
            new SimulatedStageExecutor(TaskType.AUDIO, 10, unitDelay),
            new SimulatedStageExecutor(TaskType.SUBTITLES, 5, unitDelay)
        );
    }

    @Override
    public TaskType type() {
        return type;
    }

    @Override
    public void execute(StageContext context) throws StageExecutionException {
        log.info("Simulating {} for project {} ({} units)", type, context.getProjectId(), units);

        switch (type) {
            case PROMPTS -> generatePrompts(context);
            case IMAGES -> generateImages(context);
            case AUDIO, SUBTITLES -> generateStepwise(context);
        }
    }

    private void generatePrompts(StageContext context) throws StageExecutionException {
        int batchCount = (units + PROMPT_BATCH_SIZE - 1) / PROMPT_BATCH_SIZE;
        List<Integer> batches = IntStream.range(0, batchCount).boxed().toList();

        FanOutWorkerPool.FanOutResult<Integer> result = FanOutWorkerPool.run(
            context,
            batches,
            batch -> {
                sleep(unitDelay);
                return Math.min(PROMPT_BATCH_SIZE, units - batch * PROMPT_BATCH_SIZE);
            },
            details -> ProgressDetails.ofCounts(promptsIn(details.completed()), units)
                .withFailed(promptsIn(details.failed() == null ? 0 : details.failed()))
                .withBatch(details.completed(), batchCount)
                .withWorkers(details.activeWorkers(), details.maxWorkers())
        );

        if (result.allFailed()) {
            throw StageExecutionException.failed("No prompt batch succeeded");
        }
    }

    // Batch counts to prompt counts; the last batch may be short.
    private int promptsIn(int batches) {
        return Math.min(units, batches * PROMPT_BATCH_SIZE);
    }

    private void generateImages(StageContext context) throws StageExecutionException {
        List<Integer> prompts = IntStream.range(0, units).boxed().toList();

        FanOutWorkerPool.FanOutResult<String> result = FanOutWorkerPool.run(
            context,
            prompts,
            prompt -> {
                sleep(unitDelay);
                return "image-" + prompt + ".png";
            }
        );

        if (result.allFailed()) {
            throw StageExecutionException.failed("All " + units + " images failed");
        }
    }

    private void generateStepwise(StageContext context) throws StageExecutionException {
        for (int step = 1; step <= units; step++) {
            context.pause(unitDelay);
            context.reportProgress(ProgressDetails.ofPercentage(step * 100 / units));
        }
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero()) {
            Thread.sleep(delay.toMillis());
        }
    }
}
