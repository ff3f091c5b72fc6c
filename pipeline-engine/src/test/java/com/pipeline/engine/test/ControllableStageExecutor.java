package com.pipeline.engine.test;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskType;
import com.pipeline.executor.StageContext;
import com.pipeline.executor.StageExecutionException;
import com.pipeline.executor.StageExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stage executor driven by the test.
 * Every execution blocks until the test completes or fails it, or until it is cancelled.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ControllableStageExecutor audio = new ControllableStageExecutor(TaskType.AUDIO);
 * dispatcher.generate("p1", Set.of(TaskType.AUDIO));
 *
 * PipelineTask running = audio.awaitStarted("p1");
 * audio.report(running.id(), ProgressDetails.ofPercentage(50));
 * audio.complete(running.id());
 * }</pre>
 */
public class ControllableStageExecutor implements StageExecutor {

    private static final Duration DEFAULT_WAIT = Duration.ofSeconds(5);

    private final TaskType type;
    private final Map<String, Control> controls = new ConcurrentHashMap<>();
    private final List<PipelineTask> started = new CopyOnWriteArrayList<>();
    private final List<String> cancelHookCalls = new CopyOnWriteArrayList<>();
    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger peakRunning = new AtomicInteger();
    private volatile boolean ignoreCancellation;

    public ControllableStageExecutor(TaskType type) {
        this.type = type;
    }

    @Override
    public TaskType type() {
        return type;
    }

    @Override
    public void execute(StageContext context) throws StageExecutionException {
        Control control = control(context.getTaskId());
        started.add(context.getTask());
        peakRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        try {
            while (true) {
                if (!ignoreCancellation) {
                    context.throwIfCancelled();
                }
                Outcome outcome = control.outcomes.poll(5, TimeUnit.MILLISECONDS);
                if (outcome == null) {
                    continue;
                }
                if (outcome.progress != null) {
                    context.reportProgress(outcome.progress);
                    continue;
                }
                if (outcome.failure != null) {
                    throw outcome.failure;
                }
                if (outcome.crash != null) {
                    throw outcome.crash;
                }
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StageExecutionException.cancelled(context.getTaskId());
        } finally {
            running.decrementAndGet();
        }
    }

    @Override
    public void cancel(PipelineTask task) {
        cancelHookCalls.add(task.id());
    }

    // ========== Test Controls ==========

    public void complete(String taskId) {
        control(taskId).outcomes.add(new Outcome(null, null, null));
    }

    public void fail(String taskId, String message) {
        control(taskId).outcomes.add(new Outcome(null, StageExecutionException.failed(message), null));
    }

    /**
     * Make the execution throw an unchecked exception.
     */
    public void crash(String taskId, RuntimeException error) {
        control(taskId).outcomes.add(new Outcome(null, null, error));
    }

    public void report(String taskId, ProgressDetails details) {
        control(taskId).outcomes.add(new Outcome(details, null, null));
    }

    /**
     * Keep running after the cancellation token is signalled, like an executor
     * blocked in a call that cannot be interrupted.
     */
    public void ignoreCancellation() {
        this.ignoreCancellation = true;
    }

    /**
     * Wait until a task of the project has started executing.
     */
    public PipelineTask awaitStarted(String projectId) {
        Conditions.await(() -> started.stream().anyMatch(t -> t.projectId().equals(projectId)),
            DEFAULT_WAIT, type + " task of " + projectId + " to start");
        return started.stream()
            .filter(t -> t.projectId().equals(projectId))
            .reduce((first, second) -> second)
            .orElseThrow();
    }

    public void awaitStartCount(int count) {
        Conditions.await(() -> started.size() >= count, DEFAULT_WAIT, count + " " + type + " start(s)");
    }

    public List<PipelineTask> started() {
        return List.copyOf(started);
    }

    public int running() {
        return running.get();
    }

    public int peakRunning() {
        return peakRunning.get();
    }

    public List<String> cancelHookCalls() {
        return List.copyOf(cancelHookCalls);
    }

    private Control control(String taskId) {
        return controls.computeIfAbsent(taskId, id -> new Control());
    }

    private static final class Control {
        private final BlockingQueue<Outcome> outcomes = new ArrayBlockingQueue<>(64);
    }

    private record Outcome(ProgressDetails progress, StageExecutionException failure, RuntimeException crash) {
    }
}
