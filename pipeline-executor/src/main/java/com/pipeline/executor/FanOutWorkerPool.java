package com.pipeline.executor;

import com.pipeline.core.model.ProgressDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Runs the sub-units of one task with bounded parallelism.
 *
 * At most {@code context.getMaxWorkers()} units run at once. A failed unit is counted and
 * the remaining units still run. After every unit starts or finishes, progress is reported
 * as completed/total with failed, active and max worker counts. Units not yet started
 * when the task is cancelled are skipped and the run ends with a cancellation.
 *
 * Usage:
 * <pre>
 * FanOutResult&lt;Image&gt; result = FanOutWorkerPool.run(context, prompts, prompt -> client.render(prompt));
 * </pre>
 */
public final class FanOutWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(FanOutWorkerPool.class);

    private FanOutWorkerPool() {
    }

    /**
     * One unit of work inside a task.
     */
    @FunctionalInterface
    public interface WorkUnit<T, R> {
        R process(T item) throws Exception;
    }

    /**
     * Outcome of a fan-out run. Results keep input order; failed units leave a null entry.
     */
    public record FanOutResult<R>(List<R> results, int completed, int failed, List<Throwable> errors) {

        public boolean allFailed() {
            return completed == 0 && failed > 0;
        }
    }

    public static <T, R> FanOutResult<R> run(StageContext context, List<T> items, WorkUnit<T, R> unit)
            throws StageExecutionException {
        return run(context, items, unit, UnaryOperator.identity());
    }

    /**
     * Run every item through the unit.
     *
     * @param decorator Adjusts each progress report before it is sent, e.g. to add batch fields
     * @throws StageExecutionException if the task is cancelled before all units finish
     */
    public static <T, R> FanOutResult<R> run(
            StageContext context,
            List<T> items,
            WorkUnit<T, R> unit,
            UnaryOperator<ProgressDetails> decorator) throws StageExecutionException {

        int total = items.size();
        int maxWorkers = Math.max(1, context.getMaxWorkers());
        Tracker tracker = new Tracker(context, total, maxWorkers, decorator);

        if (total == 0) {
            tracker.report();
            return new FanOutResult<>(List.of(), 0, 0, List.of());
        }

        List<R> results = new ArrayList<>(Collections.nCopies(total, null));
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        ExecutorService workers = Executors.newFixedThreadPool(
            Math.min(maxWorkers, total), threadFactory(context.getTaskId()));

        try {
            List<Future<?>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                int index = i;
                T item = items.get(i);
                futures.add(workers.submit(() -> {
                    if (context.isCancelled()) {
                        return;
                    }
                    tracker.started();
                    try {
                        R value = unit.process(item);
                        synchronized (results) {
                            results.set(index, value);
                        }
                        tracker.finished(true);
                    } catch (Exception e) {
                        log.warn("Unit {} of task {} failed: {}", index, context.getTaskId(), e.getMessage());
                        errors.add(e);
                        tracker.finished(false);
                    }
                }));
            }

            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StageExecutionException.cancelled(context.getTaskId());
        } catch (ExecutionException e) {
            throw new StageExecutionException(StageExecutionException.GENERATION_FAILED,
                "Worker crashed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            workers.shutdownNow();
        }

        context.throwIfCancelled();

        List<R> snapshot;
        synchronized (results) {
            snapshot = new ArrayList<>(results);
        }
        return new FanOutResult<>(snapshot, tracker.completed, tracker.failed, List.copyOf(errors));
    }

    private static ThreadFactory threadFactory(String taskId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "fanout-" + taskId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Counters shared by the workers of one run. Reports are sent under the tracker lock
     * so observers see counts that never go backwards.
     */
    private static final class Tracker {
        private final StageContext context;
        private final int total;
        private final int maxWorkers;
        private final UnaryOperator<ProgressDetails> decorator;
        private int completed;
        private int failed;
        private int active;

        Tracker(StageContext context, int total, int maxWorkers, UnaryOperator<ProgressDetails> decorator) {
            this.context = context;
            this.total = total;
            this.maxWorkers = maxWorkers;
            this.decorator = decorator;
        }

        synchronized void started() {
            active++;
            report();
        }

        synchronized void finished(boolean success) {
            active--;
            if (success) {
                completed++;
            } else {
                failed++;
            }
            report();
        }

        synchronized void report() {
            ProgressDetails details = ProgressDetails.ofCounts(completed, total)
                .withFailed(failed)
                .withWorkers(active, maxWorkers);
            context.reportProgress(decorator.apply(details));
        }
    }
}
