package com.pipeline.engine.dispatcher;

import com.pipeline.core.exception.DuplicateGenerationException;
import com.pipeline.core.exception.InvalidStateTransitionException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.ProjectProgress;
import com.pipeline.core.model.QueueStats;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.core.repository.TaskRepository;
import com.pipeline.engine.budget.ConcurrencyBudgetManager;
import com.pipeline.engine.event.PipelineEventBus;
import com.pipeline.engine.event.PipelineEventListener;
import com.pipeline.engine.event.ProjectFinishedEvent;
import com.pipeline.engine.event.Subscription;
import com.pipeline.engine.event.TaskProgressEvent;
import com.pipeline.engine.event.TaskStatusEvent;
import com.pipeline.engine.logging.LoggingContext;
import com.pipeline.engine.progress.ProgressAggregator;
import com.pipeline.engine.recovery.OrphanedTaskRecovery;
import com.pipeline.engine.resolver.DependencyGraphResolver;
import com.pipeline.engine.service.PipelineQueueService;
import com.pipeline.engine.service.ProjectStagesProvider;
import com.pipeline.executor.CancellationToken;
import com.pipeline.executor.StageContext;
import com.pipeline.executor.StageExecutionException;
import com.pipeline.executor.StageExecutor;
import com.pipeline.executor.StageExecutorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns the task state machine and admits pending tasks into stage executors.
 *
 * Responsibilities:
 * - Select ready tasks in (priority, createdAt, id) order on every state change,
 *   on resume and on a periodic tick
 * - Hold back dependents until their predecessor completed; cancel them when it did not
 * - Reserve budget slots before admission and release them exactly once
 * - Run executors off the scheduler lock and fold their results back in
 * - Publish progress, status, drain and project-finished events in transition order
 *
 * Every transition happens under one lock. Executor calls and cancel hooks run outside it.
 */
public class PipelineDispatcher implements PipelineQueueService {

    private static final Logger log = LoggerFactory.getLogger(PipelineDispatcher.class);

    private static final Duration STATS_WINDOW = Duration.ofHours(24);
    private static final String CANCELLED_BY_USER = "Cancelled by user";
    private static final String NO_EXECUTOR = "NO_EXECUTOR";
    private static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final TaskRepository taskRepository;
    private final DependencyGraphResolver resolver;
    private final ConcurrencyBudgetManager budgetManager;
    private final StageExecutorRegistry executors;
    private final PipelineEventBus eventBus;
    private final ProjectStagesProvider stagesProvider;
    private final OrphanedTaskRecovery recovery;
    private final Clock clock;
    private final Duration tickInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Map<String, ActiveExecution> active = new HashMap<>();

    private final ExecutorService executionPool;
    private final ScheduledExecutorService scheduler;

    // guarded by lock
    private boolean running;
    private boolean shuttingDown;
    private boolean drainArmed;

    public PipelineDispatcher(
            TaskRepository taskRepository,
            DependencyGraphResolver resolver,
            ConcurrencyBudgetManager budgetManager,
            StageExecutorRegistry executors,
            PipelineEventBus eventBus,
            ProjectStagesProvider stagesProvider,
            Clock clock,
            Duration tickInterval) {
        this.taskRepository = taskRepository;
        this.resolver = resolver;
        this.budgetManager = budgetManager;
        this.executors = executors;
        this.eventBus = eventBus;
        this.stagesProvider = stagesProvider;
        this.recovery = new OrphanedTaskRecovery(taskRepository);
        this.clock = clock;
        this.tickInterval = tickInterval;
        this.executionPool = Executors.newCachedThreadPool(namedThreads("stage-executor"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("pipeline-dispatcher"));
    }

    // ========== Lifecycle ==========

    /**
     * Recover orphaned tasks, start the periodic tick and run a first selection.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            if (shuttingDown) {
                throw new IllegalStateException("Dispatcher has been shut down");
            }
            recovery.recover();
            running = true;
            log.info("Dispatcher started (tick every {} ms, budget {})", tickInterval.toMillis(), budgetManager.getBudget());
            dispatchLocked();
        } finally {
            lock.unlock();
        }
        scheduler.scheduleWithFixedDelay(this::tick,
            tickInterval.toMillis(), tickInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop admissions, signal every running execution and wait for them to return.
     * Executions interrupted by shutdown go back to pending.
     *
     * @return true if every execution returned within the grace period
     */
    public boolean shutdown(Duration gracePeriod) {
        List<ActiveExecution> signalled;
        lock.lock();
        try {
            if (shuttingDown) {
                return active.isEmpty();
            }
            shuttingDown = true;
            running = false;
            signalled = new ArrayList<>(active.values());
            signalled.forEach(execution -> execution.token.cancel(CancellationToken.Reason.SHUTDOWN));
            log.info("Dispatcher shutting down, {} execution(s) in flight", signalled.size());
        } finally {
            lock.unlock();
        }

        signalled.forEach(execution -> invokeCancelHook(execution.task));

        int remaining;
        lock.lock();
        try {
            long nanos = gracePeriod.toNanos();
            while (!active.isEmpty() && nanos > 0) {
                nanos = drained.awaitNanos(nanos);
            }
            remaining = active.size();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            remaining = active.size();
        } finally {
            lock.unlock();
        }

        scheduler.shutdownNow();
        executionPool.shutdownNow();

        if (remaining > 0) {
            log.warn("{} execution(s) still running after {} s; they stay processing until the next start recovers them",
                remaining, gracePeriod.toSeconds());
            return false;
        }
        log.info("Dispatcher stopped");
        return true;
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    private void tick() {
        lock.lock();
        try {
            dispatchLocked();
        } catch (RuntimeException e) {
            log.error("Error in dispatch tick", e);
        } finally {
            lock.unlock();
        }
    }

    // ========== Queries ==========

    @Override
    public List<PipelineTask> listTasks() {
        return taskRepository.findAll();
    }

    @Override
    public List<PipelineTask> listProjectTasks(String projectId) {
        return taskRepository.findByProject(projectId);
    }

    @Override
    public PipelineTask getTask(String taskId) {
        return taskRepository.findById(taskId)
            .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    @Override
    public QueueStats getStats() {
        Instant since = clock.instant().minus(STATS_WINDOW);
        return new QueueStats(
            taskRepository.countByStatus(TaskStatus.PENDING),
            taskRepository.countByStatus(TaskStatus.PROCESSING),
            taskRepository.countFinishedSince(TaskStatus.COMPLETED, since),
            taskRepository.countFinishedSince(TaskStatus.FAILED, since),
            taskRepository.count(),
            budgetManager.activeWorkers(),
            budgetManager.activeProjects(),
            budgetManager.stageWorkers(),
            budgetManager.getBudget().maxProjects(),
            budgetManager.getBudget().effectiveStageLimits()
        );
    }

    @Override
    public boolean getPaused() {
        return budgetManager.isPaused();
    }

    @Override
    public ProjectProgress projectProgress(String projectId) {
        List<PipelineTask> tasks = taskRepository.findByProject(projectId);
        if (tasks.isEmpty()) {
            throw new NotFoundException("Project", projectId);
        }
        return ProgressAggregator.projectProgress(projectId, latestPerStage(tasks));
    }

    // ========== Control ==========

    @Override
    public void pause() {
        budgetManager.pause();
    }

    @Override
    public void resume() {
        budgetManager.resume();
        lock.lock();
        try {
            dispatchLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void cancelTask(String taskId) {
        PipelineTask hookTarget = null;
        lock.lock();
        try {
            PipelineTask task = getTask(taskId);
            switch (task.status()) {
                case PENDING -> {
                    PipelineTask cancelled = transition(task, task.withCancelled(CANCELLED_BY_USER, clock.instant()));
                    log.info("Cancelled pending task {} ({}) of project {}", taskId, task.taskType(), task.projectId());
                    cascadeCancelLocked(cancelled);
                    checkProjectFinishedLocked(task.projectId());
                    dispatchLocked();
                }
                case PROCESSING -> {
                    ActiveExecution execution = active.get(taskId);
                    if (execution == null) {
                        // No live executor behind it; nothing to wait for.
                        PipelineTask cancelled = transition(task, task.withCancelled(CANCELLED_BY_USER, clock.instant()));
                        cascadeCancelLocked(cancelled);
                        checkProjectFinishedLocked(task.projectId());
                        dispatchLocked();
                    } else if (!execution.cancelRequested) {
                        execution.cancelRequested = true;
                        execution.token.cancel(CancellationToken.Reason.USER);
                        hookTarget = execution.task;
                        log.info("Cancellation requested for processing task {} ({})", taskId, task.taskType());
                    }
                }
                default -> throw new InvalidStateTransitionException(taskId, task.status(), TaskStatus.CANCELLED);
            }
        } finally {
            lock.unlock();
        }
        if (hookTarget != null) {
            invokeCancelHook(hookTarget);
        }
    }

    @Override
    public void retryTask(String taskId) {
        lock.lock();
        try {
            PipelineTask task = getTask(taskId);
            if (task.status() != TaskStatus.FAILED) {
                throw new InvalidStateTransitionException(taskId, task.status(), TaskStatus.PENDING);
            }
            transition(task, task.withPending());
            log.info("Retrying task {} ({}) of project {}, {} attempt(s) so far",
                taskId, task.taskType(), task.projectId(), task.attempts());
            dispatchLocked();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public PipelineTask reorderTask(String taskId, int priority) {
        lock.lock();
        try {
            PipelineTask task = getTask(taskId);
            PipelineTask reordered = task.withPriority(priority);
            taskRepository.update(reordered);
            log.info("Task {} priority {} -> {}", taskId, task.priority(), reordered.priority());
            dispatchLocked();
            return reordered;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PipelineTask> generate(String projectId) {
        return generate(projectId, stagesProvider.enabledStages(projectId));
    }

    @Override
    public List<PipelineTask> generate(String projectId, Collection<TaskType> stages) {
        List<PipelineTask> tasks = resolver.resolve(projectId, stages);

        lock.lock();
        try {
            long unfinished = taskRepository.findByProject(projectId).stream()
                .filter(t -> t.status() == TaskStatus.PENDING || t.status() == TaskStatus.PROCESSING)
                .count();
            if (unfinished > 0) {
                throw new DuplicateGenerationException(projectId, unfinished);
            }

            taskRepository.saveAll(tasks);
            try (var ctx = LoggingContext.forProject(projectId)) {
                log.info("Queued {} task(s) for project {}: {}", tasks.size(), projectId,
                    tasks.stream().map(PipelineTask::taskType).toList());
            }
            tasks.forEach(task -> publishStatus(null, task));
            dispatchLocked();
            return tasks;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int deleteProject(String projectId) {
        List<ActiveExecution> stopped = new ArrayList<>();
        int deleted;
        lock.lock();
        try {
            for (ActiveExecution execution : List.copyOf(active.values())) {
                if (execution.task.projectId().equals(projectId)) {
                    execution.token.cancel(CancellationToken.Reason.PROJECT_DELETED);
                    releaseLocked(execution);
                    stopped.add(execution);
                }
            }
            deleted = taskRepository.deleteByProject(projectId);
            log.info("Deleted {} task(s) of project {} ({} running execution(s) stopped)",
                deleted, projectId, stopped.size());
            dispatchLocked();
        } finally {
            lock.unlock();
        }
        stopped.forEach(execution -> invokeCancelHook(execution.task));
        return deleted;
    }

    // ========== Subscriptions ==========

    @Override
    public Subscription subscribe(PipelineEventListener listener) {
        return eventBus.subscribe(listener);
    }

    @Override
    public Subscription onProgress(Consumer<TaskProgressEvent> callback) {
        return eventBus.onProgress(callback);
    }

    @Override
    public Subscription onStatusChange(Consumer<TaskStatusEvent> callback) {
        return eventBus.onStatusChange(callback);
    }

    @Override
    public Subscription onPipelineComplete(Runnable callback) {
        return eventBus.onPipelineComplete(callback);
    }

    // ========== Selection ==========

    /**
     * One selection pass. Caller holds the lock.
     */
    private void dispatchLocked() {
        if (running && !shuttingDown) {
            Map<String, Optional<PipelineTask>> predecessors = new HashMap<>();
            Set<String> finishedProjects = new LinkedHashSet<>();

            for (PipelineTask task : taskRepository.findByStatus(TaskStatus.PENDING)) {
                if (task.hasDependency()) {
                    // Status may have changed earlier in this pass, so cascaded tasks are re-read.
                    Optional<PipelineTask> predecessor = predecessors.computeIfAbsent(
                        task.dependsOnTaskId(), taskRepository::findById);

                    if (predecessor.isPresent()) {
                        TaskStatus predecessorStatus = predecessor.get().status();
                        if (predecessorStatus.blocksDependents()) {
                            Optional<PipelineTask> current = taskRepository.findById(task.id());
                            if (current.isPresent() && current.get().status() == TaskStatus.PENDING) {
                                PipelineTask cancelled = cancelForDependency(current.get(), predecessor.get());
                                cascadeCancelLocked(cancelled);
                                finishedProjects.add(task.projectId());
                            }
                            predecessors.clear();
                            continue;
                        }
                        if (predecessorStatus != TaskStatus.COMPLETED) {
                            continue;
                        }
                    }
                }

                if (budgetManager.isPaused()) {
                    continue;
                }
                if (taskRepository.findById(task.id()).map(PipelineTask::status).orElse(null) != TaskStatus.PENDING) {
                    continue;
                }
                if (budgetManager.tryReserve(task.taskType(), task.projectId())) {
                    admitLocked(task);
                } else {
                    log.debug("No budget slot for task {} ({}) of project {}", task.id(), task.taskType(), task.projectId());
                }
            }

            finishedProjects.forEach(this::checkProjectFinishedLocked);
        }
        checkDrainLocked();
    }

    private void admitLocked(PipelineTask task) {
        PipelineTask processing = transition(task, task.withProcessing(clock.instant()));
        ActiveExecution execution = new ActiveExecution(processing);
        active.put(processing.id(), execution);
        drainArmed = true;

        budgetManager.getBudget().timeout(processing.taskType()).ifPresent(timeout ->
            execution.timeoutFuture = scheduler.schedule(
                () -> onTimeout(execution, timeout), timeout.toMillis(), TimeUnit.MILLISECONDS));

        log.info("Admitted task {} ({}) of project {}, attempt {}",
            processing.id(), processing.taskType(), processing.projectId(), processing.attempts());
        executionPool.execute(() -> runExecution(execution));
    }

    private void checkDrainLocked() {
        if (drainArmed && active.isEmpty()) {
            drainArmed = false;
            log.info("Pipeline drained, no task processing");
            eventBus.publishPipelineComplete();
        }
    }

    // ========== Execution ==========

    private void runExecution(ActiveExecution execution) {
        PipelineTask task = execution.task;
        StageContext context = new StageContext(
            task,
            budgetManager.maxWorkers(task.taskType()),
            details -> onProgress(execution, details),
            execution.token
        );

        String errorCode = null;
        String message = null;
        String stack = null;

        try (var ctx = LoggingContext.forTask(task)) {
            Optional<StageExecutor> executor = executors.find(task.taskType());
            try {
                if (executor.isEmpty()) {
                    throw new StageExecutionException(NO_EXECUTOR,
                        "No executor registered for stage " + task.taskType());
                }
                log.info("Executing {} for project {} (attempt {})", task.taskType(), task.projectId(), task.attempts());
                executor.get().execute(context);
            } catch (StageExecutionException e) {
                log.warn("Task {} failed: {} - {}", task.id(), e.getErrorCode(), e.getMessage());
                errorCode = e.getErrorCode();
                message = e.getMessage();
                stack = stackTrace(e);
            } catch (Exception e) {
                log.error("Task {} failed with unexpected error", task.id(), e);
                errorCode = INTERNAL_ERROR;
                message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
                stack = stackTrace(e);
            }
        }

        if (errorCode == null) {
            onSuccess(execution);
        } else {
            onFailure(execution, message, stack);
        }
    }

    private void onProgress(ActiveExecution execution, ProgressDetails details) {
        lock.lock();
        try {
            if (!isCurrent(execution)) {
                log.debug("Ignoring progress for task {}: execution no longer current", execution.task.id());
                return;
            }
            Optional<PipelineTask> current = taskRepository.findById(execution.task.id());
            if (current.isEmpty() || current.get().status() != TaskStatus.PROCESSING) {
                return;
            }
            int progress = ProgressAggregator.taskProgress(details, TaskStatus.PROCESSING);
            PipelineTask updated = current.get().withProgress(progress, details);
            taskRepository.update(updated);
            eventBus.publishProgress(new TaskProgressEvent(
                updated.id(), updated.projectId(), updated.taskType(), updated.progress(), details));
        } finally {
            lock.unlock();
        }
    }

    private void onSuccess(ActiveExecution execution) {
        lock.lock();
        try {
            if (!isCurrent(execution)) {
                log.warn("Ignoring late result for task {}", execution.task.id());
                return;
            }
            releaseLocked(execution);
            Optional<PipelineTask> current = taskRepository.findById(execution.task.id());
            if (current.isEmpty()) {
                dispatchLocked();
                return;
            }
            PipelineTask task = current.get();
            Instant now = clock.instant();

            if (execution.cancelRequested) {
                PipelineTask cancelled = transition(task, task.withCancelled(CANCELLED_BY_USER, now));
                log.info("Task {} ({}) cancelled", task.id(), task.taskType());
                cascadeCancelLocked(cancelled);
            } else {
                transition(task, task.withCompleted(now));
                log.info("Task {} ({}) of project {} completed", task.id(), task.taskType(), task.projectId());
            }
            checkProjectFinishedLocked(task.projectId());
            dispatchLocked();
        } finally {
            lock.unlock();
        }
    }

    private void onFailure(ActiveExecution execution, String message, String stack) {
        lock.lock();
        try {
            if (!isCurrent(execution)) {
                log.warn("Ignoring late failure for task {}: {}", execution.task.id(), message);
                return;
            }
            releaseLocked(execution);
            Optional<PipelineTask> current = taskRepository.findById(execution.task.id());
            if (current.isEmpty()) {
                dispatchLocked();
                return;
            }
            PipelineTask task = current.get();
            Instant now = clock.instant();

            if (execution.cancelRequested) {
                PipelineTask cancelled = transition(task, task.withCancelled(CANCELLED_BY_USER, now));
                log.info("Task {} ({}) cancelled", task.id(), task.taskType());
                cascadeCancelLocked(cancelled);
                checkProjectFinishedLocked(task.projectId());
            } else if (execution.token.reason().orElse(null) == CancellationToken.Reason.SHUTDOWN) {
                // Same reset as startup recovery.
                PipelineTask reset = task.withPending();
                taskRepository.update(reset);
                publishStatus(TaskStatus.PROCESSING, reset);
                log.info("Task {} ({}) interrupted by shutdown, back to pending", task.id(), task.taskType());
            } else {
                PipelineTask failed = transition(task, task.withFailed(message, stack, now));
                log.warn("Task {} ({}) of project {} failed: {}", task.id(), task.taskType(), task.projectId(), message);
                cascadeCancelLocked(failed);
                checkProjectFinishedLocked(task.projectId());
            }
            dispatchLocked();
        } finally {
            lock.unlock();
        }
    }

    private void onTimeout(ActiveExecution execution, Duration timeout) {
        lock.lock();
        try {
            if (!isCurrent(execution)) {
                return;
            }
            execution.token.cancel(CancellationToken.Reason.TIMEOUT);
            releaseLocked(execution);
            Optional<PipelineTask> current = taskRepository.findById(execution.task.id());
            if (current.isPresent() && execution.cancelRequested) {
                PipelineTask task = current.get();
                PipelineTask cancelled = transition(task, task.withCancelled(CANCELLED_BY_USER, clock.instant()));
                log.info("Task {} ({}) cancelled before its timeout of {}", task.id(), task.taskType(), describe(timeout));
                cascadeCancelLocked(cancelled);
                checkProjectFinishedLocked(task.projectId());
            } else if (current.isPresent()) {
                PipelineTask task = current.get();
                String message = "Stage " + task.taskType() + " timed out after " + describe(timeout);
                PipelineTask failed = transition(task, task.withFailed(message, null, clock.instant()));
                log.warn("Task {} of project {}: {}", task.id(), task.projectId(), message);
                cascadeCancelLocked(failed);
                checkProjectFinishedLocked(task.projectId());
            }
            dispatchLocked();
        } catch (RuntimeException e) {
            log.error("Error handling timeout of task {}", execution.task.id(), e);
        } finally {
            lock.unlock();
        }
        invokeCancelHook(execution.task);
    }

    // ========== Transitions ==========

    /**
     * Persist a changed task and publish its status. Caller holds the lock.
     */
    private PipelineTask transition(PipelineTask from, PipelineTask to) {
        if (from.status() != to.status() && !from.status().canTransitionTo(to.status())) {
            throw new InvalidStateTransitionException(from.id(), from.status(), to.status());
        }
        taskRepository.update(to);
        publishStatus(from.status(), to);
        return to;
    }

    private void publishStatus(TaskStatus previous, PipelineTask task) {
        eventBus.publishStatusChange(new TaskStatusEvent(
            task.id(), task.projectId(), task.taskType(), task.status(), task.error(), previous));
    }

    private PipelineTask cancelForDependency(PipelineTask dependent, PipelineTask predecessor) {
        String reason = "Dependency failed: " + predecessor.taskType();
        log.info("Cancelling task {} ({}): {}", dependent.id(), dependent.taskType(), reason);
        return transition(dependent, dependent.withCancelled(reason, clock.instant()));
    }

    /**
     * Cancel every pending task transitively depending on a failed or cancelled task.
     */
    private void cascadeCancelLocked(PipelineTask origin) {
        Deque<PipelineTask> queue = new ArrayDeque<>();
        queue.add(origin);
        while (!queue.isEmpty()) {
            PipelineTask predecessor = queue.poll();
            for (PipelineTask dependent : taskRepository.findDependents(predecessor.id())) {
                if (dependent.status() == TaskStatus.PENDING) {
                    queue.add(cancelForDependency(dependent, predecessor));
                }
            }
        }
    }

    private void checkProjectFinishedLocked(String projectId) {
        List<PipelineTask> tasks = latestPerStage(taskRepository.findByProject(projectId));
        if (tasks.isEmpty() || !tasks.stream().allMatch(t -> t.status().isTerminal())) {
            return;
        }
        ProjectFinishedEvent event = new ProjectFinishedEvent(projectId, ProgressAggregator.aggregateStatus(tasks));
        log.info("Project {} finished: {}", projectId, event.status());
        eventBus.publishProjectFinished(event);
    }

    private void releaseLocked(ActiveExecution execution) {
        if (active.remove(execution.task.id(), execution)) {
            if (execution.timeoutFuture != null) {
                execution.timeoutFuture.cancel(false);
            }
            budgetManager.release(execution.task.taskType(), execution.task.projectId());
            if (active.isEmpty()) {
                drained.signalAll();
            }
        }
    }

    private boolean isCurrent(ActiveExecution execution) {
        return active.get(execution.task.id()) == execution;
    }

    private void invokeCancelHook(PipelineTask task) {
        executors.find(task.taskType()).ifPresent(executor -> {
            try {
                executor.cancel(task);
            } catch (RuntimeException e) {
                log.warn("Cancel hook of {} executor failed for task {}: {}", task.taskType(), task.id(), e.getMessage());
            }
        });
    }

    // ========== Helpers ==========

    /**
     * A regenerated project keeps its earlier task groups; only the newest task of each stage counts.
     */
    private static List<PipelineTask> latestPerStage(List<PipelineTask> tasks) {
        Map<TaskType, PipelineTask> latest = new EnumMap<>(TaskType.class);
        for (PipelineTask task : tasks) {
            latest.merge(task.taskType(), task,
                (a, b) -> b.createdAt().isAfter(a.createdAt()) ? b : a);
        }
        return List.copyOf(latest.values());
    }

    private static String describe(Duration timeout) {
        return timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
    }

    private static String stackTrace(Throwable e) {
        StringWriter sw = new StringWriter();
        e.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A running execution. Identity marks it current: results from a replaced or
     * released execution are ignored.
     */
    private static final class ActiveExecution {
        private final PipelineTask task;
        private final CancellationToken token = new CancellationToken();
        private ScheduledFuture<?> timeoutFuture;
        private boolean cancelRequested;

        ActiveExecution(PipelineTask task) {
            this.task = task;
        }
    }
}
