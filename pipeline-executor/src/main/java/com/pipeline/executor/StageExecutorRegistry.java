package com.pipeline.executor;

import com.pipeline.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Stage executors keyed by the stage they handle. At most one executor per stage.
 */
public class StageExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageExecutorRegistry.class);

    private final Map<TaskType, StageExecutor> executors = new EnumMap<>(TaskType.class);

    public StageExecutorRegistry() {
    }

    public StageExecutorRegistry(Collection<? extends StageExecutor> executors) {
        executors.forEach(this::register);
    }

    /**
     * Register an executor, replacing any executor previously registered for its stage.
     */
    public synchronized void register(StageExecutor executor) {
        StageExecutor previous = executors.put(executor.type(), executor);
        if (previous != null && previous != executor) {
            log.warn("Replaced executor for stage {}: {} -> {}",
                executor.type(), previous.getClass().getSimpleName(), executor.getClass().getSimpleName());
        } else {
            log.info("Registered executor for stage {}: {}", executor.type(), executor.getClass().getSimpleName());
        }
    }

    public synchronized Optional<StageExecutor> find(TaskType type) {
        return Optional.ofNullable(executors.get(type));
    }

    public synchronized Set<TaskType> registeredStages() {
        return Set.copyOf(executors.keySet());
    }
}
