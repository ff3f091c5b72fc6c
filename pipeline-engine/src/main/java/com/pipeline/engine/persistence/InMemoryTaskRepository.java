package com.pipeline.engine.persistence;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.repository.TaskRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of TaskRepository.
 * Default store; tasks do not survive a restart.
 */
public class InMemoryTaskRepository implements TaskRepository {
    
    private static final Comparator<PipelineTask> DISPATCH_ORDER = Comparator
        .comparingInt(PipelineTask::priority)
        .thenComparing(PipelineTask::createdAt)
        .thenComparing(PipelineTask::id);
    
    private static final Comparator<PipelineTask> PROJECT_ORDER = Comparator
        .comparingInt(PipelineTask::stageGroup)
        .thenComparing(PipelineTask::createdAt)
        .thenComparing(PipelineTask::id);
    
    private final Map<String, PipelineTask> tasks = new ConcurrentHashMap<>();
    
    @Override
    public void saveAll(List<PipelineTask> newTasks) {
        for (PipelineTask task : newTasks) {
            tasks.put(task.id(), task);
        }
    }
    
    @Override
    public void update(PipelineTask task) {
        tasks.computeIfPresent(task.id(), (id, existing) -> task);
    }
    
    @Override
    public Optional<PipelineTask> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }
    
    @Override
    public List<PipelineTask> findAll() {
        return tasks.values().stream()
            .sorted(DISPATCH_ORDER)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<PipelineTask> findByProject(String projectId) {
        return tasks.values().stream()
            .filter(t -> t.projectId().equals(projectId))
            .sorted(PROJECT_ORDER)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<PipelineTask> findByStatus(TaskStatus status) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .sorted(DISPATCH_ORDER)
            .collect(Collectors.toList());
    }
    
    @Override
    public List<PipelineTask> findDependents(String taskId) {
        return tasks.values().stream()
            .filter(t -> Objects.equals(t.dependsOnTaskId(), taskId))
            .sorted(DISPATCH_ORDER)
            .collect(Collectors.toList());
    }
    
    @Override
    public long countByStatus(TaskStatus status) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .count();
    }
    
    @Override
    public long countFinishedSince(TaskStatus status, Instant since) {
        return tasks.values().stream()
            .filter(t -> t.status() == status)
            .filter(t -> t.completedAt() != null && t.completedAt().isAfter(since))
            .count();
    }
    
    @Override
    public long count() {
        return tasks.size();
    }
    
    @Override
    public int resetProcessingToPending() {
        int reset = 0;
        for (PipelineTask task : tasks.values()) {
            if (task.status() == TaskStatus.PROCESSING) {
                tasks.put(task.id(), task.withPending());
                reset++;
            }
        }
        return reset;
    }
    
    @Override
    public int deleteByProject(String projectId) {
        List<String> ids = tasks.values().stream()
            .filter(t -> t.projectId().equals(projectId))
            .map(PipelineTask::id)
            .toList();
        ids.forEach(tasks::remove);
        return ids.size();
    }
    
    /**
     * Clear all data. For testing.
     */
    public void clear() {
        tasks.clear();
    }
}
