package com.pipeline.api.rest;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.QueueStats;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.engine.service.PipelineQueueService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST API for the task queue.
 */
@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private final PipelineQueueService queueService;

    public QueueController(PipelineQueueService queueService) {
        this.queueService = queueService;
    }

    /**
     * List every task in dispatch order.
     */
    @GetMapping("/tasks")
    public ResponseEntity<List<TaskResponse>> listTasks() {
        return ResponseEntity.ok(TaskResponse.fromAll(queueService.listTasks()));
    }

    @GetMapping("/tasks/{taskId}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(TaskResponse.from(queueService.getTask(taskId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(StatsResponse.from(queueService.getStats()));
    }

    @GetMapping("/paused")
    public ResponseEntity<Map<String, Object>> getPaused() {
        return ResponseEntity.ok(Map.of("paused", queueService.getPaused()));
    }

    /**
     * Stop admitting new tasks. Running tasks finish.
     */
    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause() {
        queueService.pause();
        return ResponseEntity.ok(Map.of("paused", true));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        queueService.resume();
        return ResponseEntity.ok(Map.of("paused", false));
    }

    /**
     * Cancel a pending or processing task. A processing task turns cancelled
     * once its executor returns.
     */
    @PostMapping("/tasks/{taskId}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTask(@PathVariable String taskId) {
        queueService.cancelTask(taskId);
        return ResponseEntity.ok(Map.of("cancelled", true));
    }

    /**
     * Put a failed task back to pending.
     */
    @PostMapping("/tasks/{taskId}/retry")
    public ResponseEntity<Map<String, Object>> retryTask(@PathVariable String taskId) {
        queueService.retryTask(taskId);
        return ResponseEntity.ok(Map.of("retried", true));
    }

    @PutMapping("/tasks/{taskId}/priority")
    public ResponseEntity<Map<String, Object>> reorderTask(
            @PathVariable String taskId,
            @RequestBody PriorityRequest request) {

        PipelineTask task = queueService.reorderTask(taskId, request.priority());
        return ResponseEntity.ok(Map.of(
            "reordered", true,
            "priority", task.priority()
        ));
    }

    // ========== DTOs ==========

    public record PriorityRequest(int priority) {}

    public record TaskResponse(
        String id,
        String projectId,
        TaskType taskType,
        TaskStatus status,
        int priority,
        int progress,
        ProgressDetails progressDetails,
        int attempts,
        int maxAttempts,
        String dependsOnTaskId,
        int stageGroup,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String error
    ) {
        public static TaskResponse from(PipelineTask task) {
            return new TaskResponse(
                task.id(),
                task.projectId(),
                task.taskType(),
                task.status(),
                task.priority(),
                task.progress(),
                task.progressDetails(),
                task.attempts(),
                task.maxAttempts(),
                task.dependsOnTaskId(),
                task.stageGroup(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.error()
            );
        }

        public static List<TaskResponse> fromAll(List<PipelineTask> tasks) {
            return tasks.stream().map(TaskResponse::from).toList();
        }
    }

    public record StatsResponse(
        long pending,
        long processing,
        long completedLast24h,
        long failedLast24h,
        long total,
        int activeWorkers,
        int activeProjects,
        Map<String, Integer> stageWorkers,
        int maxProjects,
        Map<String, Integer> maxPerStage
    ) {
        public static StatsResponse from(QueueStats stats) {
            return new StatsResponse(
                stats.pending(),
                stats.processing(),
                stats.completedLast24h(),
                stats.failedLast24h(),
                stats.total(),
                stats.activeWorkers(),
                stats.activeProjects(),
                byWireName(stats.stageWorkers()),
                stats.maxProjects(),
                byWireName(stats.maxPerStage())
            );
        }
    }

    static Map<String, Integer> byWireName(Map<TaskType, Integer> values) {
        Map<String, Integer> result = new LinkedHashMap<>();
        for (TaskType type : TaskType.values()) {
            if (values.containsKey(type)) {
                result.put(type.wireName(), values.get(type));
            }
        }
        return result;
    }
}
