package com.pipeline.api.rest;

import com.pipeline.api.rest.QueueController.TaskResponse;
import com.pipeline.core.exception.StageValidationException;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProjectProgress;
import com.pipeline.core.model.ProjectStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.engine.service.PipelineQueueService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for project-level generation and progress.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final PipelineQueueService queueService;

    public ProjectController(PipelineQueueService queueService) {
        this.queueService = queueService;
    }

    /**
     * Queue the project's stages. Without a body the project's enabled stages are used.
     */
    @PostMapping("/{projectId}/generate")
    public ResponseEntity<List<TaskResponse>> generate(
            @PathVariable String projectId,
            @RequestBody(required = false) GenerateRequest request) {

        List<PipelineTask> tasks = request == null || request.stages() == null
            ? queueService.generate(projectId)
            : queueService.generate(projectId, parseStages(request.stages()));

        return ResponseEntity.status(HttpStatus.CREATED)
            .body(TaskResponse.fromAll(tasks));
    }

    @GetMapping("/{projectId}/progress")
    public ResponseEntity<ProgressResponse> getProgress(@PathVariable String projectId) {
        return ResponseEntity.ok(ProgressResponse.from(queueService.projectProgress(projectId)));
    }

    @GetMapping("/{projectId}/tasks")
    public ResponseEntity<List<TaskResponse>> listTasks(@PathVariable String projectId) {
        return ResponseEntity.ok(TaskResponse.fromAll(queueService.listProjectTasks(projectId)));
    }

    /**
     * Remove every task of the project, stopping running ones.
     */
    @DeleteMapping("/{projectId}/tasks")
    public ResponseEntity<Map<String, Object>> deleteTasks(@PathVariable String projectId) {
        int deleted = queueService.deleteProject(projectId);
        return ResponseEntity.ok(Map.of("deleted", deleted));
    }

    private static Set<TaskType> parseStages(List<String> names) {
        if (names.isEmpty()) {
            throw new StageValidationException("stages", "at least one stage must be requested");
        }
        Set<TaskType> stages = EnumSet.noneOf(TaskType.class);
        for (String name : names) {
            stages.add(TaskType.fromWireName(name));
        }
        return stages;
    }

    // ========== DTOs ==========

    public record GenerateRequest(List<String> stages) {}

    public record ProgressResponse(
        String projectId,
        Map<String, Integer> stages,
        int overall,
        ProjectStatus status
    ) {
        public static ProgressResponse from(ProjectProgress progress) {
            return new ProgressResponse(
                progress.projectId(),
                QueueController.byWireName(progress.stageProgress()),
                progress.overall(),
                progress.status()
            );
        }
    }
}
