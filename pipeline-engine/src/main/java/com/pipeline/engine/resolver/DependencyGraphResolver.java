package com.pipeline.engine.resolver;

import com.pipeline.core.exception.StageValidationException;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.StageGraph;
import com.pipeline.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a project's requested stages into its task group.
 *
 * Each task depends on the task of the nearest requested ancestor stage in the
 * {@link StageGraph}; stages with no requested ancestor are roots of group 0.
 * A task's stage group is its predecessor's group plus one, and its priority
 * defaults to its stage group so earlier stages dispatch first.
 */
public class DependencyGraphResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphResolver.class);

    private final StageGraph stageGraph;
    private final Clock clock;

    public DependencyGraphResolver(StageGraph stageGraph, Clock clock) {
        this.stageGraph = stageGraph;
        this.clock = clock;
    }

    /**
     * Create the tasks for a project, in dependency order. Nothing is persisted.
     *
     * @throws StageValidationException if no stage is requested or a stage's requirement is missing
     */
    public List<PipelineTask> resolve(String projectId, Collection<TaskType> stages) {
        if (projectId == null || projectId.isBlank()) {
            throw new StageValidationException("projectId", "must not be blank");
        }
        if (stages == null || stages.isEmpty()) {
            throw new StageValidationException("stages", "at least one stage must be requested");
        }

        Set<TaskType> requested = EnumSet.copyOf(stages);
        validateRequirements(requested);

        Instant now = clock.instant();
        Map<TaskType, PipelineTask> created = new EnumMap<>(TaskType.class);
        List<PipelineTask> tasks = new ArrayList<>(requested.size());

        for (TaskType stage : stageGraph.topologicalOrder(requested)) {
            PipelineTask predecessor = stageGraph.nearestRequestedAncestor(stage, requested)
                .map(created::get)
                .orElse(null);

            int stageGroup = predecessor == null ? 0 : predecessor.stageGroup() + 1;
            PipelineTask task = PipelineTask.create(
                projectId,
                stage,
                stageGroup,
                predecessor == null ? null : predecessor.id(),
                stageGroup,
                now
            );
            created.put(stage, task);
            tasks.add(task);
        }

        log.debug("Resolved {} task(s) for project {}: {}", tasks.size(), projectId,
            tasks.stream().map(PipelineTask::taskType).toList());
        return tasks;
    }

    private void validateRequirements(Set<TaskType> requested) {
        for (TaskType stage : requested) {
            for (TaskType required : stageGraph.requirementsOf(stage)) {
                if (!requested.contains(required)) {
                    throw new StageValidationException("stages",
                        "stage '" + stage + "' requires '" + required + "'");
                }
            }
        }
    }

    public StageGraph getStageGraph() {
        return stageGraph;
    }
}
