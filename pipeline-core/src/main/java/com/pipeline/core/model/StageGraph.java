package com.pipeline.core.model;

import com.pipeline.core.exception.StageValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordering edges between stages.
 *
 * predecessors maps a stage to the single stage whose output it consumes
 * (images consume prompts, subtitles consume audio). requirements lists stages that
 * must be requested together with a stage (subtitles cannot be requested without audio).
 *
 * Invariants:
 * - no stage is its own predecessor
 * - following predecessors from any stage terminates (no cycles)
 */
public record StageGraph(
    Map<TaskType, TaskType> predecessors,
    Map<TaskType, Set<TaskType>> requirements
) {
    public StageGraph {
        EnumMap<TaskType, TaskType> edges = new EnumMap<>(TaskType.class);
        if (predecessors != null) {
            edges.putAll(predecessors);
        }
        for (TaskType stage : edges.keySet()) {
            TaskType current = edges.get(stage);
            int steps = 0;
            while (current != null) {
                if (current == stage || ++steps > TaskType.values().length) {
                    throw new StageValidationException("dependencies",
                        "cycle detected at stage '" + stage + "'");
                }
                current = edges.get(current);
            }
        }

        EnumMap<TaskType, Set<TaskType>> required = new EnumMap<>(TaskType.class);
        if (requirements != null) {
            requirements.forEach((stage, needs) -> {
                EnumSet<TaskType> set = EnumSet.noneOf(TaskType.class);
                if (needs != null) {
                    set.addAll(needs);
                }
                if (set.contains(stage)) {
                    throw new StageValidationException("requires",
                        "stage '" + stage + "' cannot require itself");
                }
                required.put(stage, Collections.unmodifiableSet(set));
            });
        }

        predecessors = Collections.unmodifiableMap(edges);
        requirements = Collections.unmodifiableMap(required);
    }

    /**
     * prompts → images, audio → subtitles; subtitles require audio.
     */
    public static StageGraph defaults() {
        return new StageGraph(
            Map.of(TaskType.IMAGES, TaskType.PROMPTS, TaskType.SUBTITLES, TaskType.AUDIO),
            Map.of(TaskType.SUBTITLES, Set.of(TaskType.AUDIO))
        );
    }

    public Optional<TaskType> predecessorOf(TaskType stage) {
        return Optional.ofNullable(predecessors.get(stage));
    }

    public Set<TaskType> requirementsOf(TaskType stage) {
        return requirements.getOrDefault(stage, Set.of());
    }

    /**
     * Nearest ancestor of the stage that is part of the requested set, if any.
     * Stages skipped in the request are walked through.
     */
    public Optional<TaskType> nearestRequestedAncestor(TaskType stage, Set<TaskType> requested) {
        TaskType current = predecessors.get(stage);
        while (current != null) {
            if (requested.contains(current)) {
                return Optional.of(current);
            }
            current = predecessors.get(current);
        }
        return Optional.empty();
    }

    /**
     * Order stages so every stage follows its predecessors.
     */
    public List<TaskType> topologicalOrder(Collection<TaskType> stages) {
        return stages.stream()
            .distinct()
            .sorted(Comparator.comparingInt(this::depthOf).thenComparing(Enum::ordinal))
            .toList();
    }

    private int depthOf(TaskType stage) {
        int depth = 0;
        TaskType current = predecessors.get(stage);
        while (current != null) {
            depth++;
            current = predecessors.get(current);
        }
        return depth;
    }
}
