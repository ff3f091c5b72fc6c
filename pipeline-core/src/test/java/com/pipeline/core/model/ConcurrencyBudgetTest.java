package com.pipeline.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyBudgetTest {

    @Test
    void defaults_shouldMatchStockCeilings() {
        ConcurrencyBudget budget = ConcurrencyBudget.defaults();

        assertEquals(3, budget.maxProjects());
        for (TaskType type : TaskType.values()) {
            assertEquals(2, budget.stageLimit(type));
        }
        assertEquals(4, budget.workerLimit(TaskType.IMAGES));
        assertEquals(3, budget.workerLimit(TaskType.PROMPTS));
        assertEquals(1, budget.workerLimit(TaskType.AUDIO));
        assertTrue(budget.timeout(TaskType.AUDIO).isEmpty());
    }

    @Test
    void builder_shouldOverrideIndividualStages() {
        ConcurrencyBudget budget = ConcurrencyBudget.builder()
            .maxProjects(1)
            .maxPerStage(TaskType.IMAGES, 1)
            .stageTimeout(TaskType.AUDIO, Duration.ofMinutes(10))
            .build();

        assertEquals(1, budget.maxProjects());
        assertEquals(1, budget.stageLimit(TaskType.IMAGES));
        assertEquals(2, budget.stageLimit(TaskType.PROMPTS));
        assertEquals(Duration.ofMinutes(10), budget.timeout(TaskType.AUDIO).orElseThrow());
        assertEquals(4, budget.effectiveStageLimits().size());
    }

    @Test
    void constructor_withNonPositiveLimits_shouldThrow() {
        assertThrows(IllegalArgumentException.class,
            () -> ConcurrencyBudget.builder().maxProjects(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> ConcurrencyBudget.builder().maxPerStage(TaskType.AUDIO, 0).build());
        assertThrows(IllegalArgumentException.class,
            () -> ConcurrencyBudget.builder().maxWorkers(TaskType.IMAGES, -1).build());
        assertThrows(IllegalArgumentException.class,
            () -> ConcurrencyBudget.builder().stageTimeout(TaskType.IMAGES, Duration.ZERO).build());
    }

    @Test
    void limits_shouldBeImmutable() {
        ConcurrencyBudget budget = ConcurrencyBudget.defaults();

        assertThrows(UnsupportedOperationException.class,
            () -> budget.maxPerStage().put(TaskType.AUDIO, 9));
        assertThrows(UnsupportedOperationException.class,
            () -> budget.maxWorkers().putAll(Map.of(TaskType.AUDIO, 9)));
    }
}
