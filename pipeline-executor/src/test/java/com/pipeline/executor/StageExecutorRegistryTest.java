package com.pipeline.executor;

import com.pipeline.core.model.TaskType;
import com.pipeline.executor.simulated.SimulatedStageExecutor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StageExecutorRegistryTest {

    @Test
    @DisplayName("Executors are found by stage")
    void testFindExecutorByStage() {
        StageExecutorRegistry registry = new StageExecutorRegistry(
            SimulatedStageExecutor.forAllStages(Duration.ZERO));

        assertThat(registry.registeredStages()).containsExactlyInAnyOrder(TaskType.values());
        assertThat(registry.find(TaskType.AUDIO)).get()
            .extracting(StageExecutor::type).isEqualTo(TaskType.AUDIO);
    }

    @Test
    @DisplayName("A later registration replaces the earlier one")
    void testLaterRegistrationReplacesEarlier() {
        StageExecutorRegistry registry = new StageExecutorRegistry();
        StageExecutor first = new SimulatedStageExecutor(TaskType.IMAGES, 1, Duration.ZERO);
        StageExecutor second = new SimulatedStageExecutor(TaskType.IMAGES, 2, Duration.ZERO);

        registry.register(first);
        registry.register(second);

        assertThat(registry.find(TaskType.IMAGES)).containsSame(second);
        assertThat(registry.find(TaskType.PROMPTS)).isEmpty();
    }
}
