package com.pipeline.engine.recovery;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.engine.persistence.InMemoryTaskRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OrphanedTaskRecoveryTest {

    @Test
    @DisplayName("Tasks left processing go back to pending with progress cleared")
    void testProcessingTasksGoBackToPending() {
        InMemoryTaskRepository repository = new InMemoryTaskRepository();
        Instant now = Instant.now();
        PipelineTask orphan = PipelineTask.create("p1", TaskType.AUDIO, 0, null, 0, now).withProcessing(now);
        PipelineTask waiting = PipelineTask.create("p1", TaskType.SUBTITLES, 1, orphan.id(), 1, now);
        repository.saveAll(List.of(orphan, waiting));

        int recovered = new OrphanedTaskRecovery(repository).recover();

        assertThat(recovered).isEqualTo(1);
        assertThat(repository.countByStatus(TaskStatus.PROCESSING)).isZero();
        assertThat(repository.countByStatus(TaskStatus.PENDING)).isEqualTo(2);
    }
}
