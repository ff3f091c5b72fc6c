package com.pipeline.executor.simulated;

import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskType;
import com.pipeline.executor.CancellationToken;
import com.pipeline.executor.StageContext;
import com.pipeline.executor.StageExecutionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulatedStageExecutorTest {

    private final List<ProgressDetails> reports = new CopyOnWriteArrayList<>();

    private StageContext context(TaskType type, int maxWorkers, CancellationToken token) {
        PipelineTask task = PipelineTask.create("proj", type, 0, null, 0, Instant.now())
            .withProcessing(Instant.now());
        return new StageContext(task, maxWorkers, reports::add, token);
    }

    @Test
    @DisplayName("Prompts report batch progress with the fan-out failure count")
    void testPromptsReportBatches() throws Exception {
        new SimulatedStageExecutor(TaskType.PROMPTS, 10, Duration.ZERO)
            .execute(context(TaskType.PROMPTS, 3, new CancellationToken()));

        ProgressDetails last = reports.get(reports.size() - 1);
        assertThat(last.completed()).isEqualTo(10);
        assertThat(last.total()).isEqualTo(10);
        assertThat(last.currentBatch()).isEqualTo(3);
        assertThat(last.batchCount()).isEqualTo(3);
        assertThat(last.maxWorkers()).isEqualTo(3);
        assertThat(reports).allSatisfy(report -> assertThat(report.failed()).isZero());
    }

    @Test
    @DisplayName("Images report completed counts")
    void testImagesReportCounts() throws Exception {
        new SimulatedStageExecutor(TaskType.IMAGES, 6, Duration.ZERO)
            .execute(context(TaskType.IMAGES, 4, new CancellationToken()));

        ProgressDetails last = reports.get(reports.size() - 1);
        assertThat(last.completed()).isEqualTo(6);
        assertThat(last.total()).isEqualTo(6);
    }

    @Test
    @DisplayName("Audio reports percentage up to 100")
    void testAudioReportsPercentageUpToHundred() throws Exception {
        new SimulatedStageExecutor(TaskType.AUDIO, 4, Duration.ZERO)
            .execute(context(TaskType.AUDIO, 1, new CancellationToken()));

        assertThat(reports).extracting(ProgressDetails::percentage).containsExactly(25, 50, 75, 100);
    }

    @Test
    @DisplayName("A cancelled execution stops early")
    void testCancelledExecutionStopsEarly() {
        CancellationToken token = new CancellationToken();
        token.cancel(CancellationToken.Reason.USER);

        assertThatThrownBy(() -> new SimulatedStageExecutor(TaskType.SUBTITLES, 5, Duration.ofSeconds(10))
            .execute(context(TaskType.SUBTITLES, 1, token)))
            .isInstanceOf(StageExecutionException.class);
        assertThat(reports).isEmpty();
    }
}
