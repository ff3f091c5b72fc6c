package com.pipeline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import org.junit.jupiter.api.*;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Task store against a real PostgreSQL. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcTaskRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("pipeline_test")
        .withUsername("test")
        .withPassword("test");

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private JdbcTemplate jdbcTemplate;
    private JdbcTaskRepository repository;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM pipeline_tasks");
        repository = new JdbcTaskRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    @DisplayName("Saved task group reads back with dependency links")
    void testSaveAndFind() {
        PipelineTask prompts = PipelineTask.create("p1", TaskType.PROMPTS, 0, null, 0, T0);
        PipelineTask images = PipelineTask.create("p1", TaskType.IMAGES, 1, prompts.id(), 1, T0);

        repository.saveAll(List.of(prompts, images));

        PipelineTask loaded = repository.findById(images.id()).orElseThrow();
        assertThat(loaded.projectId()).isEqualTo("p1");
        assertThat(loaded.taskType()).isEqualTo(TaskType.IMAGES);
        assertThat(loaded.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(loaded.dependsOnTaskId()).isEqualTo(prompts.id());
        assertThat(loaded.stageGroup()).isEqualTo(1);
        assertThat(loaded.maxAttempts()).isEqualTo(PipelineTask.DEFAULT_MAX_ATTEMPTS);
        assertThat(loaded.createdAt()).isEqualTo(T0);

        assertThat(repository.findByProject("p1")).extracting(PipelineTask::taskType)
            .containsExactly(TaskType.PROMPTS, TaskType.IMAGES);
        assertThat(repository.findDependents(prompts.id())).extracting(PipelineTask::id).containsExactly(images.id());
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    @DisplayName("Progress details survive as JSON")
    void testProgressDetailsRoundTrip() {
        PipelineTask task = PipelineTask.create("p1", TaskType.IMAGES, 0, null, 0, T0);
        repository.saveAll(List.of(task));

        ProgressDetails details = ProgressDetails.ofCounts(3, 12).withFailed(1).withWorkers(2, 4);
        Instant started = T0.plusSeconds(1);
        repository.update(task.withProcessing(started).withProgress(25, details));

        PipelineTask loaded = repository.findById(task.id()).orElseThrow();
        assertThat(loaded.status()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(loaded.attempts()).isEqualTo(1);
        assertThat(loaded.progress()).isEqualTo(25);
        assertThat(loaded.progressDetails()).isEqualTo(details);
        assertThat(loaded.startedAt()).isEqualTo(started);
    }

    @Test
    @DisplayName("Status queries honour dispatch order and the stats window")
    void testStatusQueries() {
        PipelineTask second = PipelineTask.create("p1", TaskType.AUDIO, 0, null, 0, T0.plusSeconds(5));
        PipelineTask first = PipelineTask.create("p2", TaskType.AUDIO, 0, null, 0, T0);
        PipelineTask done = PipelineTask.create("p3", TaskType.AUDIO, 0, null, 0, T0)
            .withProcessing(T0).withCompleted(T0.plus(Duration.ofHours(2)));
        PipelineTask failed = PipelineTask.create("p4", TaskType.AUDIO, 0, null, 0, T0)
            .withProcessing(T0).withFailed("boom", "trace", T0.plus(Duration.ofMinutes(1)));
        repository.saveAll(List.of(second, first, done, failed));

        assertThat(repository.findByStatus(TaskStatus.PENDING)).extracting(PipelineTask::id)
            .containsExactly(first.id(), second.id());
        assertThat(repository.countByStatus(TaskStatus.PENDING)).isEqualTo(2);
        assertThat(repository.count()).isEqualTo(4);
        assertThat(repository.countFinishedSince(TaskStatus.COMPLETED, T0.plus(Duration.ofHours(1)))).isEqualTo(1);
        assertThat(repository.countFinishedSince(TaskStatus.FAILED, T0.plus(Duration.ofHours(1)))).isZero();
        assertThat(repository.findAll()).hasSize(4);

        PipelineTask loadedFailure = repository.findById(failed.id()).orElseThrow();
        assertThat(loadedFailure.error()).isEqualTo("boom");
        assertThat(loadedFailure.errorStack()).isEqualTo("trace");
    }

    @Test
    @DisplayName("Startup reset and project deletion")
    void testResetAndDelete() {
        PipelineTask running = PipelineTask.create("p1", TaskType.IMAGES, 0, null, 0, T0)
            .withProcessing(T0).withProgress(50, ProgressDetails.ofCounts(6, 12));
        PipelineTask other = PipelineTask.create("p2", TaskType.AUDIO, 0, null, 0, T0);
        repository.saveAll(List.of(running, other));

        assertThat(repository.resetProcessingToPending()).isEqualTo(1);
        PipelineTask reset = repository.findById(running.id()).orElseThrow();
        assertThat(reset.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(reset.progress()).isZero();
        assertThat(reset.progressDetails()).isNull();
        assertThat(reset.startedAt()).isNull();

        assertThat(repository.deleteByProject("p1")).isEqualTo(1);
        assertThat(repository.findByProject("p1")).isEmpty();
        assertThat(repository.findByProject("p2")).hasSize(1);
    }

    @Test
    @DisplayName("Priority changes are persisted")
    void testPriorityUpdate() {
        PipelineTask task = PipelineTask.create("p1", TaskType.AUDIO, 0, null, 0, T0.truncatedTo(ChronoUnit.MILLIS));
        repository.saveAll(List.of(task));

        repository.update(task.withPriority(42));

        assertThat(repository.findById(task.id()).orElseThrow().priority()).isEqualTo(42);
    }
}
