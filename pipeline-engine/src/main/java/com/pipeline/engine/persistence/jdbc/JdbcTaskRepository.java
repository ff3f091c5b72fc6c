package com.pipeline.engine.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pipeline.core.model.PipelineTask;
import com.pipeline.core.model.ProgressDetails;
import com.pipeline.core.model.TaskStatus;
import com.pipeline.core.model.TaskType;
import com.pipeline.core.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Relational implementation of TaskRepository over the {@code pipeline_tasks} table.
 * progress_details is stored as a JSON document.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final String DISPATCH_ORDER = " ORDER BY priority ASC, created_at ASC, id ASC";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final PipelineTaskRowMapper rowMapper;

    public JdbcTaskRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = new PipelineTaskRowMapper();
    }

    @Override
    @Transactional
    public void saveAll(List<PipelineTask> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        String sql = """
            INSERT INTO pipeline_tasks (
                id, project_id, task_type, status,
                priority, progress, progress_details,
                attempts, max_attempts,
                depends_on_task_id, stage_group,
                created_at, started_at, completed_at,
                error, error_stack
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.batchUpdate(sql, tasks, tasks.size(), (ps, task) -> {
            ps.setString(1, task.id());
            ps.setString(2, task.projectId());
            ps.setString(3, task.taskType().name());
            ps.setString(4, task.status().name());
            ps.setInt(5, task.priority());
            ps.setInt(6, task.progress());
            ps.setString(7, toJson(task.progressDetails()));
            ps.setInt(8, task.attempts());
            ps.setInt(9, task.maxAttempts());
            ps.setString(10, task.dependsOnTaskId());
            ps.setInt(11, task.stageGroup());
            ps.setTimestamp(12, toTimestamp(task.createdAt()));
            ps.setTimestamp(13, toTimestamp(task.startedAt()));
            ps.setTimestamp(14, toTimestamp(task.completedAt()));
            ps.setString(15, task.error());
            ps.setString(16, task.errorStack());
        });
        log.debug("Inserted {} task(s)", tasks.size());
    }

    @Override
    @Transactional
    public void update(PipelineTask task) {
        String sql = """
            UPDATE pipeline_tasks SET
                status = ?,
                priority = ?,
                progress = ?,
                progress_details = ?,
                attempts = ?,
                started_at = ?,
                completed_at = ?,
                error = ?,
                error_stack = ?
            WHERE id = ?
            """;

        int rows = jdbcTemplate.update(sql,
            task.status().name(),
            task.priority(),
            task.progress(),
            toJson(task.progressDetails()),
            task.attempts(),
            toTimestamp(task.startedAt()),
            toTimestamp(task.completedAt()),
            task.error(),
            task.errorStack(),
            task.id()
        );

        if (rows == 0) {
            log.debug("Task {} no longer exists, update skipped", task.id());
        }
    }

    @Override
    public Optional<PipelineTask> findById(String taskId) {
        String sql = "SELECT * FROM pipeline_tasks WHERE id = ?";
        List<PipelineTask> results = jdbcTemplate.query(sql, rowMapper, taskId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<PipelineTask> findAll() {
        return jdbcTemplate.query("SELECT * FROM pipeline_tasks" + DISPATCH_ORDER, rowMapper);
    }

    @Override
    public List<PipelineTask> findByProject(String projectId) {
        String sql = """
            SELECT * FROM pipeline_tasks
            WHERE project_id = ?
            ORDER BY stage_group ASC, created_at ASC, id ASC
            """;
        return jdbcTemplate.query(sql, rowMapper, projectId);
    }

    @Override
    public List<PipelineTask> findByStatus(TaskStatus status) {
        String sql = "SELECT * FROM pipeline_tasks WHERE status = ?" + DISPATCH_ORDER;
        return jdbcTemplate.query(sql, rowMapper, status.name());
    }

    @Override
    public List<PipelineTask> findDependents(String taskId) {
        String sql = "SELECT * FROM pipeline_tasks WHERE depends_on_task_id = ?" + DISPATCH_ORDER;
        return jdbcTemplate.query(sql, rowMapper, taskId);
    }

    @Override
    public long countByStatus(TaskStatus status) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM pipeline_tasks WHERE status = ?", Long.class, status.name());
        return count != null ? count : 0;
    }

    @Override
    public long countFinishedSince(TaskStatus status, Instant since) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM pipeline_tasks WHERE status = ? AND completed_at > ?",
            Long.class, status.name(), toTimestamp(since));
        return count != null ? count : 0;
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM pipeline_tasks", Long.class);
        return count != null ? count : 0;
    }

    @Override
    @Transactional
    public int resetProcessingToPending() {
        String sql = """
            UPDATE pipeline_tasks SET
                status = ?,
                progress = 0,
                progress_details = NULL,
                started_at = NULL,
                completed_at = NULL,
                error = NULL,
                error_stack = NULL
            WHERE status = ?
            """;
        return jdbcTemplate.update(sql, TaskStatus.PENDING.name(), TaskStatus.PROCESSING.name());
    }

    @Override
    @Transactional
    public int deleteByProject(String projectId) {
        return jdbcTemplate.update("DELETE FROM pipeline_tasks WHERE project_id = ?", projectId);
    }

    // ========== Helpers ==========

    private String toJson(ProgressDetails details) {
        if (details == null) return null;
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize progress details", e);
        }
    }

    private ProgressDetails parseDetails(String json) throws JsonProcessingException {
        if (json == null) return null;
        return objectMapper.readValue(json, ProgressDetails.class);
    }

    private Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private class PipelineTaskRowMapper implements RowMapper<PipelineTask> {
        @Override
        public PipelineTask mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new PipelineTask(
                    rs.getString("id"),
                    rs.getString("project_id"),
                    TaskType.valueOf(rs.getString("task_type")),
                    TaskStatus.valueOf(rs.getString("status")),
                    rs.getInt("priority"),
                    rs.getInt("progress"),
                    parseDetails(rs.getString("progress_details")),
                    rs.getInt("attempts"),
                    rs.getInt("max_attempts"),
                    rs.getString("depends_on_task_id"),
                    rs.getInt("stage_group"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    rs.getString("error"),
                    rs.getString("error_stack")
                );
            } catch (JsonProcessingException e) {
                throw new SQLException("Failed to map pipeline task row", e);
            }
        }
    }
}
